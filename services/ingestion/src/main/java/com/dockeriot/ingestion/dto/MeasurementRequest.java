package com.dockeriot.ingestion.dto;

import com.dockeriot.common.util.UtcInstantDeserializer;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Inbound measurement. Only client-settable fields; the id is always assigned by the store.
 *
 * Example JSON:
 * {
 *   "device_id": "esp32-1",
 *   "sensor": "temp",
 *   "value": 21.5,
 *   "ts": "2024-01-01T00:00:00Z"
 * }
 *
 * {@code ts} is optional and defaults to the insertion time; a value without offset is UTC.
 * Blank {@code device_id} or {@code sensor} values are rejected.
 */
public record MeasurementRequest(
    @NotBlank(message = "Device ID is required")
    @JsonProperty("device_id")
    String deviceId,

    @NotBlank(message = "Sensor is required")
    @JsonProperty("sensor")
    String sensor,

    @NotNull(message = "Value is required")
    @JsonProperty("value")
    Double value,

    @JsonProperty("ts")
    @JsonDeserialize(using = UtcInstantDeserializer.class)
    Instant timestamp
) {}

package com.dockeriot.ingestion.dto;

import com.dockeriot.ingestion.model.Measurement;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeasurementResponse {

    private Long id;

    @JsonProperty("device_id")
    private String deviceId;

    private String sensor;

    private Double value;

    @JsonProperty("ts")
    private Instant timestamp;

    public static MeasurementResponse fromEntity(Measurement measurement) {
        return MeasurementResponse.builder()
                .id(measurement.getId())
                .deviceId(measurement.getDeviceId())
                .sensor(measurement.getSensor())
                .value(measurement.getValue())
                .timestamp(measurement.getTimestamp())
                .build();
    }
}

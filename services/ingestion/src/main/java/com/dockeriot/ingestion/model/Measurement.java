package com.dockeriot.ingestion.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "measurement", indexes = {
    @Index(name = "ix_measurement_device_id", columnList = "device_id"),
    @Index(name = "ix_measurement_sensor", columnList = "sensor")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Measurement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "device_id", nullable = false)
    private String deviceId;

    @Column(name = "sensor", nullable = false)
    private String sensor;

    @Column(name = "sensor_value", nullable = false)
    private Double value;

    @Column(name = "ts", nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}

package com.dockeriot.ingestion.service;

import com.dockeriot.ingestion.dto.MeasurementRequest;
import com.dockeriot.ingestion.dto.MeasurementResponse;
import com.dockeriot.ingestion.model.Measurement;
import com.dockeriot.ingestion.repository.MeasurementRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stores and lists sensor measurements. Each call is one transaction and one statement;
 * store failures propagate unchanged to the caller.
 */
@Service
@Slf4j
public class MeasurementService {

    private final MeasurementRepository measurementRepository;
    private final EntityManager entityManager;
    private final Counter measurementsCreated;

    public MeasurementService(
            MeasurementRepository measurementRepository,
            EntityManager entityManager,
            MeterRegistry meterRegistry) {
        this.measurementRepository = measurementRepository;
        this.entityManager = entityManager;
        this.measurementsCreated = Counter.builder("ingestion.measurements.created")
                .description("Number of measurements persisted")
                .register(meterRegistry);
    }

    @Transactional
    public MeasurementResponse createMeasurement(MeasurementRequest request) {
        log.debug("Creating measurement: device={}, sensor={}", request.deviceId(), request.sensor());

        Measurement measurement = Measurement.builder()
                .deviceId(request.deviceId())
                .sensor(request.sensor())
                .value(request.value())
                .timestamp(request.timestamp())
                .build();

        Measurement saved = measurementRepository.saveAndFlush(measurement);
        // Re-read so the response carries exactly what the store holds.
        entityManager.refresh(saved);
        measurementsCreated.increment();

        log.info("Measurement created with ID: {}", saved.getId());
        return MeasurementResponse.fromEntity(saved);
    }

    @Transactional(readOnly = true)
    public List<MeasurementResponse> listMeasurements(int limit) {
        log.debug("Listing measurements with limit {}", limit);
        return measurementRepository.findAllByOrderByIdAsc(Limit.of(limit)).stream()
                .map(MeasurementResponse::fromEntity)
                .toList();
    }
}

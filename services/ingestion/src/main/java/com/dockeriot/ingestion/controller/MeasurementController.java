package com.dockeriot.ingestion.controller;

import com.dockeriot.ingestion.dto.MeasurementRequest;
import com.dockeriot.ingestion.dto.MeasurementResponse;
import com.dockeriot.ingestion.service.MeasurementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for sensor measurements.
 *
 * Endpoints:
 * - POST /measurements/ - Store a single measurement
 * - GET /measurements/?limit=N - List up to N measurements (1..1000, default 100)
 */
@RestController
@RequestMapping({"/measurements", "/measurements/"})
@RequiredArgsConstructor
@Validated
@Tag(name = "Measurements", description = "Ingest and list sensor measurements")
public class MeasurementController {

    private final MeasurementService measurementService;

    @PostMapping(
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Store a measurement", description = "Persists one measurement; ts defaults to the current UTC time")
    public ResponseEntity<MeasurementResponse> createMeasurement(@Valid @RequestBody MeasurementRequest request) {
        return ResponseEntity.ok(measurementService.createMeasurement(request));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List measurements", description = "Returns at most limit measurements in id order")
    public ResponseEntity<List<MeasurementResponse>> listMeasurements(
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(measurementService.listMeasurements(limit));
    }
}

package com.dockeriot.ingestion.controller;

import com.dockeriot.ingestion.dto.HeroRequest;
import com.dockeriot.ingestion.dto.HeroResponse;
import com.dockeriot.ingestion.service.HeroService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping({"/heroes", "/heroes/"})
@RequiredArgsConstructor
@Validated
@Tag(name = "Heroes", description = "Create and list heroes")
public class HeroController {

    private final HeroService heroService;

    @PostMapping
    @Operation(summary = "Create a hero")
    public ResponseEntity<HeroResponse> createHero(@Valid @RequestBody HeroRequest request) {
        return ResponseEntity.ok(heroService.createHero(request));
    }

    @GetMapping
    @Operation(summary = "List heroes")
    public ResponseEntity<List<HeroResponse>> listHeroes(
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(heroService.listHeroes(limit));
    }
}

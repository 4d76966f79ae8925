package com.dockeriot.ingestion.service;

import com.dockeriot.ingestion.dto.HeroRequest;
import com.dockeriot.ingestion.dto.HeroResponse;
import com.dockeriot.ingestion.model.Hero;
import com.dockeriot.ingestion.repository.HeroRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
public class HeroService {

    private final HeroRepository heroRepository;
    private final EntityManager entityManager;
    private final Counter heroesCreated;

    public HeroService(HeroRepository heroRepository, EntityManager entityManager, MeterRegistry meterRegistry) {
        this.heroRepository = heroRepository;
        this.entityManager = entityManager;
        this.heroesCreated = Counter.builder("ingestion.heroes.created")
                .description("Number of heroes persisted")
                .register(meterRegistry);
    }

    @Transactional
    public HeroResponse createHero(HeroRequest request) {
        log.info("Creating new hero: {}", request.getName());

        Hero hero = Hero.builder()
                .name(request.getName())
                .secretName(request.getSecretName())
                .age(request.getAge())
                .build();

        Hero saved = heroRepository.saveAndFlush(hero);
        entityManager.refresh(saved);
        heroesCreated.increment();

        log.info("Hero created with ID: {}", saved.getId());
        return HeroResponse.fromEntity(saved);
    }

    @Transactional(readOnly = true)
    public List<HeroResponse> listHeroes(int limit) {
        log.debug("Listing heroes with limit {}", limit);
        return heroRepository.findAllByOrderByIdAsc(Limit.of(limit)).stream()
                .map(HeroResponse::fromEntity)
                .toList();
    }
}

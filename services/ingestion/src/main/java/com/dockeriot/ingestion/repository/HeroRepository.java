package com.dockeriot.ingestion.repository;

import com.dockeriot.ingestion.model.Hero;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HeroRepository extends JpaRepository<Hero, Long> {

    List<Hero> findAllByOrderByIdAsc(Limit limit);
}

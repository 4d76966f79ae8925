package com.dockeriot.ingestion.repository;

import com.dockeriot.ingestion.model.Measurement;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MeasurementRepository extends JpaRepository<Measurement, Long> {

    List<Measurement> findAllByOrderByIdAsc(Limit limit);
}

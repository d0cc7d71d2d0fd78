package com.elssolution.hydromonitor.repository;

import com.elssolution.hydromonitor.entity.SensorReadingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface SensorReadingRepository extends JpaRepository<SensorReadingEntity, String> {

    Optional<SensorReadingEntity> findFirstByOrderByTimestampDesc();

    List<SensorReadingEntity> findAllByOrderByTimestampDesc(Pageable pageable);

    List<SensorReadingEntity> findByTimestampBetweenOrderByTimestampAsc(Instant start, Instant end);
}

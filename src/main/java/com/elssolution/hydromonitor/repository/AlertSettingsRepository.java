package com.elssolution.hydromonitor.repository;

import com.elssolution.hydromonitor.entity.AlertSettingsEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlertSettingsRepository extends JpaRepository<AlertSettingsEntity, Long> {
    Optional<AlertSettingsEntity> findFirstByOrderByIdAsc();
}

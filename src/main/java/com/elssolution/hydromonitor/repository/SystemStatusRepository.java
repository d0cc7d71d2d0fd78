package com.elssolution.hydromonitor.repository;

import com.elssolution.hydromonitor.entity.SystemStatusEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SystemStatusRepository extends JpaRepository<SystemStatusEntity, Long> {
    Optional<SystemStatusEntity> findFirstByOrderByIdAsc();
}

package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.ExternalCorrelation;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExternalCorrelationRepository extends org.springframework.data.jpa.repository.JpaRepository<ExternalCorrelation, String> {

    Optional<ExternalCorrelation> findByInstanceId(String instanceId);

    boolean existsByInstanceId(String instanceId);
}

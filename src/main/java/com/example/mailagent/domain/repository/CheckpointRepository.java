package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.Checkpoint;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CheckpointRepository extends org.springframework.data.jpa.repository.JpaRepository<Checkpoint, Long> {

    Optional<Checkpoint> findTopByInstanceIdOrderBySeqDesc(String instanceId);

    List<Checkpoint> findByInstanceIdOrderBySeqAsc(String instanceId);
}

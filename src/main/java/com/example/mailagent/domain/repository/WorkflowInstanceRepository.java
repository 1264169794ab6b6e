package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.model.WorkflowState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface WorkflowInstanceRepository extends org.springframework.data.jpa.repository.JpaRepository<WorkflowInstance, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select w from WorkflowInstance w where w.id = :id")
    Optional<WorkflowInstance> findForUpdate(@Param("id") String id);

    Optional<WorkflowInstance> findByItemRef(String itemRef);

    Optional<WorkflowInstance> findByCorrelationKey(String correlationKey);

    List<WorkflowInstance> findByUserId(String userId);

    List<WorkflowInstance> findByBlockedTrue();

    List<WorkflowInstance> findByBlockedFalseAndCurrentStateNotIn(Collection<WorkflowState> states);

    List<WorkflowInstance> findByBlockedFalseAndCurrentStateNotInAndUpdatedAtBefore(Collection<WorkflowState> states, LocalDateTime updatedBefore);
}

package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.ActionType;
import com.example.mailagent.domain.model.PendingAction;
import com.example.mailagent.domain.model.PendingActionStatus;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PendingActionRepository extends org.springframework.data.jpa.repository.JpaRepository<PendingAction, Long> {

    Optional<PendingAction> findByIdempotencyKey(String idempotencyKey);

    List<PendingAction> findByInstanceId(String instanceId);

    List<PendingAction> findByInstanceIdAndActionType(String instanceId, ActionType actionType);

    List<PendingAction> findByActionTypeAndStatusInAndAttemptsLessThan(ActionType actionType,
                                                                       Collection<PendingActionStatus> statuses,
                                                                       int attempts);
}

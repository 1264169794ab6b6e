package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.BatchQueueEntry;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BatchQueueRepository extends org.springframework.data.jpa.repository.JpaRepository<BatchQueueEntry, Long> {

    List<BatchQueueEntry> findByUserIdOrderByScheduledTimeAsc(String userId);

    Optional<BatchQueueEntry> findByInstanceId(String instanceId);

    @Query("select distinct b.userId from BatchQueueEntry b")
    List<String> findDistinctUserIds();
}

package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.ApprovalHistory;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ApprovalHistoryRepository extends org.springframework.data.jpa.repository.JpaRepository<ApprovalHistory, Long> {

    List<ApprovalHistory> findByInstanceId(String instanceId);
}

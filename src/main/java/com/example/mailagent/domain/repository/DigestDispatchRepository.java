package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.DigestDispatch;
import com.example.mailagent.domain.model.DigestStatus;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DigestDispatchRepository extends org.springframework.data.jpa.repository.JpaRepository<DigestDispatch, Long> {

    Optional<DigestDispatch> findByDigestKey(String digestKey);

    List<DigestDispatch> findByUserIdOrderByCreatedAtDesc(String userId);

    List<DigestDispatch> findByUserIdAndStatusOrderByCreatedAtAsc(String userId, DigestStatus status);
}

package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.NotificationPreferences;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface NotificationPreferencesRepository extends org.springframework.data.jpa.repository.JpaRepository<NotificationPreferences, Long> {

    Optional<NotificationPreferences> findByUserId(String userId);
}

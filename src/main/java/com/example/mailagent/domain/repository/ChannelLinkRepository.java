package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.ChannelLink;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChannelLinkRepository extends org.springframework.data.jpa.repository.JpaRepository<ChannelLink, Long> {

    Optional<ChannelLink> findByUserId(String userId);

    Optional<ChannelLink> findByMattermostUserId(String mattermostUserId);
}

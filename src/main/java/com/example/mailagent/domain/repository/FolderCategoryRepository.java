package com.example.mailagent.domain.repository;

import com.example.mailagent.domain.model.FolderCategory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FolderCategoryRepository extends org.springframework.data.jpa.repository.JpaRepository<FolderCategory, Long> {

    List<FolderCategory> findByUserIdOrderByNameAsc(String userId);

    Optional<FolderCategory> findByUserIdAndName(String userId, String name);
}

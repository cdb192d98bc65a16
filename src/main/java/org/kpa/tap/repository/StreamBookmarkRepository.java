package org.kpa.tap.repository;

import org.kpa.tap.models.entity.StreamBookmark;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface StreamBookmarkRepository extends JpaRepository<StreamBookmark, Long> {
    Optional<StreamBookmark> findByStreamName(String streamName);
}

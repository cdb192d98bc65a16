package org.kpa.tap.repository;

import org.kpa.tap.models.entity.SyncRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {
    Optional<SyncRun> findByRunUid(String runUid);

    List<SyncRun> findTop10ByOrderByStartedAtDesc();
}

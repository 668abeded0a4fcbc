package com.example.backupscheduler.domain.repository;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for BackupSchedule entity
 */
@Repository
public interface BackupScheduleRepository extends JpaRepository<BackupSchedule, UUID> {

    Optional<BackupSchedule> findByResourceId(String resourceId);

    boolean existsByResourceId(String resourceId);

    /**
     * Enabled schedules whose due marker has passed, oldest due first
     */
    @Query("""
            SELECT s FROM BackupSchedule s
            WHERE s.enabled = true
              AND s.nextTriggerAt IS NOT NULL
              AND s.nextTriggerAt <= :now
            ORDER BY s.nextTriggerAt ASC
            """)
    List<BackupSchedule> findDueSchedules(@Param("now") Instant now);

    List<BackupSchedule> findAllByOrderByResourceIdAsc();

    List<BackupSchedule> findByEnabledTrueOrderByResourceIdAsc();

    long countByEnabledTrue();
}

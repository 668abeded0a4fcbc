package com.example.backupscheduler.domain.repository;

import com.example.backupscheduler.domain.entity.ScheduleEvent;
import com.example.backupscheduler.domain.enums.ScheduleAction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for ScheduleEvent entity. Events are only ever inserted and read.
 */
@Repository
public interface ScheduleEventRepository extends JpaRepository<ScheduleEvent, Long> {

    /**
     * Event history of one resource, newest first, later inserts first within the same instant
     */
    Page<ScheduleEvent> findByResourceIdOrderByCreatedAtDescIdDesc(String resourceId, Pageable pageable);

    List<ScheduleEvent> findByResourceIdAndActionOrderByCreatedAtAscIdAsc(String resourceId, ScheduleAction action);
}

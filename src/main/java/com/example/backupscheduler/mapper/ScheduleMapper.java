package com.example.backupscheduler.mapper;

import com.example.backupscheduler.domain.entity.BackupSchedule;
import com.example.backupscheduler.domain.entity.ScheduleEvent;
import com.example.backupscheduler.dto.BackupScheduleResponse;
import com.example.backupscheduler.dto.ScheduleEventResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting schedule entities to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    BackupScheduleResponse toResponse(BackupSchedule schedule);

    List<BackupScheduleResponse> toResponseList(List<BackupSchedule> schedules);

    ScheduleEventResponse toEventResponse(ScheduleEvent event);
}

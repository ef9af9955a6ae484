package com.example.taskflow.mapper;

import com.example.taskflow.domain.model.ScheduledTask;
import com.example.taskflow.dto.ScheduledTaskResponse;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.time.Instant;

/**
 * MapStruct mapper for converting scheduled tasks to API responses
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TaskMapper {

    /**
     * Convert ScheduledTask to ScheduledTaskResponse.
     *
     * @param nextRunAt next due time of the backing job, null when paused
     */
    @Mapping(target = "nextRunAt", source = "nextRunAt")
    ScheduledTaskResponse toResponse(ScheduledTask task, Instant nextRunAt);
}

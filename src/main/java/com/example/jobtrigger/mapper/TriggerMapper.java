package com.example.jobtrigger.mapper;

import com.example.jobtrigger.domain.RegisteredTrigger;
import com.example.jobtrigger.domain.TriggerIdentity;
import com.example.jobtrigger.dto.SchedulingResponse;
import com.example.jobtrigger.dto.TriggerResponse;
import com.example.jobtrigger.service.SchedulingResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting scheduling results and live triggers to DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface TriggerMapper {

    /**
     * Convert RegisteredTrigger to TriggerResponse DTO
     */
    @Mapping(target = "name", source = "identity.name")
    @Mapping(target = "group", source = "identity.group")
    @Mapping(target = "jobName", source = "jobIdentity.name")
    @Mapping(target = "jobGroup", source = "jobIdentity.group")
    @Mapping(target = "triggerData", source = "data")
    TriggerResponse toResponse(RegisteredTrigger trigger);

    List<TriggerResponse> toResponseList(List<RegisteredTrigger> triggers);

    /**
     * Convert SchedulingResult to SchedulingResponse DTO
     */
    @Mapping(target = "jobName", source = "jobIdentity.name")
    @Mapping(target = "jobGroup", source = "jobIdentity.group")
    @Mapping(target = "source", source = "source.code")
    SchedulingResponse toResponse(SchedulingResult result);

    default String toTriggerName(TriggerIdentity identity) {
        return identity != null ? identity.getName() : null;
    }
}

package com.example.jobtrigger.controller;

import com.example.jobtrigger.dto.ApiResponse;
import com.example.jobtrigger.dto.ScheduleJobRequest;
import com.example.jobtrigger.dto.SchedulingResponse;
import com.example.jobtrigger.dto.TriggerResponse;
import com.example.jobtrigger.mapper.TriggerMapper;
import com.example.jobtrigger.service.JobSchedulingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for job trigger scheduling.
 * <p>
 * Provides endpoints for:
 * - Scheduling a job's configured triggers
 * - Listing the triggers the scheduler holds for a job
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Scheduling", description = "APIs for registering job triggers with the scheduler")
public class JobSchedulingController {

    private final JobSchedulingService jobSchedulingService;
    private final TriggerMapper triggerMapper;

    @PostMapping("/{jobName}")
    @Operation(summary = "Schedule a job", description = "Register the job's configured triggers that the scheduler does not hold yet")
    public ResponseEntity<ApiResponse<SchedulingResponse>> scheduleJob(
            @Parameter(description = "Job name") @PathVariable String jobName,
            @Valid @RequestBody(required = false) ScheduleJobRequest request) {
        var scheduleRequest = request != null ? request : new ScheduleJobRequest();
        scheduleRequest.setJobName(jobName);

        log.info("API: Schedule job {} in group {} (trigger: {})", jobName, scheduleRequest.getJobGroup(), scheduleRequest.getTriggerName());

        var result = jobSchedulingService.scheduleAndAwait(scheduleRequest);
        var response = triggerMapper.toResponse(result);
        var message = result.isSourceResolved()
                ? String.format("Registered %d trigger(s)", response.getRegisteredTriggers().size())
                : "No trigger source configured for job, nothing scheduled";

        return ResponseEntity.ok(ApiResponse.success(response, message));
    }

    @GetMapping("/{jobName}/triggers")
    @Operation(summary = "List job triggers", description = "Get the triggers currently registered for a job")
    public ResponseEntity<ApiResponse<List<TriggerResponse>>> getJobTriggers(
            @Parameter(description = "Job name") @PathVariable String jobName,
            @Parameter(description = "Job group") @RequestParam(required = false) String jobGroup) {

        var triggers = jobSchedulingService.getRegisteredTriggers(jobName, jobGroup);
        return ResponseEntity.ok(ApiResponse.success(triggerMapper.toResponseList(triggers)));
    }
}

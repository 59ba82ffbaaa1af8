package com.eyelevel.docpipeline.controller;

import com.eyelevel.docpipeline.dto.ApiResponse;
import com.eyelevel.docpipeline.dto.ExecutionDetailResponse;
import com.eyelevel.docpipeline.dto.StartExecutionRequest;
import com.eyelevel.docpipeline.model.DocumentRef;
import com.eyelevel.docpipeline.model.ExecutionId;
import com.eyelevel.docpipeline.model.ExecutionStatusView;
import com.eyelevel.docpipeline.orchestrator.PipelineOrchestrator;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for starting, inspecting and controlling pipeline executions.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/executions")
@RequiredArgsConstructor
@Validated
public class ExecutionController implements ExecutionApi {

    private final PipelineOrchestrator orchestrator;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<String>> startExecution(@Valid @RequestBody final StartExecutionRequest request) {
        final DocumentRef document = new DocumentRef(request.getContainer(), request.getKey());
        log.info("API request to start execution for {}", document);
        final ExecutionId executionId = orchestrator.start(document);
        return accepted(executionId.value(), "Execution accepted.");
    }

    @Override
    @GetMapping("/status")
    public ResponseEntity<ApiResponse<ExecutionStatusView>> getExecutionStatus(
            @RequestParam("container") @NotBlank(message = "The 'container' parameter cannot be empty.") final String container,
            @RequestParam("key") @NotBlank(message = "The 'key' parameter cannot be empty.") final String key) {
        final ExecutionStatusView status = orchestrator.getExecutionStatus(new DocumentRef(container, key));
        return ResponseEntity.ok(ApiResponse.success(status, "Execution status retrieved successfully."));
    }

    @Override
    @GetMapping("/{executionId}")
    public ResponseEntity<ApiResponse<ExecutionDetailResponse>> getExecution(
            @PathVariable("executionId") final String executionId) {
        final ExecutionDetailResponse details =
                ExecutionDetailResponse.from(orchestrator.describe(new ExecutionId(executionId)));
        return ResponseEntity.ok(ApiResponse.success(details, "Execution retrieved successfully."));
    }

    @Override
    @PostMapping("/{executionId}/cancel")
    public ResponseEntity<ApiResponse<ExecutionStatusView>> cancelExecution(
            @PathVariable("executionId") final String executionId) {
        log.info("API request to cancel execution {}", executionId);
        final ExecutionStatusView status = orchestrator.cancel(new ExecutionId(executionId));
        return ResponseEntity.ok(ApiResponse.success(status, "Cancellation requested."));
    }

    @Override
    @PostMapping("/{executionId}/resume")
    public ResponseEntity<ApiResponse<ExecutionStatusView>> resumeExecution(
            @PathVariable("executionId") final String executionId) {
        log.info("API request to resume execution {}", executionId);
        final ExecutionStatusView status = orchestrator.resume(new ExecutionId(executionId));
        return ResponseEntity.ok(ApiResponse.success(status, "Execution resumed."));
    }

    @Override
    @PostMapping("/{executionId}/replay")
    public ResponseEntity<ApiResponse<ExecutionStatusView>> replayExecution(
            @PathVariable("executionId") final String executionId) {
        log.warn("API request to REPLAY execution {}", executionId);
        final ExecutionId id = new ExecutionId(executionId);
        final DocumentRef document = orchestrator.describe(id).record().documentRef();
        orchestrator.replay(document);
        return accepted(orchestrator.getExecutionStatus(id), "Replay scheduled.");
    }

    @Override
    @PostMapping("/{executionId}/retry")
    public ResponseEntity<ApiResponse<ExecutionStatusView>> retryExecution(
            @PathVariable("executionId") final String executionId,
            @RequestParam("fromStage") @Min(value = 0, message = "The 'fromStage' index cannot be negative.") final int fromStage) {
        log.warn("API request to RETRY execution {} from stage {}", executionId, fromStage);
        final ExecutionStatusView status = orchestrator.retryFromStage(new ExecutionId(executionId), fromStage);
        return accepted(status, "Retry scheduled.");
    }

    private static <T> ResponseEntity<ApiResponse<T>> accepted(final T data, final String message) {
        final ApiResponse<T> response = ApiResponse.<T>builder()
                .response(data)
                .displayMessage(message)
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}

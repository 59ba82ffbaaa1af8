package com.eyelevel.docpipeline.controller;

import com.eyelevel.docpipeline.dto.ApiResponse;
import com.eyelevel.docpipeline.dto.ExecutionDetailResponse;
import com.eyelevel.docpipeline.dto.StartExecutionRequest;
import com.eyelevel.docpipeline.model.ExecutionStatusView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

@Tag(name = "Pipeline Executions", description = "Endpoints for starting, inspecting and controlling document pipeline executions.")
public interface ExecutionApi {

    @Operation(summary = "Start Execution",
            description = "Starts the pipeline for a document. Idempotent: repeated calls for the same document return the same execution ID and never start a second run.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Execution created or joined.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Execution accepted.",
                                        "response": "3f1a9c0e5b...",
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing container or key.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<String>> startExecution(@Valid @RequestBody StartExecutionRequest request);

    @Operation(summary = "Get Execution Status",
            description = "Returns status, current stage, attempt count and last error of the execution of a document.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Status retrieved.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Failed execution", value = """
                                    {
                                        "displayMessage": "Execution status retrieved successfully.",
                                        "response": {
                                            "executionId": "3f1a9c0e5b...",
                                            "status": "FAILED",
                                            "currentStage": "analyze-text",
                                            "currentStageIndex": 2,
                                            "attempt": 3,
                                            "lastError": "Stage 'analyze-text' failed on attempt 3: Sentiment detection unavailable",
                                            "suspended": false
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "No execution exists for the document.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ExecutionStatusView>> getExecutionStatus(
            @Parameter(description = "Bucket holding the document.", required = true, example = "docs")
            @RequestParam("container") String container,
            @Parameter(description = "Object key of the document.", required = true, example = "a.pdf")
            @RequestParam("key") String key);

    @Operation(summary = "Get Execution Details",
            description = "Returns the full execution record, including the accumulated payload and the audit trail of replays and retries.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Execution retrieved."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Execution not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<ExecutionDetailResponse>> getExecution(
            @Parameter(description = "The execution ID.", required = true) @PathVariable("executionId") String executionId);

    @Operation(summary = "Cancel Execution",
            description = "Stops an unfinished execution at its next stage boundary or retry wait. The execution stays at its last checkpoint and can be resumed.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cancellation recorded or signalled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Execution not found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Execution already finished.")
    })
    ResponseEntity<ApiResponse<ExecutionStatusView>> cancelExecution(
            @Parameter(description = "The execution ID.", required = true) @PathVariable("executionId") String executionId);

    @Operation(summary = "Resume Execution",
            description = "Schedules an unfinished execution again from its last checkpoint, lifting a previous cancellation.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Execution scheduled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Execution not found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Execution already finished.")
    })
    ResponseEntity<ApiResponse<ExecutionStatusView>> resumeExecution(
            @Parameter(description = "The execution ID.", required = true) @PathVariable("executionId") String executionId);

    @Operation(summary = "Replay Execution",
            description = "**Caution:** Reprocesses a finished document from the first stage, starting from the original trigger payload. Recorded in the audit trail.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Replay scheduled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Execution not found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Execution has not finished.")
    })
    ResponseEntity<ApiResponse<ExecutionStatusView>> replayExecution(
            @Parameter(description = "The execution ID.", required = true) @PathVariable("executionId") String executionId);

    @Operation(summary = "Retry Execution From Stage",
            description = "**Caution:** Reruns a finished execution from the given stage index, keeping the output of earlier stages. Recorded in the audit trail.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Retry scheduled."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Execution not found."),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Execution has not finished or the stage index is out of range.")
    })
    ResponseEntity<ApiResponse<ExecutionStatusView>> retryExecution(
            @Parameter(description = "The execution ID.", required = true) @PathVariable("executionId") String executionId,
            @Parameter(description = "Zero-based index of the stage to rerun from.", required = true, example = "2")
            @RequestParam("fromStage") int fromStage);
}

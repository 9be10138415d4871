package com.example.oncallrotation.controller;

import com.example.oncallrotation.dto.ApiResponse;
import com.example.oncallrotation.dto.RotationTaskResponse;
import com.example.oncallrotation.dto.RunSummary;
import com.example.oncallrotation.service.RotationOrchestrator;
import com.example.oncallrotation.service.RotationTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Operations API: run a rotation, inspect and remove tasks.
 * The run endpoint is what the one-shot wake-up trigger calls.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/rotations")
@Tag(name = "Rotations", description = "APIs for running and managing user group rotations")
public class RotationController {

    private final RotationOrchestrator rotationOrchestrator;
    private final RotationTaskService rotationTaskService;

    @PostMapping("/run")
    @Operation(summary = "Run a rotation", description = "Sync every due task and schedule the next wake-up")
    public ResponseEntity<ApiResponse<RunSummary>> run() {
        log.info("API: Run rotation");

        var summary = rotationOrchestrator.run();
        return ResponseEntity.ok(ApiResponse.success(summary,
                String.format("Synced %d of %d due task(s)", summary.getSucceeded(), summary.getDueTasks())));
    }

    @GetMapping
    @Operation(summary = "List rotation tasks", description = "List all tasks, or those of one team scope")
    public ResponseEntity<ApiResponse<List<RotationTaskResponse>>> list(
            @Parameter(description = "Team scope, \"{teamId}:{enterpriseId}\"") @RequestParam(required = false) String team) {

        return ResponseEntity.ok(ApiResponse.success(rotationTaskService.listTasks(team)));
    }

    @DeleteMapping("/{team}/{taskId}")
    @Operation(summary = "Delete a rotation task")
    public ResponseEntity<ApiResponse<Void>> delete(
            @Parameter(description = "Team scope") @PathVariable String team,
            @Parameter(description = "Task id") @PathVariable String taskId) {
        log.info("API: Delete rotation task {}/{}", team, taskId);

        rotationTaskService.deleteTask(team, taskId);
        return ResponseEntity.ok(ApiResponse.success(null, "Task deleted"));
    }
}

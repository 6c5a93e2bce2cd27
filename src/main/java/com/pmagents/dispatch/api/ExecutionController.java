package com.pmagents.dispatch.api;

import com.pmagents.core.engine.ExecutionEngine;
import com.pmagents.core.engine.ExecutionNotFoundException;
import com.pmagents.core.graph.CycleException;
import com.pmagents.core.graph.GraphValidationException;
import com.pmagents.core.model.ExecuteRequest;
import com.pmagents.core.model.ExecuteResponse;
import com.pmagents.core.model.ProgressUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for graph executions.
 */
@RestController
@RequestMapping("/api/v1")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final ExecutionEngine engine;
    private final SseStreamingService sseStreamingService;

    public ExecutionController(ExecutionEngine engine, SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/executions: Submit a task graph. Runs asynchronously.
     */
    @PostMapping("/executions")
    public ResponseEntity<Map<String, String>> submit(@RequestBody ExecuteRequest request) {
        if (request.tasks().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one task is required"));
        }
        String executionId = engine.submitAsync(request);
        log.info("Accepted execution {} with {} task(s)", executionId, request.tasks().size());
        return ResponseEntity.accepted().body(Map.of(
                "executionId", executionId,
                "status", "RUNNING"));
    }

    /**
     * POST /api/v1/executions/sync: Execute a task graph and wait for the response.
     */
    @PostMapping("/executions/sync")
    public ResponseEntity<ExecuteResponse> executeSync(@RequestBody ExecuteRequest request) {
        return ResponseEntity.ok(engine.execute(request));
    }

    /**
     * GET /api/v1/executions/{id}: Final response (200), or progress while running (202).
     */
    @GetMapping("/executions/{id}")
    public ResponseEntity<?> get(@PathVariable String id) {
        if (!engine.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        var response = engine.response(id);
        if (response.isPresent()) {
            return ResponseEntity.ok(response.get());
        }
        return ResponseEntity.accepted().body(engine.progress(id));
    }

    @GetMapping("/executions/{id}/progress")
    public ResponseEntity<ProgressUpdate> progress(@PathVariable String id) {
        if (!engine.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(engine.progress(id));
    }

    /**
     * GET /api/v1/executions/{id}/events: SSE stream of execution events. Ends at once for a finished execution.
     */
    @GetMapping(value = "/executions/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> streamEvents(@PathVariable String id) {
        if (!engine.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id, () -> engine.response(id)));
    }

    /**
     * POST /api/v1/executions/{id}/cancel: Cooperative cancellation of a running execution.
     */
    @PostMapping("/executions/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (!engine.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        if (!engine.cancel(id)) {
            return ResponseEntity.status(409).body(Map.of("error", "Execution " + id + " is not running"));
        }
        return ResponseEntity.ok(Map.of(
                "executionId", id,
                "status", "CANCELLING"));
    }

    /**
     * POST /api/v1/executions/{id}/retry: Retry failed tasks and the tasks skipped because of them.
     */
    @PostMapping("/executions/{id}/retry")
    public ResponseEntity<Map<String, String>> retry(@PathVariable String id) {
        if (!engine.exists(id)) {
            return ResponseEntity.notFound().build();
        }
        if (!engine.submitRetry(id)) {
            return ResponseEntity.ok(Map.of(
                    "executionId", id,
                    "status", "NOTHING_TO_RETRY"));
        }
        return ResponseEntity.accepted().body(Map.of(
                "executionId", id,
                "status", "RUNNING"));
    }

    /**
     * POST /api/v1/graphs/levels: Validate a task set and return its concurrency levels.
     */
    @PostMapping("/graphs/levels")
    public ResponseEntity<Map<String, List<List<String>>>> levels(@RequestBody GraphRequest request) {
        return ResponseEntity.ok(Map.of("levels", engine.previewLevels(request.tasks())));
    }

    @ExceptionHandler(GraphValidationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidGraph(GraphValidationException e) {
        log.warn("Rejected task graph: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("category", e.category().name());
        if (e instanceof CycleException cycle) {
            body.put("cycle", cycle.cycle());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(ExecutionNotFoundException e) {
        return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleConflict(IllegalStateException e) {
        return ResponseEntity.status(409).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}

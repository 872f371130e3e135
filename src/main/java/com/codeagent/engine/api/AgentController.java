package com.codeagent.engine.api;

import com.codeagent.engine.model.AgentExecution;
import com.codeagent.engine.service.AgentSessionService;
import com.codeagent.engine.trajectory.Trajectory;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Session-scoped agent endpoints.
 *
 * POST   /api/agent/sessions/{id}/tasks       run a task (blocks until terminal)
 * POST   /api/agent/sessions/{id}/cancel      cancel the running task
 * GET    /api/agent/sessions/{id}/snapshot    export the conversation snapshot
 * PUT    /api/agent/sessions/{id}/snapshot    restore a snapshot
 * GET    /api/agent/sessions/{id}/trajectory  the session's trajectory
 * DELETE /api/agent/sessions/{id}             close the session
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentSessionService sessionService;

    @PostMapping("/sessions/{sessionId}/tasks")
    public ResponseEntity<AgentExecution> runTask(@PathVariable String sessionId,
                                                  @Valid @RequestBody TaskRequest request) {
        log.info("Task request [session={}, projectPath={}]", sessionId, request.getProjectPath());
        return ResponseEntity.ok(sessionService.runTask(sessionId, request.getTask(), request.getProjectPath()));
    }

    @PostMapping("/sessions/{sessionId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String sessionId) {
        boolean running = sessionService.cancel(sessionId);
        return ResponseEntity.ok(Map.of("session_id", sessionId, "cancelled", running));
    }

    @GetMapping(value = "/sessions/{sessionId}/snapshot", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> snapshot(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.snapshotJson(sessionId));
    }

    @PutMapping(value = "/sessions/{sessionId}/snapshot", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> restore(@PathVariable String sessionId, @RequestBody String snapshotJson) {
        sessionService.restore(sessionId, snapshotJson);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sessions/{sessionId}/trajectory")
    public ResponseEntity<Trajectory> trajectory(@PathVariable String sessionId) {
        return sessionService.trajectory(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        sessionService.close(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}

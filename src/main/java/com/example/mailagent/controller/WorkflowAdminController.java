package com.example.mailagent.controller;

import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.repository.WorkflowInstanceRepository;
import com.example.mailagent.workflow.StepOutcome;
import com.example.mailagent.workflow.WorkflowEngine;
import com.example.mailagent.workflow.WorkflowNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowAdminController {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowAdminController.class);
    private final WorkflowEngine workflowEngine;
    private final WorkflowInstanceRepository instanceRepository;

    public WorkflowAdminController(WorkflowEngine workflowEngine, WorkflowInstanceRepository instanceRepository) {
        this.workflowEngine = workflowEngine;
        this.instanceRepository = instanceRepository;
    }

    @GetMapping("/{id}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable("id") String id) {
        WorkflowInstance instance = instanceRepository.findById(id)
                .orElseThrow(() -> new WorkflowNotFoundException(id));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("id", instance.getId());
        response.put("userId", instance.getUserId());
        response.put("itemRef", instance.getItemRef());
        response.put("state", instance.getCurrentState());
        response.put("terminalReason", instance.getTerminalReason());
        response.put("category", instance.getCategory());
        response.put("proposedFolder", instance.getProposedFolder());
        response.put("priorityScore", instance.getPriorityScore());
        response.put("decision", instance.getDecision());
        response.put("selectedFolder", instance.getSelectedFolder());
        response.put("replySent", instance.isReplySent());
        response.put("labelApplied", instance.isLabelApplied());
        response.put("blocked", instance.isBlocked());
        response.put("blockedKind", instance.getBlockedKind());
        response.put("blockedReason", instance.getBlockedReason());
        response.put("updatedAt", instance.getUpdatedAt());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Map<String, String>> retry(@PathVariable("id") String id) {
        logger.info("Manual retry requested for instance {}", id);
        return ResponseEntity.ok(toResponse(workflowEngine.retryBlocked(id)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable("id") String id) {
        logger.info("Cancellation requested for instance {}", id);
        return ResponseEntity.ok(toResponse(workflowEngine.cancel(id)));
    }

    private static Map<String, String> toResponse(StepOutcome outcome) {
        Map<String, String> response = new HashMap<>();
        response.put("instanceId", outcome.getInstanceId());
        response.put("outcome", outcome.getKind().name());
        response.put("state", String.valueOf(outcome.getState()));
        if (outcome.getDetail() != null) {
            response.put("detail", outcome.getDetail());
        }
        return response;
    }
}

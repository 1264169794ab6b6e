package com.example.mailagent.controller;

import com.example.mailagent.integration.EmailItem;
import com.example.mailagent.workflow.WorkflowDispatcher;
import com.example.mailagent.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/emails")
public class InboundEmailController {

    private static final Logger logger = LoggerFactory.getLogger(InboundEmailController.class);
    private final WorkflowEngine workflowEngine;
    private final WorkflowDispatcher workflowDispatcher;

    public InboundEmailController(WorkflowEngine workflowEngine, WorkflowDispatcher workflowDispatcher) {
        this.workflowEngine = workflowEngine;
        this.workflowDispatcher = workflowDispatcher;
    }

    /**
     * Registers an arrived email and starts processing it in the background.
     * Posting the same message id twice returns the same instance.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> receive(@RequestBody InboundEmailRequest request) {
        if (isBlank(request.getUserId()) || isBlank(request.getMessageId())) {
            Map<String, String> errorResponse = new HashMap<>();
            errorResponse.put("error", "userId and messageId are required");
            return ResponseEntity.badRequest().body(errorResponse);
        }
        logger.info("Received email {} for user {} from {}", request.getMessageId(), request.getUserId(), request.getSender());

        EmailItem item = new EmailItem(request.getUserId(),
                request.getMessageId(),
                request.getThreadId(),
                request.getRfcMessageId(),
                request.getSender(),
                request.getSubject(),
                request.getBody(),
                request.getReceivedAt() != null ? request.getReceivedAt() : LocalDateTime.now());
        String instanceId = workflowEngine.start(item);
        boolean dispatched = workflowDispatcher.dispatch(instanceId);

        Map<String, String> response = new HashMap<>();
        response.put("instanceId", instanceId);
        response.put("status", dispatched ? "accepted" : "deferred");
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

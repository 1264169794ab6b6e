package com.example.mailagent.workflow;

import com.example.mailagent.domain.model.Checkpoint;
import com.example.mailagent.domain.model.CheckpointPhase;
import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.repository.CheckpointRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends checkpoints to an instance's history. Callers own the transaction.
 */
@Component
public class CheckpointWriter {

    private static final Logger logger = LoggerFactory.getLogger(CheckpointWriter.class);

    private final CheckpointRepository checkpointRepository;
    private final ObjectMapper objectMapper;

    public CheckpointWriter(CheckpointRepository checkpointRepository, ObjectMapper objectMapper) {
        this.checkpointRepository = checkpointRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Recorded right before a port call; if it stays the latest checkpoint the call may or may not have happened.
     */
    public Checkpoint before(WorkflowInstance instance, String step) {
        return append(instance, step, CheckpointPhase.BEFORE);
    }

    public Checkpoint after(WorkflowInstance instance, String step) {
        return append(instance, step, CheckpointPhase.AFTER);
    }

    private Checkpoint append(WorkflowInstance instance, String step, CheckpointPhase phase) {
        long seq = checkpointRepository.findTopByInstanceIdOrderBySeqDesc(instance.getId())
                .map(Checkpoint::getSeq)
                .orElse(0L) + 1;
        Checkpoint checkpoint = new Checkpoint(instance.getId(), seq, instance.getCurrentState(), step, phase, snapshot(instance));
        logger.debug("Checkpoint {} {} for instance {} at {}", phase, step, instance.getId(), instance.getCurrentState());
        return checkpointRepository.save(checkpoint);
    }

    String snapshot(WorkflowInstance instance) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("state", instance.getCurrentState());
        snapshot.put("terminalReason", instance.getTerminalReason());
        snapshot.put("category", instance.getCategory());
        snapshot.put("proposedFolder", instance.getProposedFolder());
        snapshot.put("priorityScore", instance.getPriorityScore());
        snapshot.put("decision", instance.getDecision());
        snapshot.put("selectedFolder", instance.getSelectedFolder());
        snapshot.put("notificationRef", instance.getNotificationRef());
        snapshot.put("replySent", instance.isReplySent());
        snapshot.put("labelApplied", instance.isLabelApplied());
        snapshot.put("blocked", instance.isBlocked());
        snapshot.put("blockCount", instance.getBlockCount());
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise snapshot of instance " + instance.getId(), e);
        }
    }
}

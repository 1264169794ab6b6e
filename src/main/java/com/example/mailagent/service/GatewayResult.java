package com.example.mailagent.service;

import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.domain.model.WorkflowState;
import com.example.mailagent.workflow.StepOutcome;

public final class GatewayResult {

    public enum Status {
        /** The decision was applied and the instance ran to its next resting point. */
        RESUMED,
        /** The instance was already resolved; nothing was done again. */
        DUPLICATE,
        /** No instance is waiting under this key. */
        STALE,
        /** The actor does not own the instance. */
        FORBIDDEN,
        /** The event itself is malformed. */
        INVALID
    }

    private final Status status;
    private final String instanceId;
    private final Decision decision;
    private final WorkflowState state;
    private final StepOutcome outcome;
    private final boolean replySent;
    private final boolean labelApplied;

    private GatewayResult(Status status, String instanceId, Decision decision, WorkflowState state, StepOutcome outcome,
                          boolean replySent, boolean labelApplied) {
        this.status = status;
        this.instanceId = instanceId;
        this.decision = decision;
        this.state = state;
        this.outcome = outcome;
        this.replySent = replySent;
        this.labelApplied = labelApplied;
    }

    public static GatewayResult resumed(String instanceId, Decision decision, StepOutcome outcome) {
        return new GatewayResult(Status.RESUMED, instanceId, decision, outcome.getState(), outcome, false, false);
    }

    /**
     * Carries what the first decision already achieved, so a repeated click can be answered with it.
     */
    public static GatewayResult duplicate(String instanceId, Decision decision, WorkflowState state,
                                          boolean replySent, boolean labelApplied) {
        return new GatewayResult(Status.DUPLICATE, instanceId, decision, state, null, replySent, labelApplied);
    }

    public static GatewayResult stale() {
        return new GatewayResult(Status.STALE, null, null, null, null, false, false);
    }

    public static GatewayResult forbidden(String instanceId) {
        return new GatewayResult(Status.FORBIDDEN, instanceId, null, null, null, false, false);
    }

    public static GatewayResult invalid() {
        return new GatewayResult(Status.INVALID, null, null, null, null, false, false);
    }

    public Status getStatus() { return status; }
    public String getInstanceId() { return instanceId; }
    public Decision getDecision() { return decision; }
    public WorkflowState getState() { return state; }
    public StepOutcome getOutcome() { return outcome; }
    public boolean isReplySent() { return replySent; }
    public boolean isLabelApplied() { return labelApplied; }

    @Override
    public String toString() {
        return "GatewayResult[" + status + ", instance=" + instanceId + ", decision=" + decision + ", state=" + state
                + ", replySent=" + replySent + ", labelApplied=" + labelApplied + "]";
    }
}

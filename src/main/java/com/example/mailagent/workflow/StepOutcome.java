package com.example.mailagent.workflow;

import com.example.mailagent.domain.model.WorkflowState;

/**
 * Result of driving an instance one step. Everything except {@link Kind#ADVANCED} is a resting point.
 */
public final class StepOutcome {

    public enum Kind {
        ADVANCED,
        SUSPENDED,
        TERMINATED,
        BLOCKED,
        NO_OP
    }

    private final Kind kind;
    private final String instanceId;
    private final WorkflowState state;
    private final String detail;

    private StepOutcome(Kind kind, String instanceId, WorkflowState state, String detail) {
        this.kind = kind;
        this.instanceId = instanceId;
        this.state = state;
        this.detail = detail;
    }

    public static StepOutcome advanced(String instanceId, WorkflowState state) {
        return new StepOutcome(Kind.ADVANCED, instanceId, state, null);
    }

    public static StepOutcome suspended(String instanceId) {
        return new StepOutcome(Kind.SUSPENDED, instanceId, WorkflowState.AWAITING_APPROVAL, null);
    }

    public static StepOutcome terminated(String instanceId, String reason) {
        return new StepOutcome(Kind.TERMINATED, instanceId, WorkflowState.TERMINAL, reason);
    }

    public static StepOutcome blocked(String instanceId, WorkflowState state, String reason) {
        return new StepOutcome(Kind.BLOCKED, instanceId, state, reason);
    }

    public static StepOutcome noOp(String instanceId, WorkflowState state, String reason) {
        return new StepOutcome(Kind.NO_OP, instanceId, state, reason);
    }

    public boolean isResting() {
        return kind != Kind.ADVANCED;
    }

    public Kind getKind() { return kind; }
    public String getInstanceId() { return instanceId; }
    public WorkflowState getState() { return state; }
    public String getDetail() { return detail; }

    @Override
    public String toString() {
        return kind + "[" + instanceId + " @ " + state + (detail != null ? ", " + detail : "") + "]";
    }
}

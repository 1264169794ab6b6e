package com.example.mailagent.workflow.action;

import com.example.mailagent.domain.model.ErrorKind;
import com.example.mailagent.integration.PortFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What the executor achieved. The flags report effects that are known to exist, including ones
 * delivered by an earlier attempt.
 */
public final class ActionResult {

    private final boolean replySent;
    private final boolean labelApplied;
    private final List<PortFailure> errors;

    public ActionResult(boolean replySent, boolean labelApplied, List<PortFailure> errors) {
        this.replySent = replySent;
        this.labelApplied = labelApplied;
        this.errors = List.copyOf(errors);
    }

    public static ActionResult none() {
        return new ActionResult(false, false, List.of());
    }

    public boolean isSuccessful() {
        return errors.isEmpty();
    }

    /**
     * Permanent wins over transient so the instance is reported the way it needs to be handled.
     */
    public ErrorKind failureKind() {
        return errors.stream().anyMatch(error -> !error.isRetryable())
                ? ErrorKind.PERMANENT_EXTERNAL
                : ErrorKind.TRANSIENT_EXTERNAL;
    }

    public String errorSummary() {
        return errors.stream().map(PortFailure::message).collect(Collectors.joining("; "));
    }

    public boolean isReplySent() { return replySent; }
    public boolean isLabelApplied() { return labelApplied; }
    public List<PortFailure> getErrors() { return errors; }

    @Override
    public String toString() {
        return "ActionResult[replySent=" + replySent + ", labelApplied=" + labelApplied + ", errors=" + errors + "]";
    }
}

package com.example.mailagent.workflow;

public class WorkflowNotFoundException extends IllegalArgumentException {

    public WorkflowNotFoundException(String instanceId) {
        super("Unknown workflow instance " + instanceId);
    }
}

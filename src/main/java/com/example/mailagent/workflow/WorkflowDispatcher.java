package com.example.mailagent.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs instances on the worker pool so callers (HTTP ingress, recovery) do not wait for port calls.
 */
@Component
public class WorkflowDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowDispatcher.class);

    private final WorkflowEngine engine;
    private final ExecutorService workerExecutor;

    public WorkflowDispatcher(WorkflowEngine engine,
                              @Qualifier("workflowWorkerExecutor") ExecutorService workerExecutor) {
        this.engine = engine;
        this.workerExecutor = workerExecutor;
    }

    /**
     * @return false when the pool is saturated; the recovery sweep picks the instance up later
     */
    public boolean dispatch(String instanceId) {
        try {
            workerExecutor.execute(() -> {
                try {
                    StepOutcome outcome = engine.run(instanceId);
                    logger.debug("Instance {} came to rest: {}", instanceId, outcome);
                } catch (RuntimeException e) {
                    logger.error("Error while running instance {}", instanceId, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            logger.warn("Worker pool saturated, instance {} left for the recovery sweep", instanceId);
            return false;
        }
    }
}

package com.example.mailagent.workflow;

import com.example.mailagent.config.MailAgentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decides whether a scored item is notified now or held for the digest.
 */
@Component
public class PriorityRouter {

    private final int threshold;

    @Autowired
    public PriorityRouter(MailAgentProperties properties) {
        this(properties.getPriority().getThreshold());
    }

    PriorityRouter(int threshold) {
        this.threshold = threshold;
    }

    public Route route(int score) {
        return score >= threshold ? Route.IMMEDIATE : Route.BATCH;
    }

    public int getThreshold() {
        return threshold;
    }
}

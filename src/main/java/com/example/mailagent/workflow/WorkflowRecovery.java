package com.example.mailagent.workflow;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.model.WorkflowState;
import com.example.mailagent.domain.repository.WorkflowInstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;

/**
 * Re-drives instances that were interrupted between steps. Suspended, terminal and blocked
 * instances are left alone. Failure notices that never reached the user are sent again on the same
 * schedule.
 */
@Component
public class WorkflowRecovery {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowRecovery.class);
    static final EnumSet<WorkflowState> RESTING = EnumSet.of(WorkflowState.AWAITING_APPROVAL, WorkflowState.TERMINAL);

    private final WorkflowInstanceRepository instanceRepository;
    private final WorkflowDispatcher dispatcher;
    private final WorkflowEngine engine;
    private final MailAgentProperties.Recovery settings;

    public WorkflowRecovery(WorkflowInstanceRepository instanceRepository,
                            WorkflowDispatcher dispatcher,
                            WorkflowEngine engine,
                            MailAgentProperties properties) {
        this.instanceRepository = instanceRepository;
        this.dispatcher = dispatcher;
        this.engine = engine;
        this.settings = properties.getRecovery();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        if (!settings.isOnStartup()) {
            return;
        }
        List<WorkflowInstance> unfinished = instanceRepository.findByBlockedFalseAndCurrentStateNotIn(RESTING);
        logger.info("Recovering {} unfinished instances", unfinished.size());
        unfinished.forEach(instance -> dispatcher.dispatch(instance.getId()));
        redeliverNotices();
    }

    @Scheduled(fixedDelayString = "${mailagent.recovery.sweep-delay:PT5M}",
            initialDelayString = "${mailagent.recovery.sweep-delay:PT5M}")
    public void sweep() {
        redeliverNotices();
        LocalDateTime staleBefore = LocalDateTime.now().minus(settings.getStaleAfter());
        List<WorkflowInstance> stale = instanceRepository
                .findByBlockedFalseAndCurrentStateNotInAndUpdatedAtBefore(RESTING, staleBefore);
        if (stale.isEmpty()) {
            return;
        }
        logger.info("Sweep found {} instances idle since before {}", stale.size(), staleBefore);
        stale.forEach(instance -> dispatcher.dispatch(instance.getId()));
    }

    private void redeliverNotices() {
        try {
            engine.redeliverNotices();
        } catch (RuntimeException e) {
            logger.error("Error while redelivering failure notices", e);
        }
    }
}

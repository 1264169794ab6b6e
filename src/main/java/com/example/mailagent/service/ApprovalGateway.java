package com.example.mailagent.service;

import com.example.mailagent.domain.model.ChannelLink;
import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.domain.model.ExternalCorrelation;
import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.repository.ChannelLinkRepository;
import com.example.mailagent.domain.repository.ExternalCorrelationRepository;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import com.example.mailagent.domain.repository.WorkflowInstanceRepository;
import com.example.mailagent.workflow.ApprovalInput;
import com.example.mailagent.workflow.StepOutcome;
import com.example.mailagent.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for decisions coming back from the messaging channel. Maps a correlation key to the
 * waiting instance and resumes it exactly once; late, repeated and foreign clicks change nothing.
 */
@Service
public class ApprovalGateway {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalGateway.class);

    private final ExternalCorrelationRepository correlationRepository;
    private final WorkflowInstanceRepository instanceRepository;
    private final ChannelLinkRepository channelLinkRepository;
    private final FolderCategoryRepository folderCategoryRepository;
    private final WorkflowEngine engine;

    public ApprovalGateway(ExternalCorrelationRepository correlationRepository,
                           WorkflowInstanceRepository instanceRepository,
                           ChannelLinkRepository channelLinkRepository,
                           FolderCategoryRepository folderCategoryRepository,
                           WorkflowEngine engine) {
        this.correlationRepository = correlationRepository;
        this.instanceRepository = instanceRepository;
        this.channelLinkRepository = channelLinkRepository;
        this.folderCategoryRepository = folderCategoryRepository;
        this.engine = engine;
    }

    public GatewayResult onExternalEvent(ApprovalEvent event) {
        if (event.correlationKey() == null || event.decision() == null) {
            return GatewayResult.invalid();
        }

        Optional<ExternalCorrelation> correlation = correlationRepository.findById(event.correlationKey());
        if (correlation.isEmpty()) {
            return alreadyHandled(event);
        }
        Optional<WorkflowInstance> found = instanceRepository.findById(correlation.get().getInstanceId());
        if (found.isEmpty()) {
            logger.warn("Correlation {} points at missing instance {}", event.correlationKey(), correlation.get().getInstanceId());
            return GatewayResult.stale();
        }
        WorkflowInstance instance = found.get();

        Optional<ChannelLink> actor = channelLinkRepository.findByMattermostUserId(event.actorId());
        if (actor.isEmpty() || !actor.get().getUserId().equals(instance.getUserId())) {
            logger.warn("Actor {} tried to decide instance {} of user {}", event.actorId(), instance.getId(), instance.getUserId());
            return GatewayResult.forbidden(instance.getId());
        }
        if (event.decision() == Decision.CHANGE && (event.folder() == null || event.folder().isBlank())) {
            logger.info("Change for instance {} arrived without a folder", instance.getId());
            return GatewayResult.invalid();
        }
        if (event.decision() == Decision.CHANGE
                && folderCategoryRepository.findByUserIdAndName(instance.getUserId(), event.folder().trim()).isEmpty()) {
            logger.info("Change for instance {} names unknown folder '{}'", instance.getId(), event.folder());
            return GatewayResult.invalid();
        }

        if (event.skipReply() && event.replyText() != null && !event.replyText().isBlank()) {
            return GatewayResult.invalid();
        }

        StepOutcome outcome = engine.resume(instance.getId(), new ApprovalInput(event.decision(), event.folder(),
                actor.get().getUserId(), event.replyText(), event.skipReply()));
        if (outcome.getKind() == StepOutcome.Kind.NO_OP) {
            // another click won the race for this correlation
            return alreadyHandled(event);
        }
        logger.info("Decision {} applied to instance {}: {}", event.decision(), instance.getId(), outcome);
        return GatewayResult.resumed(instance.getId(), event.decision(), outcome);
    }

    /**
     * The reply text a user may edit before approving: the draft of an instance still waiting for
     * them. Empty when the key is stale, the actor is someone else or there is no draft.
     */
    public Optional<String> editableReply(String correlationKey, String actorId) {
        if (correlationKey == null) {
            return Optional.empty();
        }
        Optional<WorkflowInstance> instance = correlationRepository.findById(correlationKey)
                .flatMap(correlation -> instanceRepository.findById(correlation.getInstanceId()));
        Optional<ChannelLink> actor = channelLinkRepository.findByMattermostUserId(actorId);
        if (instance.isEmpty() || actor.isEmpty() || !actor.get().getUserId().equals(instance.get().getUserId())) {
            return Optional.empty();
        }
        return Optional.ofNullable(instance.get().getReplyBody()).filter(body -> !body.isBlank());
    }

    private GatewayResult alreadyHandled(ApprovalEvent event) {
        Optional<WorkflowInstance> instance = instanceRepository.findByCorrelationKey(event.correlationKey());
        if (instance.isPresent() && instance.get().getDecision() != null) {
            logger.info("Duplicate decision for {} on instance {}, already {}", event.correlationKey(),
                    instance.get().getId(), instance.get().getDecision());
            return GatewayResult.duplicate(instance.get().getId(), instance.get().getDecision(),
                    instance.get().getCurrentState(), instance.get().isReplySent(), instance.get().isLabelApplied());
        }
        logger.info("Stale callback for {}", event.correlationKey());
        return GatewayResult.stale();
    }
}

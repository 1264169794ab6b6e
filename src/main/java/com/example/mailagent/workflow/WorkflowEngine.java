package com.example.mailagent.workflow;

import com.example.mailagent.domain.model.*;
import com.example.mailagent.domain.repository.*;
import com.example.mailagent.integration.*;
import com.example.mailagent.service.NotificationMessageFormatter;
import com.example.mailagent.workflow.action.ActionExecutor;
import com.example.mailagent.workflow.action.ActionResult;
import com.example.mailagent.workflow.action.IdempotencyKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Drives email workflow instances through their states.
 *
 * <pre>
 * CREATED -> CLASSIFIED -> ROUTED_IMMEDIATE -> AWAITING_APPROVAL -> RESOLVED -> ACTION_EXECUTED -> CONFIRMED -> TERMINAL
 *                       \-> ROUTED_BATCH -> TERMINAL(QUEUED)
 * </pre>
 *
 * Every step that calls a port writes a BEFORE checkpoint first, and commits the AFTER checkpoint
 * together with the new state. A restart therefore re-enters the step whose AFTER checkpoint is
 * missing, and the step's idempotency key keeps the side effect from happening twice.
 * Waiting for a human holds no thread: the instance rests in AWAITING_APPROVAL with an open
 * {@link ExternalCorrelation} until {@link #resume} is called.
 */
@Service
public class WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEngine.class);
    static final int MAX_STEPS_PER_RUN = 32;
    static final int MAX_NOTICE_ATTEMPTS = 5;

    private final WorkflowInstanceRepository instanceRepository;
    private final ExternalCorrelationRepository correlationRepository;
    private final PendingActionRepository pendingActionRepository;
    private final BatchQueueRepository batchQueueRepository;
    private final ApprovalHistoryRepository approvalHistoryRepository;
    private final NotificationPreferencesRepository preferencesRepository;
    private final FolderCategoryRepository folderCategoryRepository;
    private final InstanceTransactions transactions;
    private final InstanceLocks locks;
    private final CheckpointWriter checkpoints;
    private final RetryingCaller retryingCaller;
    private final Classifier classifier;
    private final Notifier notifier;
    private final ActionExecutor actionExecutor;
    private final PriorityScorer priorityScorer;
    private final PriorityRouter priorityRouter;
    private final NotificationMessageFormatter formatter;

    public WorkflowEngine(WorkflowInstanceRepository instanceRepository,
                          ExternalCorrelationRepository correlationRepository,
                          PendingActionRepository pendingActionRepository,
                          BatchQueueRepository batchQueueRepository,
                          ApprovalHistoryRepository approvalHistoryRepository,
                          NotificationPreferencesRepository preferencesRepository,
                          FolderCategoryRepository folderCategoryRepository,
                          InstanceTransactions transactions,
                          InstanceLocks locks,
                          CheckpointWriter checkpoints,
                          RetryingCaller retryingCaller,
                          Classifier classifier,
                          Notifier notifier,
                          ActionExecutor actionExecutor,
                          PriorityScorer priorityScorer,
                          PriorityRouter priorityRouter,
                          NotificationMessageFormatter formatter) {
        this.instanceRepository = instanceRepository;
        this.correlationRepository = correlationRepository;
        this.pendingActionRepository = pendingActionRepository;
        this.batchQueueRepository = batchQueueRepository;
        this.approvalHistoryRepository = approvalHistoryRepository;
        this.preferencesRepository = preferencesRepository;
        this.folderCategoryRepository = folderCategoryRepository;
        this.transactions = transactions;
        this.locks = locks;
        this.checkpoints = checkpoints;
        this.retryingCaller = retryingCaller;
        this.classifier = classifier;
        this.notifier = notifier;
        this.actionExecutor = actionExecutor;
        this.priorityScorer = priorityScorer;
        this.priorityRouter = priorityRouter;
        this.formatter = formatter;
    }

    /**
     * Creates the instance for an item, or returns the existing one if the item was seen before.
     */
    public String start(EmailItem item) {
        Optional<WorkflowInstance> existing = instanceRepository.findByItemRef(item.messageId());
        if (existing.isPresent()) {
            logger.info("Item {} already has instance {}", item.messageId(), existing.get().getId());
            return existing.get().getId();
        }
        try {
            return transactions.inTransaction(() -> {
                WorkflowInstance instance = new WorkflowInstance();
                instance.setId(UUID.randomUUID().toString());
                instance.setCorrelationKey("wf_" + UUID.randomUUID().toString().replace("-", ""));
                instance.setItemRef(item.messageId());
                instance.setUserId(item.userId());
                instance.setThreadId(item.threadId());
                instance.setRfcMessageId(item.rfcMessageId());
                instance.setSender(item.sender());
                instance.setSubject(item.subject());
                instance.setBody(item.body());
                instance.setCurrentState(WorkflowState.CREATED);
                WorkflowInstance saved = instanceRepository.save(instance);
                checkpoints.after(saved, "start");
                logger.info("Started instance {} for item {} of user {}", saved.getId(), item.messageId(), item.userId());
                return saved.getId();
            });
        } catch (DataIntegrityViolationException e) {
            // lost the race against a concurrent start for the same item
            return instanceRepository.findByItemRef(item.messageId())
                    .map(WorkflowInstance::getId)
                    .orElseThrow(() -> e);
        }
    }

    /**
     * Performs at most one transition. Failures are reported through the outcome, never thrown.
     */
    public StepOutcome step(String instanceId) {
        return locks.withLock(instanceId, () -> doStep(instanceId));
    }

    /**
     * Steps until the instance reaches a resting point: suspended, terminal or blocked.
     */
    public StepOutcome run(String instanceId) {
        return locks.withLock(instanceId, () -> {
            StepOutcome outcome = null;
            for (int i = 0; i < MAX_STEPS_PER_RUN; i++) {
                outcome = doStep(instanceId);
                if (outcome.isResting()) {
                    return outcome;
                }
            }
            logger.error("Instance {} did not come to rest after {} steps, last outcome {}", instanceId, MAX_STEPS_PER_RUN, outcome);
            return outcome;
        });
    }

    /**
     * Parks the instance until an approval arrives for {@code correlationKey}.
     */
    public StepOutcome suspend(String instanceId, String correlationKey, String notificationRef) {
        return locks.withLock(instanceId, () -> transactions.update(instanceId, instance -> {
            if (instance.getCurrentState() == WorkflowState.AWAITING_APPROVAL
                    && correlationRepository.existsByInstanceId(instanceId)) {
                return StepOutcome.suspended(instanceId);
            }
            if (instance.getCurrentState() != WorkflowState.ROUTED_IMMEDIATE) {
                throw new IllegalStateException("Instance " + instanceId + " cannot suspend from " + instance.getCurrentState());
            }
            openCorrelation(instance, correlationKey, notificationRef);
            checkpoints.after(instance, "suspend");
            return StepOutcome.suspended(instanceId);
        }));
    }

    /**
     * Applies a human decision to a suspended instance and runs it to its next resting point.
     * Returns {@link StepOutcome.Kind#NO_OP} when the instance is not waiting for a decision.
     */
    public StepOutcome resume(String instanceId, ApprovalInput input) {
        if (input.decision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        if (input.decision() == Decision.CHANGE && (input.selectedFolder() == null || input.selectedFolder().isBlank())) {
            throw new IllegalArgumentException("a folder is required to change the destination");
        }
        if (input.skipReply() && input.replyText() != null && !input.replyText().isBlank()) {
            throw new IllegalArgumentException("an edited reply cannot be skipped");
        }
        return locks.withLock(instanceId, () -> {
            StepOutcome resumed = transactions.update(instanceId, instance -> {
                Optional<ExternalCorrelation> correlation = correlationRepository.findByInstanceId(instanceId);
                if (instance.getCurrentState() != WorkflowState.AWAITING_APPROVAL || correlation.isEmpty()) {
                    return StepOutcome.noOp(instanceId, instance.getCurrentState(), "not awaiting approval");
                }
                instance.setDecision(input.decision());
                instance.setSelectedFolder(input.decision() == Decision.CHANGE ? input.selectedFolder().trim() : null);
                if (input.decision().isAffirmative()) {
                    instance.setEditedResponse(input.replyText() == null || input.replyText().isBlank() ? null : input.replyText().trim());
                    instance.setReplyDeclined(input.skipReply());
                }
                correlationRepository.delete(correlation.get());
                approvalHistoryRepository.save(new ApprovalHistory(instance, input.actorId()));
                instance.setCurrentState(WorkflowState.RESOLVED);
                checkpoints.after(instance, "resume");
                return StepOutcome.advanced(instanceId, WorkflowState.RESOLVED);
            });
            if (resumed.getKind() == StepOutcome.Kind.NO_OP) {
                logger.info("Ignoring decision for instance {}: {}", instanceId, resumed.getDetail());
                return resumed;
            }
            logger.info("Instance {} resumed with decision {} by {}", instanceId, input.decision(), input.actorId());
            return run(instanceId);
        });
    }

    /**
     * Stops an instance that has not acted yet. No side effect is performed afterwards.
     */
    public StepOutcome cancel(String instanceId) {
        return locks.withLock(instanceId, () -> {
            WorkflowInstance cancelled = transactions.update(instanceId, instance -> {
                if (!instance.getCurrentState().isCancellable()) {
                    throw new IllegalStateException("Instance " + instanceId + " cannot be cancelled in state " + instance.getCurrentState());
                }
                correlationRepository.findByInstanceId(instanceId).ifPresent(correlationRepository::delete);
                instance.clearBlocked();
                instance.terminate(TerminalReason.REJECTED);
                checkpoints.after(instance, "cancel");
                return instance;
            });
            logger.info("Instance {} cancelled", instanceId);
            if (cancelled.getNotificationRef() != null) {
                confirmBestEffort(cancelled);
            }
            return StepOutcome.terminated(instanceId, TerminalReason.REJECTED.name());
        });
    }

    /**
     * Clears the blocked marker and re-runs the step that failed.
     */
    public StepOutcome retryBlocked(String instanceId) {
        return locks.withLock(instanceId, () -> {
            transactions.update(instanceId, instance -> {
                if (!instance.isBlocked()) {
                    throw new IllegalStateException("Instance " + instanceId + " is not blocked");
                }
                instance.clearBlocked();
                checkpoints.after(instance, "retry");
                return null;
            });
            logger.info("Retrying blocked instance {}", instanceId);
            return run(instanceId);
        });
    }

    /**
     * Moves a queued instance back to waiting for approval once it has been offered in a digest.
     * The batch entry is removed in the same transaction.
     */
    public void reactivateQueued(String instanceId, String digestMessageRef) {
        locks.withLock(instanceId, () -> transactions.update(instanceId, instance -> {
            if (instance.getCurrentState() == WorkflowState.TERMINAL && instance.getTerminalReason() == TerminalReason.QUEUED) {
                instance.setTerminalReason(null);
                openCorrelation(instance, instance.getCorrelationKey(), digestMessageRef);
                checkpoints.after(instance, "digest");
                logger.info("Instance {} reactivated from digest {}", instanceId, digestMessageRef);
            } else {
                logger.warn("Instance {} in {} was not queued, only removing its batch entry", instanceId, instance.getCurrentState());
            }
            batchQueueRepository.findByInstanceId(instanceId).ifPresent(batchQueueRepository::delete);
            return null;
        }));
    }

    private StepOutcome doStep(String instanceId) {
        WorkflowInstance instance = instanceRepository.findById(instanceId)
                .orElseThrow(() -> new WorkflowNotFoundException(instanceId));
        if (instance.isBlocked()) {
            return StepOutcome.blocked(instanceId, instance.getCurrentState(), instance.getBlockedReason());
        }
        try {
            switch (instance.getCurrentState()) {
                case CREATED:
                    return classify(instance);
                case CLASSIFIED:
                    return route(instance);
                case ROUTED_BATCH:
                    return enqueue(instance);
                case ROUTED_IMMEDIATE:
                    return notifyUser(instance);
                case AWAITING_APPROVAL:
                    return StepOutcome.suspended(instanceId);
                case RESOLVED:
                    return instance.getDecision() == Decision.REJECT ? reject(instance) : executeActions(instance);
                case ACTION_EXECUTED:
                    return confirm(instance);
                case CONFIRMED:
                    return advance(instanceId, WorkflowState.CONFIRMED, "complete",
                            i -> i.terminate(TerminalReason.COMPLETED));
                case TERMINAL:
                default:
                    return StepOutcome.noOp(instanceId, instance.getCurrentState(), "terminal");
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error while stepping instance {} in {}", instanceId, instance.getCurrentState(), e);
            return block(instanceId, new PortFailure(ErrorKind.PERMANENT_EXTERNAL,
                    "Unexpected error in " + instance.getCurrentState() + ": " + e.getMessage()));
        }
    }

    private StepOutcome classify(WorkflowInstance instance) {
        String id = instance.getId();
        transactions.update(id, i -> checkpoints.before(i, "classify"));
        EmailItem item = new EmailItem(instance.getUserId(), instance.getItemRef(), instance.getThreadId(),
                instance.getRfcMessageId(), instance.getSender(), instance.getSubject(), instance.getBody(), null);
        PortResult<Classification> result = retryingCaller.call("classify", id, () -> classifier.classify(item));
        if (!result.isSuccess()) {
            logger.error("Classification of instance {} failed, handing over to manual review: {}", id, result.getFailure());
            String key = IdempotencyKeys.manualReview(id);
            StepOutcome outcome = advance(id, WorkflowState.CREATED, "classify", i -> {
                i.setActionErrors(result.getFailure().toString());
                i.terminate(TerminalReason.MANUAL_REVIEW);
                recordNotice(id, key, formatter.manualReview(i));
            });
            pendingActionRepository.findByIdempotencyKey(key)
                    .ifPresent(notice -> deliverNotice(instance.getUserId(), notice));
            return outcome;
        }
        Classification classification = result.getValue();
        return advance(id, WorkflowState.CREATED, "classify", i -> {
            i.setCategory(classification.category());
            i.setProposedFolder(classification.proposedFolder());
            i.setReasoning(classification.reasoning());
            i.setNeedsResponse(classification.needsResponse());
            i.setDraftResponse(classification.draftResponse());
            i.setPriorityScore(classification.priorityScore());
            i.setCurrentState(WorkflowState.CLASSIFIED);
        });
    }

    private StepOutcome route(WorkflowInstance instance) {
        PriorityScorer.Assessment assessment = priorityScorer.assess(instance.getUserId(), instance.getSender(),
                instance.getSubject(), instance.getBody());
        int score = priorityScorer.combine(instance.getPriorityScore(), assessment);
        boolean batchEnabled = preferencesRepository.findByUserId(instance.getUserId())
                .map(NotificationPreferences::isBatchEnabled)
                .orElse(true);
        Route route = batchEnabled ? priorityRouter.route(score) : Route.IMMEDIATE;
        logger.info("Instance {} scored {} {} routed {}", instance.getId(), score, assessment.reasons(), route);
        return advance(instance.getId(), WorkflowState.CLASSIFIED, "route", i -> {
            i.setPriorityScore(score);
            i.setPriority(score >= priorityRouter.getThreshold());
            i.setCurrentState(route == Route.IMMEDIATE ? WorkflowState.ROUTED_IMMEDIATE : WorkflowState.ROUTED_BATCH);
        });
    }

    private StepOutcome enqueue(WorkflowInstance instance) {
        return advance(instance.getId(), WorkflowState.ROUTED_BATCH, "enqueue", i -> {
            if (batchQueueRepository.findByInstanceId(i.getId()).isEmpty()) {
                BatchQueueEntry entry = new BatchQueueEntry();
                entry.setUserId(i.getUserId());
                entry.setInstanceId(i.getId());
                entry.setCategory(i.getCategory());
                entry.setProposedFolder(i.getProposedFolder());
                entry.setScheduledTime(LocalDateTime.now());
                batchQueueRepository.save(entry);
            }
            i.terminate(TerminalReason.QUEUED);
        });
    }

    private StepOutcome notifyUser(WorkflowInstance instance) {
        String id = instance.getId();
        String key = IdempotencyKeys.notify(id);
        Optional<PendingAction> existing = pendingActionRepository.findByIdempotencyKey(key);
        if (existing.isPresent() && existing.get().getStatus().isDelivered()) {
            logger.info("Notification {} already delivered as {}, suspending", key, existing.get().getExternalRef());
            return suspendAfterNotify(id, existing.get().getExternalRef(), null);
        }
        PendingAction action = transactions.update(id, i -> {
            checkpoints.before(i, "notify");
            PendingAction pending = pendingActionRepository.findByIdempotencyKey(key)
                    .orElseGet(() -> new PendingAction(id, ActionType.NOTIFY, key));
            pending.setAttempts(pending.getAttempts() + 1);
            return pendingActionRepository.save(pending);
        });

        ActionSet actions = formatter.actionSet(instance, folderCategoryRepository.findByUserIdOrderByNameAsc(instance.getUserId()));
        String summary = formatter.proposal(instance);
        // A row from an earlier run means the message may already be in the channel
        PortResult<String> result = retryingCaller.callReconciled("notify", id, existing.isPresent(),
                () -> notifier.findDelivered(instance.getUserId(), key, LookupWindow.since(action.getCreatedAt())),
                () -> notifier.notify(instance.getUserId(), key, summary, actions));
        if (!result.isSuccess()) {
            action.setStatus(PendingActionStatus.FAILED);
            action.setLastError(result.getFailure().toString());
            pendingActionRepository.save(action);
            return block(id, result.getFailure());
        }
        return suspendAfterNotify(id, result.getValue(), action);
    }

    private StepOutcome suspendAfterNotify(String instanceId, String messageRef, PendingAction action) {
        return transactions.update(instanceId, instance -> {
            if (instance.getCurrentState() != WorkflowState.ROUTED_IMMEDIATE) {
                return StepOutcome.noOp(instanceId, instance.getCurrentState(), "moved on concurrently");
            }
            if (action != null) {
                action.setStatus(PendingActionStatus.SENT);
                action.setExternalRef(messageRef);
                action.setLastError(null);
                pendingActionRepository.save(action);
            }
            openCorrelation(instance, instance.getCorrelationKey(), messageRef);
            checkpoints.after(instance, "notify");
            logger.info("Instance {} awaiting approval under {}", instanceId, instance.getCorrelationKey());
            return StepOutcome.suspended(instanceId);
        });
    }

    private void openCorrelation(WorkflowInstance instance, String correlationKey, String notificationRef) {
        if (!correlationRepository.existsByInstanceId(instance.getId())) {
            correlationRepository.save(new ExternalCorrelation(correlationKey, instance.getId(), notificationRef));
        }
        instance.setNotificationRef(notificationRef);
        instance.setCurrentState(WorkflowState.AWAITING_APPROVAL);
    }

    private StepOutcome reject(WorkflowInstance instance) {
        transactions.update(instance.getId(), i -> i.getNotificationRef() == null ? null : checkpoints.before(i, "confirm"));
        StepOutcome outcome = advance(instance.getId(), WorkflowState.RESOLVED, "reject",
                i -> i.terminate(TerminalReason.REJECTED));
        instanceRepository.findById(instance.getId())
                .filter(i -> i.getNotificationRef() != null)
                .ifPresent(this::confirmBestEffort);
        return outcome;
    }

    private StepOutcome executeActions(WorkflowInstance instance) {
        String id = instance.getId();
        transactions.update(id, i -> checkpoints.before(i, "execute"));
        ActionResult result = actionExecutor.execute(instance);
        if (!result.isSuccessful()) {
            transactions.update(id, i -> {
                i.setReplySent(result.isReplySent());
                i.setLabelApplied(result.isLabelApplied());
                i.setActionErrors(result.errorSummary());
                return null;
            });
            return block(id, new PortFailure(result.failureKind(), result.errorSummary()));
        }
        return advance(id, WorkflowState.RESOLVED, "execute", i -> {
            i.setReplySent(result.isReplySent());
            i.setLabelApplied(result.isLabelApplied());
            i.setActionErrors(null);
            i.setCurrentState(WorkflowState.ACTION_EXECUTED);
        });
    }

    private StepOutcome confirm(WorkflowInstance instance) {
        transactions.update(instance.getId(), i -> checkpoints.before(i, "confirm"));
        confirmBestEffort(instance);
        return advance(instance.getId(), WorkflowState.ACTION_EXECUTED, "confirm",
                i -> i.setCurrentState(WorkflowState.CONFIRMED));
    }

    /**
     * A confirmation that cannot be delivered never holds the instance back.
     */
    private void confirmBestEffort(WorkflowInstance instance) {
        if (instance.getNotificationRef() == null) {
            return;
        }
        String text = formatter.outcome(instance);
        PortResult<Void> result = retryingCaller.call("confirm", instance.getId(),
                () -> notifier.confirm(instance.getUserId(), instance.getNotificationRef(), text));
        if (!result.isSuccess()) {
            logger.warn("Confirmation for instance {} not delivered: {}", instance.getId(), result.getFailure());
        }
    }

    /**
     * Writes the AFTER checkpoint and the mutation in one transaction, provided the instance is still
     * in {@code expected} and not blocked.
     */
    private StepOutcome advance(String instanceId, WorkflowState expected, String step, Consumer<WorkflowInstance> mutation) {
        return transactions.update(instanceId, instance -> {
            if (instance.getCurrentState() != expected || instance.isBlocked()) {
                return StepOutcome.noOp(instanceId, instance.getCurrentState(), "expected " + expected);
            }
            mutation.accept(instance);
            checkpoints.after(instance, step);
            logger.info("Instance {} {} -> {}", instanceId, expected, describe(instance));
            switch (instance.getCurrentState()) {
                case TERMINAL:
                    return StepOutcome.terminated(instanceId, String.valueOf(instance.getTerminalReason()));
                case AWAITING_APPROVAL:
                    return StepOutcome.suspended(instanceId);
                default:
                    return StepOutcome.advanced(instanceId, instance.getCurrentState());
            }
        });
    }

    private StepOutcome block(String instanceId, PortFailure failure) {
        PendingAction notice = transactions.update(instanceId, instance -> {
            instance.markBlocked(failure.kind(), failure.message());
            return recordNotice(instanceId, IdempotencyKeys.failureNotice(instanceId, instance.getBlockCount()),
                    formatter.failureNotice(instance, failure));
        });
        WorkflowInstance blocked = instanceRepository.findById(instanceId)
                .orElseThrow(() -> new WorkflowNotFoundException(instanceId));
        logger.error("Instance {} blocked in {} ({}): {}", instanceId, blocked.getCurrentState(), failure.kind(), failure.message());
        deliverNotice(blocked.getUserId(), notice);
        return StepOutcome.blocked(instanceId, blocked.getCurrentState(), failure.message());
    }

    /**
     * Sends again every failure notice that has not gone out yet. A notice whose earlier attempt
     * may have reached the channel is looked up there first.
     */
    public void redeliverNotices() {
        List<PendingAction> undelivered = pendingActionRepository.findByActionTypeAndStatusInAndAttemptsLessThan(
                ActionType.FAILURE_NOTICE, EnumSet.of(PendingActionStatus.PENDING, PendingActionStatus.FAILED),
                MAX_NOTICE_ATTEMPTS);
        if (undelivered.isEmpty()) {
            return;
        }
        logger.info("Redelivering {} failure notices", undelivered.size());
        for (PendingAction candidate : undelivered) {
            locks.withLock(candidate.getInstanceId(), () -> {
                PendingAction notice = pendingActionRepository.findById(candidate.getId()).orElse(null);
                Optional<WorkflowInstance> instance = instanceRepository.findById(candidate.getInstanceId());
                if (notice == null || instance.isEmpty() || notice.getStatus().isDelivered()) {
                    return null;
                }
                deliverNotice(instance.get().getUserId(), notice);
                return null;
            });
        }
    }

    /**
     * Stores the notice before anything is sent, in the caller's transaction. Returns the existing
     * row when the key was already recorded.
     */
    private PendingAction recordNotice(String instanceId, String key, String text) {
        return pendingActionRepository.findByIdempotencyKey(key).orElseGet(() -> {
            PendingAction notice = new PendingAction(instanceId, ActionType.FAILURE_NOTICE, key);
            notice.setPayload(text);
            return pendingActionRepository.save(notice);
        });
    }

    /**
     * Sends a recorded notice at most once. Failures are logged and picked up by {@link #redeliverNotices}.
     */
    private void deliverNotice(String userId, PendingAction notice) {
        if (notice.getStatus().isDelivered()) {
            return;
        }
        if (notice.getPayload() == null) {
            logger.warn("Notice {} has no text, not sending it", notice.getIdempotencyKey());
            return;
        }
        String key = notice.getIdempotencyKey();
        boolean earlierAttempt = notice.getAttempts() > 0;
        notice.setAttempts(notice.getAttempts() + 1);
        PendingAction attempt = pendingActionRepository.save(notice);
        PortResult<String> result = retryingCaller.callReconciled("alert", attempt.getInstanceId(), earlierAttempt,
                () -> notifier.findDelivered(userId, key, LookupWindow.since(attempt.getCreatedAt())),
                () -> notifier.alert(userId, key, attempt.getPayload()));
        if (result.isSuccess()) {
            attempt.setStatus(PendingActionStatus.SENT);
            attempt.setExternalRef(result.getValue());
            attempt.setLastError(null);
        } else {
            attempt.setStatus(PendingActionStatus.FAILED);
            attempt.setLastError(result.getFailure().toString());
            logger.warn("Notice {} for instance {} not delivered: {}", key, attempt.getInstanceId(), result.getFailure());
        }
        pendingActionRepository.save(attempt);
    }

    private static String describe(WorkflowInstance instance) {
        return instance.getCurrentState() == WorkflowState.TERMINAL
                ? "TERMINAL(" + instance.getTerminalReason() + ")"
                : instance.getCurrentState().name();
    }
}

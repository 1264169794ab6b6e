package com.example.mailagent.workflow.action;

import com.example.mailagent.domain.model.ActionType;
import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.domain.model.ErrorKind;
import com.example.mailagent.domain.model.FolderCategory;
import com.example.mailagent.domain.model.PendingAction;
import com.example.mailagent.domain.model.PendingActionStatus;
import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.domain.repository.FolderCategoryRepository;
import com.example.mailagent.domain.repository.PendingActionRepository;
import com.example.mailagent.integration.MailboxClient;
import com.example.mailagent.integration.MailboxReceipt;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.integration.ReplyRequest;
import com.example.mailagent.workflow.RetryingCaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Carries out an approved decision against the mailbox: the reply (when one is needed) and the
 * label/move. Each sub-action is guarded by its own idempotency key and succeeds or fails on its own.
 */
@Service
public class ActionExecutor {

    private static final Logger logger = LoggerFactory.getLogger(ActionExecutor.class);

    private final MailboxClient mailboxClient;
    private final PendingActionRepository pendingActionRepository;
    private final FolderCategoryRepository folderCategoryRepository;
    private final RetryingCaller retryingCaller;

    public ActionExecutor(MailboxClient mailboxClient,
                          PendingActionRepository pendingActionRepository,
                          FolderCategoryRepository folderCategoryRepository,
                          RetryingCaller retryingCaller) {
        this.mailboxClient = mailboxClient;
        this.pendingActionRepository = pendingActionRepository;
        this.folderCategoryRepository = folderCategoryRepository;
        this.retryingCaller = retryingCaller;
    }

    public ActionResult execute(WorkflowInstance instance) {
        Decision decision = instance.getDecision();
        if (decision == null || !decision.isAffirmative()) {
            return ActionResult.none();
        }
        List<PortFailure> errors = new ArrayList<>();

        boolean replySent = false;
        if (instance.isReplyWanted()) {
            PortResult<Boolean> reply = sendReply(instance);
            if (reply.isSuccess()) {
                replySent = reply.getValue();
            } else {
                errors.add(reply.getFailure());
            }
        }

        boolean labelApplied = false;
        PortResult<Boolean> label = applyLabel(instance);
        if (label.isSuccess()) {
            labelApplied = label.getValue();
        } else {
            errors.add(label.getFailure());
        }

        ActionResult result = new ActionResult(replySent, labelApplied, errors);
        logger.info("Actions for instance {} with decision {}: {}", instance.getId(), decision, result);
        return result;
    }

    private PortResult<Boolean> sendReply(WorkflowInstance instance) {
        String key = IdempotencyKeys.reply(instance.getId());
        String body = instance.getReplyBody();
        if (body == null || body.isBlank()) {
            return PortResult.failure(PortFailure.permanentFailure("No reply draft for instance " + instance.getId()));
        }
        Optional<PendingAction> existing = pendingActionRepository.findByIdempotencyKey(key);
        if (existing.isPresent() && existing.get().getStatus().isDelivered()) {
            logger.info("Skipping reply for instance {}: {} ({})", instance.getId(), ErrorKind.DUPLICATE_ACTION, key);
            if (existing.get().getStatus() == PendingActionStatus.SENT) {
                PortResult<Optional<MailboxReceipt>> lookup = mailboxClient.findReply(key);
                promote(existing.get(), lookup.isSuccess() ? lookup.getValue().orElse(null) : null);
            }
            return PortResult.success(true);
        }

        // A row left by an earlier run means the mailbox may already hold the reply
        PendingAction action = existing.orElseGet(() ->
                pendingActionRepository.save(new PendingAction(instance.getId(), ActionType.SEND_REPLY, key)));
        ReplyRequest request = new ReplyRequest(key,
                instance.getThreadId(),
                instance.getSender(),
                instance.getSubject(),
                instance.getRfcMessageId(),
                body);
        action.setAttempts(action.getAttempts() + 1);
        PortResult<MailboxReceipt> result = retryingCaller.callReconciled("sendReply", instance.getId(), existing.isPresent(),
                () -> mailboxClient.findReply(key),
                () -> mailboxClient.sendReply(request));
        if (!result.isSuccess()) {
            recordFailure(action, result.getFailure());
            return PortResult.failure(result.getFailure());
        }
        recordDelivered(action, result.getValue());
        return PortResult.success(true);
    }

    private PortResult<Boolean> applyLabel(WorkflowInstance instance) {
        String folder = instance.getTargetFolder();
        Optional<FolderCategory> category = folder == null
                ? Optional.empty()
                : folderCategoryRepository.findByUserIdAndName(instance.getUserId(), folder);
        if (category.isEmpty()) {
            return PortResult.failure(PortFailure.permanentFailure(
                    "Folder '" + folder + "' is not configured for user " + instance.getUserId()));
        }

        String key = IdempotencyKeys.label(instance.getId());
        String labelId = category.get().getLabelId();
        PendingAction action = pendingActionRepository.findByIdempotencyKey(key).orElse(null);
        if (action != null && action.getStatus().isDelivered()) {
            logger.info("Skipping label for instance {}: {} ({})", instance.getId(), ErrorKind.DUPLICATE_ACTION, key);
            if (action.getStatus() == PendingActionStatus.SENT) {
                PortResult<MailboxReceipt> readBack = mailboxClient.checkLabel(instance.getItemRef(), labelId);
                promote(action, readBack.isSuccess() ? readBack.getValue() : null);
            }
            return PortResult.success(true);
        }
        if (action == null) {
            action = pendingActionRepository.save(new PendingAction(instance.getId(), ActionType.APPLY_LABEL, key));
        }

        // Adding a label twice has no further effect, so a plain retry is safe here
        action.setAttempts(action.getAttempts() + 1);
        PortResult<MailboxReceipt> result = retryingCaller.call("applyLabel", instance.getId(),
                () -> mailboxClient.applyLabel(instance.getItemRef(), labelId));
        if (!result.isSuccess()) {
            recordFailure(action, result.getFailure());
            return PortResult.failure(result.getFailure());
        }
        recordDelivered(action, result.getValue());
        return PortResult.success(true);
    }

    /**
     * Marks the row SENT once the mailbox accepted the effect, then CONFIRMED if the receipt proves it.
     */
    private void recordDelivered(PendingAction action, MailboxReceipt receipt) {
        action.setExternalRef(receipt.externalId());
        action.setStatus(PendingActionStatus.SENT);
        action.setLastError(null);
        PendingAction saved = pendingActionRepository.save(action);
        promote(saved, receipt);
    }

    /**
     * SENT rows move on to CONFIRMED when a later read proves the effect. Without proof they stay SENT,
     * which still counts as delivered.
     */
    private void promote(PendingAction action, MailboxReceipt receipt) {
        if (receipt == null || !receipt.confirmed() || action.getStatus() != PendingActionStatus.SENT) {
            return;
        }
        if (action.getExternalRef() == null) {
            action.setExternalRef(receipt.externalId());
        }
        action.setStatus(PendingActionStatus.CONFIRMED);
        pendingActionRepository.save(action);
        logger.debug("Action {} confirmed by the mailbox", action.getIdempotencyKey());
    }

    private void recordFailure(PendingAction action, PortFailure failure) {
        action.setStatus(PendingActionStatus.FAILED);
        action.setLastError(failure.toString());
        pendingActionRepository.save(action);
    }
}

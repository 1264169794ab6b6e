package com.example.mailagent.controller;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.integration.PortResult;
import com.example.mailagent.integration.ReplyMode;
import com.example.mailagent.integration.mattermost.MattermostNotifier;
import com.example.mailagent.integration.mattermost.model.ActionCallback;
import com.example.mailagent.integration.mattermost.model.ActionCallbackResponse;
import com.example.mailagent.integration.mattermost.model.DialogSubmission;
import com.example.mailagent.integration.mattermost.model.DialogSubmissionResponse;
import com.example.mailagent.service.ApprovalEvent;
import com.example.mailagent.service.ApprovalGateway;
import com.example.mailagent.service.GatewayResult;
import com.example.mailagent.workflow.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.MessageDigest;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * Receives Mattermost interactive message actions (button clicks and folder picks) and the
 * submissions of the reply editor dialog.
 */
@RestController
@RequestMapping("/api/v1/approvals")
public class ApprovalCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalCallbackController.class);
    private final ApprovalGateway approvalGateway;
    private final MattermostNotifier mattermostNotifier;
    private final String callbackToken;

    public ApprovalCallbackController(ApprovalGateway approvalGateway,
                                      MattermostNotifier mattermostNotifier,
                                      MailAgentProperties properties) {
        this.approvalGateway = approvalGateway;
        this.mattermostNotifier = mattermostNotifier;
        this.callbackToken = properties.getMattermost().getCallbackToken();
    }

    @PostMapping("/mattermost")
    public ResponseEntity<ActionCallbackResponse> onAction(@RequestBody ActionCallback callback) {
        Map<String, Object> context = callback.getContext() != null ? callback.getContext() : Collections.emptyMap();
        if (!tokenMatches(asString(context.get(MattermostNotifier.CONTEXT_TOKEN)))) {
            logger.warn("Rejected action callback with a bad token from user {}", callback.getUser_id());
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ActionCallbackResponse.ephemeral("This action could not be verified."));
        }

        String correlationKey = asString(context.get(MattermostNotifier.CONTEXT_CORRELATION_KEY));
        Decision decision;
        ReplyMode replyMode;
        try {
            decision = Decision.fromWire(asString(context.get(MattermostNotifier.CONTEXT_DECISION)));
            replyMode = ReplyMode.fromWire(asString(context.get(MattermostNotifier.CONTEXT_REPLY_MODE)));
        } catch (IllegalArgumentException e) {
            logger.info("Unreadable decision in callback for {}: {}", correlationKey, e.getMessage());
            return ResponseEntity.ok(ActionCallbackResponse.ephemeral("This action is not supported."));
        }
        String folder = asString(context.get(MattermostNotifier.CONTEXT_FOLDER));
        if (folder == null) {
            folder = asString(context.get(MattermostNotifier.CONTEXT_SELECTED_OPTION));
        }

        if (replyMode == ReplyMode.EDIT) {
            return ResponseEntity.ok(ActionCallbackResponse.ephemeral(
                    openReplyEditor(correlationKey, callback.getUser_id(), callback.getTrigger_id())));
        }

        logger.info("Action {} ({} reply) for {} from Mattermost user {}", decision, replyMode, correlationKey, callback.getUser_id());
        GatewayResult result = approvalGateway.onExternalEvent(new ApprovalEvent(correlationKey, decision,
                callback.getUser_id(), folder, null, replyMode == ReplyMode.NONE));
        return ResponseEntity.ok(ActionCallbackResponse.ephemeral(replyFor(result)));
    }

    /**
     * The reply editor submits here. Submitting approves the suggested folder with the edited reply.
     */
    @PostMapping("/mattermost/dialog")
    public ResponseEntity<DialogSubmissionResponse> onDialogSubmission(@RequestBody DialogSubmission submission) {
        if (!tokenMatches(submission.getState())) {
            logger.warn("Rejected dialog submission with a bad state from user {}", submission.getUser_id());
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(new DialogSubmissionResponse("This action could not be verified.", null));
        }
        if (submission.isCancelled()) {
            logger.info("Reply editor for {} cancelled by {}", submission.getCallback_id(), submission.getUser_id());
            return ResponseEntity.ok(DialogSubmissionResponse.closed());
        }
        Map<String, Object> fields = submission.getSubmission() != null ? submission.getSubmission() : Collections.emptyMap();
        String reply = asString(fields.get(MattermostNotifier.DIALOG_REPLY_FIELD));
        if (reply == null || reply.isBlank()) {
            return ResponseEntity.ok(DialogSubmissionResponse.fieldError(MattermostNotifier.DIALOG_REPLY_FIELD,
                    "Please enter a reply."));
        }

        logger.info("Edited reply for {} from Mattermost user {}", submission.getCallback_id(), submission.getUser_id());
        GatewayResult result = approvalGateway.onExternalEvent(new ApprovalEvent(submission.getCallback_id(),
                Decision.APPROVE, submission.getUser_id(), null, reply, false));
        if (result.getStatus() == GatewayResult.Status.RESUMED) {
            return ResponseEntity.ok(DialogSubmissionResponse.closed());
        }
        return ResponseEntity.ok(new DialogSubmissionResponse(replyFor(result), null));
    }

    private String openReplyEditor(String correlationKey, String actorId, String triggerId) {
        Optional<String> draft = approvalGateway.editableReply(correlationKey, actorId);
        if (draft.isEmpty()) {
            return replyFor(GatewayResult.stale());
        }
        PortResult<Void> opened = mattermostNotifier.openReplyEditor(triggerId, correlationKey, draft.get());
        if (!opened.isSuccess()) {
            logger.warn("Reply editor for {} did not open: {}", correlationKey, opened.getFailure());
            return "The reply editor could not be opened. Please try again.";
        }
        return "Edit the reply and press Send to approve.";
    }

    static String replyFor(GatewayResult result) {
        switch (result.getStatus()) {
            case RESUMED:
                if (result.getOutcome() != null && result.getOutcome().getKind() == StepOutcome.Kind.BLOCKED) {
                    return "Your decision was saved, but carrying it out failed. You will get a notice with details.";
                }
                return "Got it: " + result.getDecision().toWire() + ".";
            case DUPLICATE:
                return "This email was already handled (" + result.getDecision().toWire() + ")" + effects(result) + ".";
            case FORBIDDEN:
                return "You can only decide on your own emails.";
            case INVALID:
                return "Please pick one of your folders.";
            case STALE:
            default:
                return "This request is no longer active.";
        }
    }

    private static String effects(GatewayResult result) {
        if (result.isLabelApplied() && result.isReplySent()) {
            return ": moved and replied";
        }
        if (result.isLabelApplied()) {
            return ": moved";
        }
        return result.isReplySent() ? ": replied" : "";
    }

    private boolean tokenMatches(String presented) {
        if (callbackToken == null || callbackToken.isEmpty()) {
            return true;
        }
        if (presented == null) {
            return false;
        }
        return MessageDigest.isEqual(callbackToken.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}

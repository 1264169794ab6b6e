package com.example.mailagent.service;

import com.example.mailagent.domain.model.Decision;
import com.example.mailagent.domain.model.FolderCategory;
import com.example.mailagent.domain.model.TerminalReason;
import com.example.mailagent.domain.model.WorkflowInstance;
import com.example.mailagent.integration.ActionOption;
import com.example.mailagent.integration.ActionSet;
import com.example.mailagent.integration.PortFailure;
import com.example.mailagent.integration.ReplyMode;
import com.example.mailagent.util.MessageSanitizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the chat texts and action sets sent to users. All email derived content is escaped here.
 */
@Component
public class NotificationMessageFormatter {

    private static final int PREVIEW_LENGTH = 300;
    private static final int DRAFT_LENGTH = 1500;

    public String proposal(WorkflowInstance instance) {
        StringBuilder text = new StringBuilder();
        if (instance.isPriority()) {
            text.append("**Priority email** (score ").append(instance.getPriorityScore()).append(")\n");
        }
        text.append("**From:** ").append(MessageSanitizer.forChat(instance.getSender())).append('\n');
        text.append("**Subject:** ").append(MessageSanitizer.forChat(instance.getSubject())).append('\n');
        text.append("**Suggested folder:** ").append(MessageSanitizer.forChat(instance.getProposedFolder())).append('\n');
        if (instance.getReasoning() != null && !instance.getReasoning().isBlank()) {
            text.append("**Why:** ").append(MessageSanitizer.forChat(instance.getReasoning())).append('\n');
        }
        String preview = MessageSanitizer.truncate(MessageSanitizer.forChat(instance.getBody()), PREVIEW_LENGTH);
        if (preview != null && !preview.isBlank()) {
            text.append('\n').append(preview).append('\n');
        }
        if (instance.isNeedsResponse() && instance.getDraftResponse() != null) {
            text.append("\n**Reply that will be sent on approval:**\n");
            text.append(MessageSanitizer.truncate(MessageSanitizer.forChat(instance.getDraftResponse()), DRAFT_LENGTH));
        }
        return MessageSanitizer.truncate(text.toString(), MessageSanitizer.MAX_MESSAGE_LENGTH);
    }

    /**
     * Approve and reject, plus one change option per other folder the user has.
     */
    public ActionSet actionSet(WorkflowInstance instance, List<FolderCategory> folders) {
        List<ActionOption> options = new ArrayList<>();
        options.add(new ActionOption("Approve", Decision.APPROVE, null));
        if (instance.isNeedsResponse() && instance.getDraftResponse() != null && !instance.getDraftResponse().isBlank()) {
            options.add(new ActionOption("Edit reply", Decision.APPROVE, null, ReplyMode.EDIT));
            options.add(new ActionOption("Approve without reply", Decision.APPROVE, null, ReplyMode.NONE));
        }
        options.add(new ActionOption("Reject", Decision.REJECT, null));
        for (FolderCategory folder : folders) {
            if (!folder.getName().equals(instance.getProposedFolder())) {
                options.add(new ActionOption(folder.getName(), Decision.CHANGE, folder.getName()));
            }
        }
        return new ActionSet(instance.getCorrelationKey(), options);
    }

    public String digestSummary(List<WorkflowInstance> instances) {
        Map<String, Integer> byCategory = new TreeMap<>();
        for (WorkflowInstance instance : instances) {
            String category = instance.getCategory() != null ? instance.getCategory() : "Uncategorized";
            byCategory.merge(category, 1, Integer::sum);
        }
        StringBuilder text = new StringBuilder();
        text.append("**Daily digest:** ").append(instances.size())
                .append(instances.size() == 1 ? " email" : " emails").append(" waiting for review\n");
        byCategory.forEach((category, count) ->
                text.append("- ").append(MessageSanitizer.forChat(category)).append(": ").append(count).append('\n'));
        return text.toString();
    }

    public String digestItem(WorkflowInstance instance) {
        return "**" + MessageSanitizer.forChat(instance.getSubject()) + "**\n"
                + "From " + MessageSanitizer.forChat(instance.getSender())
                + ", suggested folder " + MessageSanitizer.forChat(instance.getProposedFolder());
    }

    public String outcome(WorkflowInstance instance) {
        if (instance.getTerminalReason() == TerminalReason.REJECTED) {
            return instance.getDecision() == Decision.REJECT
                    ? "Rejected. The email stays in your inbox."
                    : "Cancelled. No action was taken.";
        }
        StringBuilder text = new StringBuilder();
        if (instance.isLabelApplied()) {
            text.append("Moved to ").append(MessageSanitizer.forChat(instance.getTargetFolder())).append('.');
        }
        if (instance.isReplySent()) {
            text.append(text.length() > 0 ? " " : "").append("Reply sent.");
        } else if (instance.isReplyDeclined()) {
            text.append(text.length() > 0 ? " " : "").append("No reply sent.");
        }
        if (text.length() == 0) {
            text.append("Done.");
        }
        return "**" + MessageSanitizer.forChat(instance.getSubject()) + "**: " + text;
    }

    public String failureNotice(WorkflowInstance instance, PortFailure failure) {
        return "Could not finish processing **" + MessageSanitizer.forChat(instance.getSubject()) + "**"
                + " from " + MessageSanitizer.forChat(instance.getSender()) + ".\n"
                + "Reason: " + MessageSanitizer.forChat(failure.message()) + "\n"
                + "It will stay on hold until it is retried.";
    }

    public String manualReview(WorkflowInstance instance) {
        return "Could not classify **" + MessageSanitizer.forChat(instance.getSubject()) + "**"
                + " from " + MessageSanitizer.forChat(instance.getSender()) + ". Please sort it manually.";
    }
}

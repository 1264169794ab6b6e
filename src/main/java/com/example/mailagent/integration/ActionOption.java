package com.example.mailagent.integration;

import com.example.mailagent.domain.model.Decision;

/**
 * One button offered to the user. {@code folder} is only set for change options.
 */
public record ActionOption(String label, Decision decision, String folder, ReplyMode replyMode) {

    public ActionOption(String label, Decision decision, String folder) {
        this(label, decision, folder, ReplyMode.DRAFT);
    }
}

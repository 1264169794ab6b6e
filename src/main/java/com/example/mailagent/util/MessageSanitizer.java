package com.example.mailagent.util;

import java.util.regex.Pattern;

/**
 * Cleans untrusted email content before it is shown in chat or written into mail headers.
 */
public final class MessageSanitizer {

    /** Mattermost rejects posts above 16383 characters; stay well below. */
    public static final int MAX_MESSAGE_LENGTH = 4000;

    private static final Pattern SCRIPT_BLOCK = Pattern.compile("(?is)<script.*?>.*?</script>");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern LINE_BREAKS = Pattern.compile("[\\r\\n]+");
    private static final Pattern MARKDOWN_SPECIALS = Pattern.compile("([\\\\`*_~#|\\[\\]<>])");

    private MessageSanitizer() {
    }

    /**
     * Removes script blocks and control characters, keeping newlines and tabs.
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = SCRIPT_BLOCK.matcher(value).replaceAll("");
        return CONTROL_CHARS.matcher(cleaned).replaceAll("");
    }

    /**
     * Cleans the value and escapes Markdown so sender-controlled text cannot format or link.
     */
    public static String forChat(String value) {
        return MARKDOWN_SPECIALS.matcher(clean(value)).replaceAll("\\\\$1");
    }

    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength - 3)) + "...";
    }

    /**
     * Single line value safe for an RFC 822 header.
     */
    public static String headerValue(String value) {
        if (value == null) {
            return "";
        }
        return LINE_BREAKS.matcher(clean(value)).replaceAll(" ").trim();
    }
}

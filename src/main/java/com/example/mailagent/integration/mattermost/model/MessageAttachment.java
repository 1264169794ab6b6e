package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Mattermost message attachment carrying interactive actions.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageAttachment {
    private String fallback;
    private String color;
    private String title;
    private String text;
    private List<Action> actions;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Action {
        private String id;
        private String name;
        private String type; // "button" or "select"
        private String style;
        private List<SelectOption> options;
        private Integration integration;
    }

    @Data
    @Builder
    public static class SelectOption {
        private String text;
        private String value;
    }

    @Data
    @Builder
    public static class Integration {
        private String url;
        private Map<String, Object> context;
    }
}

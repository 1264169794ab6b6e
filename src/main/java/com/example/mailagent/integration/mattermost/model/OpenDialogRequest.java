package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Interactive dialog, opened in answer to a button click while its trigger id is still valid.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OpenDialogRequest {
    private String trigger_id;
    private String url;
    private Dialog dialog;

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Dialog {
        private String callback_id;
        private String title;
        private String introduction_text;
        private String submit_label;
        private String state;
        private List<Element> elements;
    }

    @Data
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Element {
        private String display_name;
        private String name;
        private String type;
        private String subtype;
        private String default_value;
        private Integer max_length;
        private boolean optional;
    }
}

package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendPostRequest {
    private String channel_id;
    private String message;
    private String root_id;
    private Map<String, Object> props;
    private PostMetadata metadata;

    @Data
    @Builder
    public static class PostMetadata {
        private Priority priority;
    }

    @Data
    @Builder
    public static class Priority {
        private String priority;
        private boolean requested_ack;
    }
}

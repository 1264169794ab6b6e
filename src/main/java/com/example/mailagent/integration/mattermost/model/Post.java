package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Post {
    private String id;
    private long create_at;
    private long update_at;
    private String user_id;
    private String channel_id;
    private String root_id;
    private String message;
    private String type;
    private Map<String, Object> props;
}

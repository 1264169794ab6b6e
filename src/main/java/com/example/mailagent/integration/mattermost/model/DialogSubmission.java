package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DialogSubmission {
    private String type;
    private String callback_id;
    private String state;
    private String user_id;
    private String channel_id;
    private boolean cancelled;
    private Map<String, Object> submission;
}

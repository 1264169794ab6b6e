package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

/**
 * Body Mattermost posts to the integration URL when a user clicks a button or picks an option.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionCallback {
    private String user_id;
    private String user_name;
    private String channel_id;
    private String post_id;
    private String trigger_id;
    private String type;
    private Map<String, Object> context;
}

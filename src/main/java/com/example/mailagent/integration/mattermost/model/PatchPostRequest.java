package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatchPostRequest {
    private String message;
    private Map<String, Object> props;
}

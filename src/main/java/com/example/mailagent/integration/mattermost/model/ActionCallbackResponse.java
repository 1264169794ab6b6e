package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionCallbackResponse {
    private String ephemeral_text;

    public static ActionCallbackResponse ephemeral(String text) {
        return new ActionCallbackResponse(text);
    }
}

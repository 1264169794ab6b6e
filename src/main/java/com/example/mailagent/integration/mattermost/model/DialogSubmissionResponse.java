package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * An empty body closes the dialog. {@code errors} keeps it open with messages next to the fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DialogSubmissionResponse {
    private String error;
    private Map<String, String> errors;

    public static DialogSubmissionResponse closed() {
        return new DialogSubmissionResponse();
    }

    public static DialogSubmissionResponse fieldError(String field, String message) {
        return new DialogSubmissionResponse(null, Map.of(field, message));
    }
}

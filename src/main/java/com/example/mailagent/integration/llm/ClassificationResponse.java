package com.example.mailagent.integration.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

/**
 * Structured answer the model is asked to produce.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"category", "suggested_folder", "reasoning", "priority_score", "needs_response", "response_draft"})
public class ClassificationResponse {

    @JsonProperty("category")
    private String category;

    @JsonProperty("suggested_folder")
    private String suggestedFolder;

    @JsonProperty("reasoning")
    private String reasoning;

    @JsonProperty("priority_score")
    private int priorityScore;

    @JsonProperty("needs_response")
    private boolean needsResponse;

    @JsonProperty("response_draft")
    private String responseDraft;
}

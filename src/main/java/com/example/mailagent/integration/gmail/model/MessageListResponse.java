package com.example.mailagent.integration.gmail.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessageListResponse {
    private List<GmailMessage> messages;
    private Integer resultSizeEstimate;
}

package com.example.mailagent.integration.gmail.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class GmailMessage {
    private String id;
    private String threadId;
    private List<String> labelIds;
}

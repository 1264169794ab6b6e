package com.example.mailagent.controller;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundEmailRequest {
    private String userId;
    private String messageId;
    private String threadId;
    private String rfcMessageId;
    private String sender;
    private String subject;
    private String body;
    private LocalDateTime receivedAt;
}

package com.example.mailagent.integration.gmail.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SendMessageRequest {
    // base64url encoded RFC 822 message
    private String raw;
    private String threadId;
}

package com.example.mailagent.integration.gmail.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class ModifyMessageRequest {
    private List<String> addLabelIds;
    private List<String> removeLabelIds;
}

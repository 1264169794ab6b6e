package com.example.mailagent.integration;

public record Classification(String category,
                             String proposedFolder,
                             int priorityScore,
                             String reasoning,
                             boolean needsResponse,
                             String draftResponse) {
}

package com.example.mailagent.domain.model;

public enum CheckpointPhase {
    BEFORE,
    AFTER
}

package com.example.mailagent.domain.model;

public enum ActionType {
    NOTIFY,
    SEND_REPLY,
    APPLY_LABEL,
    FAILURE_NOTICE
}

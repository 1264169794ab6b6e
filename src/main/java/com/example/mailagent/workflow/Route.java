package com.example.mailagent.workflow;

public enum Route {
    IMMEDIATE,
    BATCH
}

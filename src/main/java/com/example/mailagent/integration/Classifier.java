package com.example.mailagent.integration;

public interface Classifier {

    PortResult<Classification> classify(EmailItem item);
}

package com.example.mailagent.integration;

import java.util.List;

/**
 * The choices attached to a notification, all bound to one correlation key.
 */
public record ActionSet(String correlationKey, List<ActionOption> options) {
}

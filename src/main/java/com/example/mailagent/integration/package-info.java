/**
 * Ports the engine depends on (classifier, notifier, mailbox) and their adapters.
 * Every port call returns a {@link com.example.mailagent.integration.PortResult}.
 */
package com.example.mailagent.integration;

/**
 * Spring configuration: bound {@code mailagent.*} properties, executors, LLM client and scheduling.
 */
package com.example.mailagent.config;

package com.pawpal.core.model;

/**
 * Thrown when a task id cannot be resolved within an owner's aggregate.
 */
public class TaskNotFoundException extends RuntimeException {
    public TaskNotFoundException(String message) {
        super(message);
    }
}

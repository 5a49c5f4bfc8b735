package com.vidnyan.rulecov.application.service;

/**
 * Value or failure of one pooled task.
 */
public record TaskOutcome<T>(T value, Throwable error) {

    public static <T> TaskOutcome<T> success(T value) {
        return new TaskOutcome<>(value, null);
    }

    public static <T> TaskOutcome<T> failure(Throwable error) {
        return new TaskOutcome<>(null, error);
    }

    public boolean succeeded() {
        return error == null;
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}

package com.bko.workouttracker.workout;

import java.util.List;

/**
 * Result of a session operation. The training is always a consistent aggregate: the updated one on success,
 * the unchanged one otherwise.
 */
public record SessionOutcome(Status status, Training training, List<SetIssue> issues, List<String> messages) {

    public enum Status {
        SAVED,
        IGNORED,
        INVALID,
        STORE_FAILED
    }

    public SessionOutcome {
        issues = issues == null ? List.of() : List.copyOf(issues);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public static SessionOutcome saved(Training training, List<String> messages) {
        return new SessionOutcome(Status.SAVED, training, List.of(), messages);
    }

    public static SessionOutcome ignored(Training training) {
        return new SessionOutcome(Status.IGNORED, training, List.of(), List.of("Set not entered, nothing saved."));
    }

    public static SessionOutcome invalid(Training training, List<SetIssue> issues) {
        List<String> messages = issues.stream().map(SetIssue::describe).toList();
        return new SessionOutcome(Status.INVALID, training, issues, messages);
    }

    public static SessionOutcome storeFailed(Training training, String message) {
        return new SessionOutcome(Status.STORE_FAILED, training, List.of(), List.of(message));
    }

    public boolean isSuccess() {
        return status == Status.SAVED || status == Status.IGNORED;
    }
}

package io.notify4j.core;

/**
 * Thrown when a create/update/toggle request violates a schedule invariant.
 * No state has been changed when this is raised.
 */
public class ScheduleValidationException extends NotifierException {

    private final ValidationFailure failure;

    public ScheduleValidationException(ValidationFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ValidationFailure failure() {
        return failure;
    }
}

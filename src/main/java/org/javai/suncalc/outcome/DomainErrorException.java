package org.javai.suncalc.outcome;

/**
 * Raised by {@link Outcome#getOrThrow()} when the sunrise or sunset asked for does not happen on
 * that date, for example during the midnight sun. Carries the {@link DomainError} with the
 * offending hour-angle ratio.
 */
public class DomainErrorException extends RuntimeException {

    private final DomainError error;

    public DomainErrorException(DomainError error) {
        super("No solar event: " + error.message());
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}

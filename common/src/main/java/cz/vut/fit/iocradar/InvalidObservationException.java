package cz.vut.fit.iocradar;

/**
 * Thrown when an observation is malformed (e.g., its value or kind is missing) and must be rejected before
 * normalization.
 */
public class InvalidObservationException extends IllegalArgumentException {
    public InvalidObservationException(String message) {
        super(message);
    }
}

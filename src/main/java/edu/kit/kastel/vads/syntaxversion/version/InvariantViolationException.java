package edu.kit.kastel.vads.syntaxversion.version;

/// Thrown when the caller breaks a precondition of the detector. Not meant to be recovered from.
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(String message) {
        super(message);
    }
}

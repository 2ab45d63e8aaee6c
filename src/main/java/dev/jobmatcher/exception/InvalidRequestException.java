package dev.jobmatcher.exception;

/**
 * Input rejected before any scoring or search work starts.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}

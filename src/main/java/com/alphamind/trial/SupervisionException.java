package com.alphamind.trial;

/**
 * Unexpected failure while reading or classifying trial output.
 */
public class SupervisionException extends TrialException {
    public SupervisionException(String message, Throwable cause) {
        super(message, cause);
    }
}

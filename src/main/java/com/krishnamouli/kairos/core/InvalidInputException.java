package com.krishnamouli.kairos.core;

/**
 * Raised when a caller passes a value outside an operation's domain:
 * a non-positive half-life, more successes than trials, a confidence level
 * outside (0, 1), a non-positive capacity or an invalid weighting.
 * Never raised for empty text, empty corpora or short sequences, which all
 * have defined results.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}

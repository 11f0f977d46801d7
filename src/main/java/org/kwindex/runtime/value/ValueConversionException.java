package org.kwindex.runtime.value;

/**
 * Thrown when a value cannot be given a requested interpretation.
 * <p>
 * This is an ordinary, recoverable outcome: the value keeps whatever interpretation it
 * had before the attempt.
 */
public class ValueConversionException extends Exception {

    public ValueConversionException(String message) {
        super(message);
    }
}

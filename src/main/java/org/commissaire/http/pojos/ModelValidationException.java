package org.commissaire.http.pojos;

/**
 * Thrown by a model's {@code validate()} when its data is unusable.
 */
public class ModelValidationException extends Exception {

    public ModelValidationException(String message) {
        super(message);
    }
}

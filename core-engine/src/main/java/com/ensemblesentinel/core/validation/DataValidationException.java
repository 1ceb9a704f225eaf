package com.ensemblesentinel.core.validation;

/**
 * Thrown when a {@link com.ensemblesentinel.core.model.DataPoint} is malformed
 * and must not enter the detection pipeline.
 *
 * @since 1.0.0
 */
public class DataValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DataValidationException(String message) {
        super(message);
    }
}

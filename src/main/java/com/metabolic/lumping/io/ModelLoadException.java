package com.metabolic.lumping.io;

/**
 * A model or thermodynamic database could not be loaded. Fatal for the run that
 * requested it.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.phillippitts.focusmanager.exception;

/**
 * Base exception for all focus-manager application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class FocusManagerException extends RuntimeException {

    public FocusManagerException(String message, Throwable cause) {
        super(message, cause);
    }
}

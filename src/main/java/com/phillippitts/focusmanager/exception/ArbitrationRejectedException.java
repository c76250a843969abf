package com.phillippitts.focusmanager.exception;

/**
 * Thrown when a task is submitted to an arbitration executor that has been shut down.
 * Focus managers translate this into a rejected request rather than propagating it to callers.
 */
public class ArbitrationRejectedException extends FocusManagerException {

    private final String executorName;

    public ArbitrationRejectedException(String executorName, Throwable cause) {
        super("Arbitration executor is shut down: " + executorName, cause);
        this.executorName = executorName;
    }

    public String getExecutorName() {
        return executorName;
    }
}

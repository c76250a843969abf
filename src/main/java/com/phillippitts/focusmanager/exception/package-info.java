/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.focusmanager.exception.FocusManagerException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.focusmanager.exception.ArbitrationRejectedException} - Thrown when
 *       work is submitted to an arbitration executor after shutdown</li>
 * </ul>
 *
 * <p>Request-level failures (unknown channel, release by a non-owner, stale stop requests) are
 * not exceptions: they are reported through return values and logged.
 *
 * @see com.phillippitts.focusmanager.exception.FocusManagerException
 * @since 1.0
 */
package com.phillippitts.focusmanager.exception;

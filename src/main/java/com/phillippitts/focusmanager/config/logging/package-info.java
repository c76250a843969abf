/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) propagation.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.focusmanager.config.logging.MdcTaskDecorator} - carries the
 *       caller's {@code ThreadContext} onto the arbitration worker so that log lines written while
 *       a queued request runs keep the caller's correlation keys</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [audio-focus-1] [requestId] DEBUG logger.name - message
 * </pre>
 *
 * @see org.apache.logging.log4j.ThreadContext
 * @since 1.0
 */
package com.phillippitts.focusmanager.config.logging;

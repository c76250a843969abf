package com.phillippitts.focusmanager.domain;

/**
 * Focus state of a channel.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * NONE → FOREGROUND | BACKGROUND (channel acquired)
 * FOREGROUND ↔ BACKGROUND (preemption / promotion)
 * FOREGROUND | BACKGROUND → NONE (released or stopped)
 * </pre>
 *
 * @since 1.0
 */
public enum FocusState {

    /** Channel is not held by any interface. */
    NONE,

    /** Channel is held but another active channel has higher priority. */
    BACKGROUND,

    /** Channel is held and is the highest-priority active channel. At most one at a time. */
    FOREGROUND
}

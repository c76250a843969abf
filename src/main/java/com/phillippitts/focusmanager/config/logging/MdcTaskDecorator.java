package com.phillippitts.focusmanager.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.task.TaskDecorator;

import java.util.Map;

/**
 * Copies Log4j2's MDC (ThreadContext) from the submitting thread to the arbitration worker.
 *
 * <p>The context map is captured when the task is decorated (on the caller thread) and installed
 * around the task on the worker thread. The worker's previous context is restored afterwards so
 * values never leak from one arbitration task into the next.
 */
public class MdcTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}

package com.phillippitts.focusmanager.service.health;

import com.phillippitts.focusmanager.service.focus.DefaultFocusManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the focus managers' arbitration workers.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: every arbitration worker is running</li>
 *   <li>DOWN: at least one worker has stopped (requests to that manager are rejected)</li>
 * </ul>
 *
 * <p>Each manager contributes a detail with its worker status and current foreground channel.
 * Exposed via the /actuator/health endpoint.
 */
@Component
public class FocusManagerHealthIndicator implements HealthIndicator {

    private static final String NO_FOREGROUND = "none";

    private final List<DefaultFocusManager> focusManagers;

    public FocusManagerHealthIndicator(List<DefaultFocusManager> focusManagers) {
        this.focusManagers = focusManagers;
    }

    @Override
    public Health health() {
        boolean allRunning = true;
        Health.Builder builder = new Health.Builder();

        for (DefaultFocusManager manager : focusManagers) {
            boolean running = manager.getExecutor().isRunning();
            allRunning &= running;
            String foreground = manager.getForegroundChannel().orElse(NO_FOREGROUND);
            builder.withDetail(manager.getName(),
                    (running ? "running" : "stopped") + ", foreground=" + foreground);
        }

        if (allRunning) {
            builder.up();
        } else {
            builder.down();
        }
        return builder.build();
    }
}

package com.phillippitts.focusmanager.config;

import com.phillippitts.focusmanager.domain.ChannelState;
import com.phillippitts.focusmanager.service.arbitration.SerialArbitrationExecutor;
import com.phillippitts.focusmanager.service.focus.DefaultFocusManager;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for arbitration worker metrics exposure via Micrometer.
 *
 * <p>Exposes, per focus manager:
 * <ul>
 *   <li>focusmanager.arbitration.queued{lane=urgent|normal} - Tasks waiting in each lane</li>
 *   <li>focusmanager.arbitration.active - Tasks currently executing on the worker</li>
 *   <li>focusmanager.arbitration.completed - Cumulative count of executed tasks</li>
 *   <li>focusmanager.channels.active - Channels currently held (FOREGROUND or BACKGROUND)</li>
 * </ul>
 *
 * <p>Additionally logs an arbitration summary every 5 minutes for operational visibility.
 */
@Configuration
public class ArbitrationMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ArbitrationMetricsConfig.class);

    private final ObjectProvider<DefaultFocusManager> focusManagers;

    public ArbitrationMetricsConfig(ObjectProvider<DefaultFocusManager> focusManagers) {
        this.focusManagers = focusManagers;
    }

    /**
     * Binds arbitration worker metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder arbitrationMetrics() {
        return registry -> focusManagers.orderedStream().forEach(manager -> {
            String name = manager.getName();
            SerialArbitrationExecutor arbitration = manager.getExecutor();
            ThreadPoolExecutor executor = arbitration.getThreadPoolExecutor();

            Gauge.builder("focusmanager.arbitration.queued", arbitration, SerialArbitrationExecutor::getPendingUrgentCount)
                    .description("Arbitration tasks waiting in the urgent lane")
                    .tag("manager", name)
                    .tag("lane", "urgent")
                    .register(registry);

            Gauge.builder("focusmanager.arbitration.queued", arbitration, SerialArbitrationExecutor::getPendingNormalCount)
                    .description("Arbitration tasks waiting in the normal lane")
                    .tag("manager", name)
                    .tag("lane", "normal")
                    .register(registry);

            Gauge.builder("focusmanager.arbitration.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Arbitration tasks currently executing (0 or 1)")
                    .tag("manager", name)
                    .register(registry);

            Gauge.builder("focusmanager.arbitration.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of executed arbitration tasks")
                    .tag("manager", name)
                    .register(registry);

            Gauge.builder("focusmanager.channels.active", manager, m -> countActiveChannels(m))
                    .description("Channels currently held by an interface")
                    .tag("manager", name)
                    .register(registry);

            LOG.info("Arbitration metrics registered for focus manager '{}'", name);
        });
    }

    /**
     * Logs an arbitration summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logArbitrationHealth() {
        focusManagers.orderedStream().forEach(manager -> {
            SerialArbitrationExecutor arbitration = manager.getExecutor();
            ThreadPoolExecutor executor = arbitration.getThreadPoolExecutor();
            LOG.info("Focus manager '{}': running={}, foreground={}, active={}, queued={}/{}, completed={}",
                    manager.getName(),
                    arbitration.isRunning(),
                    manager.getForegroundChannel().orElse("none"),
                    countActiveChannels(manager),
                    arbitration.getPendingUrgentCount(),
                    arbitration.getPendingNormalCount(),
                    executor.getCompletedTaskCount());
        });
    }

    static long countActiveChannels(DefaultFocusManager manager) {
        return manager.getChannelStates().stream().filter(ChannelState::isActive).count();
    }
}

package com.phoenixdash.app.config;

import com.phoenixdash.common.config.PhoenixDashConfig;
import com.phoenixdash.gateway.node.NodeConnection;
import com.phoenixdash.gateway.node.NodeConnectionRegistry;
import com.phoenixdash.gateway.recurring.RecurringPaymentScheduler;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the recurring payment poller once the application is ready and stops
 * it on shutdown.
 */
@Slf4j
@Component
public class SchedulerBootstrap {

    private final RecurringPaymentScheduler scheduler;
    private final NodeConnectionRegistry connections;
    private final PhoenixDashConfig config;

    public SchedulerBootstrap(RecurringPaymentScheduler scheduler, NodeConnectionRegistry connections,
            PhoenixDashConfig config) {
        this.scheduler = scheduler;
        this.connections = connections;
        this.config = config;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        PhoenixDashConfig.RecurringConfig recurring = config.getRecurring();
        if (!recurring.isEnabled()) {
            log.info("Recurring payment scheduler disabled by config");
            return;
        }
        String active = connections.getActiveConnection().map(NodeConnection::getName).orElse("none");
        log.info("Starting recurring payment scheduler (interval {}ms, active connection: {})",
                recurring.getIntervalMs(), active);
        scheduler.start(recurring.getIntervalMs());
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler.isRunning()) {
            scheduler.stop();
        }
    }
}

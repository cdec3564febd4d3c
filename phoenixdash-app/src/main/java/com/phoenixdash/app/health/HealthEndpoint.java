package com.phoenixdash.app.health;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phoenixdash.gateway.node.NodeConnectionRegistry;
import com.phoenixdash.gateway.recurring.RecurringPaymentScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;

/**
 * Liveness check with the scheduler's state.
 */
@RestController
public class HealthEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final RecurringPaymentScheduler scheduler;
    private final NodeConnectionRegistry connections;

    public HealthEndpoint(RecurringPaymentScheduler scheduler, NodeConnectionRegistry connections) {
        this.scheduler = scheduler;
        this.connections = connections;
    }

    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("uptime", ManagementFactory.getRuntimeMXBean().getUptime());

        var recurring = node.putObject("scheduler");
        recurring.put("running", scheduler.isRunning());
        scheduler.getLastTickAt().ifPresentOrElse(
                t -> recurring.put("lastTickAt", t.toString()),
                () -> recurring.putNull("lastTickAt"));

        connections.getActiveConnection().ifPresentOrElse(
                c -> node.put("activeConnection", c.getName()),
                () -> node.putNull("activeConnection"));
        return node;
    }
}

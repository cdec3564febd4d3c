package com.phoenixdash.gateway.node;

import com.phoenixdash.common.config.PhoenixDashConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * In-memory registry of phoenixd connections, seeded from configuration.
 * When nothing is configured a default Docker connection is created and
 * activated.
 */
@Slf4j
public class NodeConnectionRegistry {

    public static final String DOCKER_CONNECTION_NAME = "Docker (Local)";

    private final Map<String, NodeConnection> connections = new LinkedHashMap<>();

    public NodeConnectionRegistry() {
    }

    public static NodeConnectionRegistry fromConfig(PhoenixDashConfig.PhoenixdConfig config) {
        NodeConnectionRegistry registry = new NodeConnectionRegistry();
        for (PhoenixDashConfig.ConnectionConfig c : config.getConnections()) {
            registry.add(NodeConnection.builder()
                    .id(c.getId() != null ? c.getId() : UUID.randomUUID().toString())
                    .name(c.getName())
                    .url(c.getUrl())
                    .password(c.getPassword())
                    .docker(c.isDocker())
                    .active(c.isActive())
                    .build());
        }
        registry.ensureDockerConnection(config.getDefaultUrl(), config.getDefaultPassword());
        return registry;
    }

    /**
     * Register a connection. Activating it deactivates all others.
     */
    public synchronized NodeConnection add(NodeConnection connection) {
        if (connection.getId() == null) {
            connection.setId(UUID.randomUUID().toString());
        }
        NodeConnection copy = connection.toBuilder().build();
        if (copy.isActive()) {
            connections.values().forEach(c -> c.setActive(false));
        }
        connections.put(copy.getId(), copy);
        return copy.toBuilder().build();
    }

    /**
     * Create the default Docker connection if no Docker connection exists. It is
     * only made active when it is the first connection.
     */
    public synchronized void ensureDockerConnection(String url, String password) {
        boolean hasDocker = connections.values().stream().anyMatch(NodeConnection::isDocker);
        if (hasDocker) {
            return;
        }
        boolean first = connections.isEmpty();
        add(NodeConnection.builder()
                .name(DOCKER_CONNECTION_NAME)
                .url(url)
                .password(password)
                .docker(true)
                .active(first)
                .build());
        log.info("Created default Docker connection at {} (active={})", url, first);
    }

    public synchronized Optional<NodeConnection> getActiveConnection() {
        return connections.values().stream()
                .filter(NodeConnection::isActive)
                .findFirst()
                .map(c -> c.toBuilder().build());
    }

    public synchronized Optional<NodeConnection> get(String id) {
        return Optional.ofNullable(connections.get(id)).map(c -> c.toBuilder().build());
    }

    public synchronized List<NodeConnection> list() {
        List<NodeConnection> result = new ArrayList<>();
        connections.values().forEach(c -> result.add(c.toBuilder().build()));
        return result;
    }

    /**
     * Make the given connection the active one.
     *
     * @throws IllegalArgumentException if the id is unknown
     */
    public synchronized NodeConnection activate(String id) {
        NodeConnection target = connections.get(id);
        if (target == null) {
            throw new IllegalArgumentException("Connection not found: " + id);
        }
        connections.values().forEach(c -> c.setActive(c == target));
        log.info("Active phoenixd connection switched to {} ({})", target.getName(), target.getUrl());
        return target.toBuilder().build();
    }

    /** Leave the registry without an active connection. */
    public synchronized void deactivateAll() {
        connections.values().forEach(c -> c.setActive(false));
    }
}

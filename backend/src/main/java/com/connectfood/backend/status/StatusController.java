package com.connectfood.backend.status;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Service status endpoints: banner, database diagnostics and liveness/readiness probes.
 */
@RestController
public class StatusController {

    private static final Logger log = LoggerFactory.getLogger(StatusController.class);
    private static final int MAX_ERROR_LENGTH = 120;

    private final ObjectProvider<DataSource> dataSourceProvider;
    private final ObjectProvider<HealthEndpoint> healthEndpointProvider;
    private final Clock clock;

    public StatusController(ObjectProvider<DataSource> dataSourceProvider,
                            ObjectProvider<HealthEndpoint> healthEndpointProvider,
                            Clock clock) {
        this.dataSourceProvider = dataSourceProvider;
        this.healthEndpointProvider = healthEndpointProvider;
        this.clock = clock;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("name", "ConnectFood AI", "message", "Backend running");
    }

    /**
     * Database diagnostics. Never fails the request; problems are reported in the body.
     */
    @GetMapping("/test")
    public DatabaseStatusResponse databaseStatus() {
        DataSource dataSource = dataSourceProvider.getIfAvailable();
        if (dataSource == null) {
            return new DatabaseStatusResponse("Running", "Not Available", null, "Not Connected", List.of());
        }

        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String databaseName = connection.getCatalog();
            List<String> tables = new ArrayList<>();
            try (ResultSet rs = metaData.getTables(databaseName, "public", "%", new String[]{"TABLE"})) {
                while (rs.next()) {
                    tables.add(rs.getString("TABLE_NAME"));
                }
            }
            return new DatabaseStatusResponse("Running", "Connected & Working", databaseName, "Connected", tables);
        } catch (SQLException | RuntimeException e) {
            log.warn("Database diagnostics failed: {}", e.getMessage());
            return new DatabaseStatusResponse("Running", "Error: " + truncate(e.getMessage()), null,
                    "Not Connected", List.of());
        }
    }

    /**
     * Liveness: the process answers.
     */
    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse("UP", now());
    }

    /**
     * Readiness: database health from actuator.
     */
    @GetMapping("/readyz")
    public HealthResponse readyz() {
        HealthEndpoint healthEndpoint = healthEndpointProvider.getIfAvailable();
        if (healthEndpoint == null) {
            return new HealthResponse("UNKNOWN", now());
        }
        try {
            HealthComponent healthComponent = healthEndpoint.health();
            String status = healthComponent.getStatus().getCode();

            if (healthComponent instanceof CompositeHealth composite) {
                Object dbDetail = composite.getComponents().get("db");
                if (dbDetail instanceof Health dbHealth) {
                    status = dbHealth.getStatus().getCode();
                }
            }
            return new HealthResponse(status, now());
        } catch (RuntimeException e) {
            log.warn("Readiness check failed: {}", e.getMessage());
            return new HealthResponse("DOWN", now());
        }
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private static String truncate(String message) {
        if (message == null) {
            return "unknown";
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    public record DatabaseStatusResponse(
            String backend,
            String database,
            String databaseName,
            String connectionStatus,
            List<String> collections
    ) {
    }

    public record HealthResponse(
            String status,   // "UP" | "DOWN" | "UNKNOWN"
            String timestamp // ISO-8601 timestamp
    ) {
    }
}

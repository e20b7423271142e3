package com.flagship.ledger_query.health;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint for the query service.
 * Unlike the Actuator health endpoint, this does not require authorization.
 * The service is only ready when the ledger database answers.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;

    public HealthController(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());

        boolean ledgerReachable = isLedgerReachable();
        response.put("status", ledgerReachable ? "UP" : "DOWN");
        response.put("ledger", ledgerReachable ? "UP" : "DOWN");

        return ledgerReachable
            ? ResponseEntity.ok(response)
            : ResponseEntity.status(503).body(response);
    }

    private boolean isLedgerReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Ledger database unreachable: {}", e.getMessage());
            return false;
        }
    }
}

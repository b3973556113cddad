package com.flagship.cashback_ledger.health;

import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint. Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The primary store decides readiness. The shadow store is reported but only
 * degrades the status, since replication catches up once it is back.
 */
@RestController
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final DataSource dataSource;

    public HealthController(MongoTemplate mongoTemplate, DataSource dataSource) {
        this.mongoTemplate = mongoTemplate;
        this.dataSource = dataSource;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean primaryHealthy = checkPrimary();
        boolean shadowHealthy = checkShadow();
        response.put("primaryStore", primaryHealthy ? "UP" : "DOWN");
        response.put("shadowStore", shadowHealthy ? "UP" : "DOWN");

        if (!primaryHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }
        if (!shadowHealthy) {
            response.put("status", "DEGRADED");
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkPrimary() {
        try {
            Document result = mongoTemplate.executeCommand(new Document("ping", 1));
            Object ok = result.get("ok");
            return ok instanceof Number && ((Number) ok).doubleValue() == 1.0;
        } catch (Exception e) {
            return false;
        }
    }

    private boolean checkShadow() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}

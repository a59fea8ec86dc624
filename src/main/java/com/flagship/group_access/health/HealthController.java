package com.flagship.group_access.health;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * Readiness check for the load balancer plus the membership backlog at a glance.
 *
 * Only the database decides readiness: without it no payment can be recorded. The backlog
 * counts are informational; Redis, Kafka and reconciliation lag have Actuator indicators.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final String BACKLOG_SQL = """
        SELECT
            (SELECT COUNT(*) FROM access_grant_tasks WHERE status = 'PENDING')      AS pending_grants,
            (SELECT COUNT(*) FROM subscriptions WHERE revocation_status = 'PENDING') AS pending_revocations,
            (SELECT updated_at FROM reconciliation_cursor WHERE id = 1)             AS last_reconciliation_at
        """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<HealthReport> health() {
        Instant now = clock.instant();
        Map<String, Object> row;
        try {
            row = jdbcTemplate.queryForMap(BACKLOG_SQL);
        } catch (DataAccessException e) {
            log.warn("Health check failed, database unreachable: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthReport.builder()
                .status("DOWN")
                .timestamp(now)
                .database("DOWN")
                .build());
        }

        return ResponseEntity.ok(HealthReport.builder()
            .status("UP")
            .timestamp(now)
            .database("UP")
            .pendingAccessGrants(count(row.get("pending_grants")))
            .pendingRevocations(count(row.get("pending_revocations")))
            .lastReconciliationAt(instant(row.get("last_reconciliation_at")))
            .build());
    }

    private static Long count(Object value) {
        return value == null ? 0L : ((Number) value).longValue();
    }

    private static Instant instant(Object value) {
        return value == null ? null : ((Timestamp) value).toInstant();
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HealthReport {
        String status;
        Instant timestamp;
        String database;
        Long pendingAccessGrants;
        Long pendingRevocations;
        /** Absent until the first reconciliation run. */
        Instant lastReconciliationAt;
    }
}

package com.vantage.storage;

import com.vantage.domain.SecurityEvent;
import com.vantage.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to the {@code security_events} table.
 *
 * The batch finders back the security event loaders: they accept keys in any
 * order and return rows in database order, leaving it to the loader adapters
 * to line them up with the requested keys.
 */
@Repository
public class SecurityEventRepository {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventRepository.class);

    private static final String COLUMNS = "id, tenant_id, event_time, severity, event_type, device_vendor, "
            + "device_product, source_ip, destination_ip, message, risk_score, correlation_id";

    private static final RowMapper<SecurityEvent> ROW_MAPPER = (rs, rowNum) -> {
        SecurityEvent event = new SecurityEvent();
        event.setId(rs.getString("id"));
        event.setTenantId(rs.getString("tenant_id"));
        event.setTimestamp(rs.getObject("event_time", OffsetDateTime.class));
        event.setSeverity(Severity.valueOf(rs.getString("severity")));
        event.setEventType(rs.getString("event_type"));
        event.setDeviceVendor(rs.getString("device_vendor"));
        event.setDeviceProduct(rs.getString("device_product"));
        event.setSourceIp(rs.getString("source_ip"));
        event.setDestinationIp(rs.getString("destination_ip"));
        event.setMessage(rs.getString("message"));
        event.setRiskScore(rs.getObject("risk_score", Double.class));
        event.setCorrelationId(rs.getString("correlation_id"));
        return event;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public SecurityEventRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<SecurityEvent> findByIds(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        log.debug("Fetching {} security events by id", ids.size());
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM security_events WHERE id IN (:ids)",
                Map.of("ids", ids), ROW_MAPPER);
    }

    public List<SecurityEvent> findByCorrelationIds(List<String> correlationIds) {
        if (correlationIds.isEmpty()) {
            return List.of();
        }
        log.debug("Fetching security events for {} correlation ids", correlationIds.size());
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM security_events"
                        + " WHERE correlation_id IN (:ids) ORDER BY event_time, id",
                Map.of("ids", correlationIds), ROW_MAPPER);
    }

    public Optional<SecurityEvent> findById(String id) {
        return findByIds(List.of(id)).stream().findFirst();
    }

    public SecurityEvent insert(SecurityEvent event) {
        jdbcTemplate.update("INSERT INTO security_events (" + COLUMNS + ") VALUES (:id, :tenantId, :timestamp, "
                        + ":severity, :eventType, :deviceVendor, :deviceProduct, :sourceIp, :destinationIp, "
                        + ":message, :riskScore, :correlationId)",
                parameters(event));
        log.info("Stored security event {} for tenant {}", event.getId(), event.getTenantId());
        return event;
    }

    public SecurityEvent update(SecurityEvent event) {
        int updated = jdbcTemplate.update("UPDATE security_events SET severity = :severity, risk_score = :riskScore, "
                + "message = :message WHERE id = :id", parameters(event));
        if (updated == 0) {
            log.warn("Update of security event {} matched no rows", event.getId());
        }
        return event;
    }

    /**
     * @return false when no row matched
     */
    public boolean delete(String id) {
        int deleted = jdbcTemplate.update("DELETE FROM security_events WHERE id = :id",
                new MapSqlParameterSource("id", id));
        log.info("Deleted security event {} ({} row(s))", id, deleted);
        return deleted > 0;
    }

    private MapSqlParameterSource parameters(SecurityEvent event) {
        return new MapSqlParameterSource()
                .addValue("id", event.getId())
                .addValue("tenantId", event.getTenantId())
                .addValue("timestamp", event.getTimestamp())
                .addValue("severity", event.getSeverity() != null ? event.getSeverity().name() : null)
                .addValue("eventType", event.getEventType())
                .addValue("deviceVendor", event.getDeviceVendor())
                .addValue("deviceProduct", event.getDeviceProduct())
                .addValue("sourceIp", event.getSourceIp())
                .addValue("destinationIp", event.getDestinationIp())
                .addValue("message", event.getMessage())
                .addValue("riskScore", event.getRiskScore())
                .addValue("correlationId", event.getCorrelationId());
    }
}

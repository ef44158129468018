package com.vantage.storage;

import com.vantage.domain.Ioc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC access to {@code iocs} and the {@code ioc_events} link table.
 */
@Repository
public class IocRepository {

    private static final Logger log = LoggerFactory.getLogger(IocRepository.class);

    private static final String COLUMNS =
            "i.id, i.tenant_id, i.ioc_type, i.ioc_value, i.confidence, i.whitelisted, i.whitelist_reason, i.first_seen, i.last_seen";

    private static final RowMapper<Ioc> ROW_MAPPER = (rs, rowNum) -> {
        Ioc ioc = new Ioc();
        ioc.setId(rs.getString("id"));
        ioc.setTenantId(rs.getString("tenant_id"));
        ioc.setType(rs.getString("ioc_type"));
        ioc.setValue(rs.getString("ioc_value"));
        ioc.setConfidence(rs.getObject("confidence", Double.class));
        ioc.setWhitelisted(rs.getBoolean("whitelisted"));
        ioc.setWhitelistReason(rs.getString("whitelist_reason"));
        ioc.setFirstSeen(rs.getObject("first_seen", OffsetDateTime.class));
        ioc.setLastSeen(rs.getObject("last_seen", OffsetDateTime.class));
        return ioc;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public IocRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<Ioc> findByIds(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM iocs i WHERE i.id IN (:ids)", Map.of("ids", ids), ROW_MAPPER);
    }

    /**
     * IOCs observed in each of the given events, highest confidence first.
     */
    public Map<String, List<Ioc>> findByEventIds(List<String> eventIds) {
        Map<String, List<Ioc>> byEvent = new LinkedHashMap<>();
        if (eventIds.isEmpty()) {
            return byEvent;
        }
        jdbcTemplate.query("SELECT ie.event_id, " + COLUMNS + " FROM ioc_events ie JOIN iocs i ON i.id = ie.ioc_id"
                        + " WHERE ie.event_id IN (:ids) ORDER BY i.confidence DESC NULLS LAST, i.id",
                Map.of("ids", eventIds),
                rs -> {
                    Ioc ioc = ROW_MAPPER.mapRow(rs, 0);
                    byEvent.computeIfAbsent(rs.getString("event_id"), k -> new ArrayList<>()).add(ioc);
                });
        return byEvent;
    }

    public List<String> findEventIds(String iocId) {
        return jdbcTemplate.queryForList("SELECT event_id FROM ioc_events WHERE ioc_id = :id ORDER BY event_id",
                Map.of("id", iocId), String.class);
    }

    public Ioc insert(Ioc ioc) {
        jdbcTemplate.update("INSERT INTO iocs (id, tenant_id, ioc_type, ioc_value, confidence, whitelisted, "
                        + "whitelist_reason, first_seen, last_seen) VALUES (:id, :tenantId, :type, :value, :confidence, "
                        + ":whitelisted, :whitelistReason, :firstSeen, :lastSeen)",
                new MapSqlParameterSource()
                        .addValue("id", ioc.getId())
                        .addValue("tenantId", ioc.getTenantId())
                        .addValue("type", ioc.getType())
                        .addValue("value", ioc.getValue())
                        .addValue("confidence", ioc.getConfidence())
                        .addValue("whitelisted", ioc.isWhitelisted())
                        .addValue("whitelistReason", ioc.getWhitelistReason())
                        .addValue("firstSeen", ioc.getFirstSeen())
                        .addValue("lastSeen", ioc.getLastSeen()));
        log.info("Stored {} IOC {} for tenant {}", ioc.getType(), ioc.getId(), ioc.getTenantId());
        return ioc;
    }

    public void linkEvents(String iocId, List<String> eventIds) {
        if (eventIds.isEmpty()) {
            return;
        }
        SqlParameterSource[] links = eventIds.stream()
                .map(eventId -> new MapSqlParameterSource().addValue("iocId", iocId).addValue("eventId", eventId))
                .toArray(SqlParameterSource[]::new);
        jdbcTemplate.batchUpdate("INSERT INTO ioc_events (ioc_id, event_id) VALUES (:iocId, :eventId)", links);
    }

    public boolean whitelist(String iocId, String reason) {
        int updated = jdbcTemplate.update("UPDATE iocs SET whitelisted = TRUE, whitelist_reason = :reason WHERE id = :id",
                new MapSqlParameterSource().addValue("id", iocId).addValue("reason", reason));
        log.info("Whitelisted IOC {} ({} row(s))", iocId, updated);
        return updated > 0;
    }
}

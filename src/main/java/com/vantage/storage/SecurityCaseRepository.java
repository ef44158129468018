package com.vantage.storage;

import com.vantage.domain.CaseStatus;
import com.vantage.domain.SecurityCase;
import com.vantage.domain.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC access to {@code security_cases} and the {@code case_events} link table.
 */
@Repository
public class SecurityCaseRepository {

    private static final Logger log = LoggerFactory.getLogger(SecurityCaseRepository.class);

    private static final String COLUMNS =
            "c.id, c.tenant_id, c.title, c.description, c.status, c.priority, c.assignee_id, c.created_at, c.updated_at";

    private static final RowMapper<SecurityCase> ROW_MAPPER = (rs, rowNum) -> {
        SecurityCase securityCase = new SecurityCase();
        securityCase.setId(rs.getString("id"));
        securityCase.setTenantId(rs.getString("tenant_id"));
        securityCase.setTitle(rs.getString("title"));
        securityCase.setDescription(rs.getString("description"));
        securityCase.setStatus(CaseStatus.valueOf(rs.getString("status")));
        securityCase.setPriority(Severity.valueOf(rs.getString("priority")));
        securityCase.setAssigneeId(rs.getString("assignee_id"));
        securityCase.setCreatedAt(rs.getObject("created_at", OffsetDateTime.class));
        securityCase.setUpdatedAt(rs.getObject("updated_at", OffsetDateTime.class));
        return securityCase;
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public SecurityCaseRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<SecurityCase> findByIds(List<String> ids) {
        if (ids.isEmpty()) {
            return List.of();
        }
        List<SecurityCase> cases = jdbcTemplate.query("SELECT " + COLUMNS + " FROM security_cases c WHERE c.id IN (:ids)",
                Map.of("ids", ids), ROW_MAPPER);
        attachEventIds(cases);
        return cases;
    }

    /**
     * Cases linked to each of the given events, newest first.
     */
    public Map<String, List<SecurityCase>> findByEventIds(List<String> eventIds) {
        Map<String, List<SecurityCase>> byEvent = new LinkedHashMap<>();
        if (eventIds.isEmpty()) {
            return byEvent;
        }
        List<String> caseIds = new ArrayList<>();
        List<String> linkedEventIds = new ArrayList<>();
        jdbcTemplate.query("SELECT ce.event_id, ce.case_id FROM case_events ce JOIN security_cases c ON c.id = ce.case_id"
                        + " WHERE ce.event_id IN (:ids) ORDER BY c.created_at DESC, c.id",
                Map.of("ids", eventIds), rs -> {
                    linkedEventIds.add(rs.getString("event_id"));
                    caseIds.add(rs.getString("case_id"));
                });

        Map<String, SecurityCase> casesById = new LinkedHashMap<>();
        for (SecurityCase securityCase : findByIds(caseIds.stream().distinct().toList())) {
            casesById.put(securityCase.getId(), securityCase);
        }
        for (int i = 0; i < caseIds.size(); i++) {
            SecurityCase securityCase = casesById.get(caseIds.get(i));
            if (securityCase != null) {
                byEvent.computeIfAbsent(linkedEventIds.get(i), k -> new ArrayList<>()).add(securityCase);
            }
        }
        return byEvent;
    }

    public Optional<SecurityCase> findById(String id) {
        return findByIds(List.of(id)).stream().findFirst();
    }

    public SecurityCase insert(SecurityCase securityCase) {
        jdbcTemplate.update("INSERT INTO security_cases (id, tenant_id, title, description, status, priority, "
                        + "assignee_id, created_at, updated_at) VALUES (:id, :tenantId, :title, :description, :status, "
                        + ":priority, :assigneeId, :createdAt, :updatedAt)",
                new MapSqlParameterSource()
                        .addValue("id", securityCase.getId())
                        .addValue("tenantId", securityCase.getTenantId())
                        .addValue("title", securityCase.getTitle())
                        .addValue("description", securityCase.getDescription())
                        .addValue("status", securityCase.getStatus().name())
                        .addValue("priority", securityCase.getPriority().name())
                        .addValue("assigneeId", securityCase.getAssigneeId())
                        .addValue("createdAt", securityCase.getCreatedAt())
                        .addValue("updatedAt", securityCase.getUpdatedAt()));
        for (String eventId : securityCase.getEventIds()) {
            jdbcTemplate.update("INSERT INTO case_events (case_id, event_id) VALUES (:caseId, :eventId)",
                    Map.of("caseId", securityCase.getId(), "eventId", eventId));
        }
        log.info("Created case {} with {} linked events", securityCase.getId(), securityCase.getEventIds().size());
        return securityCase;
    }

    public void updateAssignee(String caseId, String assigneeId, CaseStatus status, OffsetDateTime updatedAt) {
        jdbcTemplate.update("UPDATE security_cases SET assignee_id = :assigneeId, status = :status, "
                        + "updated_at = :updatedAt WHERE id = :id",
                new MapSqlParameterSource()
                        .addValue("id", caseId)
                        .addValue("assigneeId", assigneeId)
                        .addValue("status", status.name())
                        .addValue("updatedAt", updatedAt));
    }

    private void attachEventIds(List<SecurityCase> cases) {
        if (cases.isEmpty()) {
            return;
        }
        Map<String, SecurityCase> byId = new LinkedHashMap<>();
        cases.forEach(c -> byId.put(c.getId(), c));
        jdbcTemplate.query("SELECT case_id, event_id FROM case_events WHERE case_id IN (:ids) ORDER BY event_id",
                Map.of("ids", new ArrayList<>(byId.keySet())),
                rs -> {
                    SecurityCase securityCase = byId.get(rs.getString("case_id"));
                    if (securityCase != null) {
                        securityCase.getEventIds().add(rs.getString("event_id"));
                    }
                });
    }
}

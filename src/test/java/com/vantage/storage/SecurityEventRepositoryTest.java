package com.vantage.storage;

import com.vantage.domain.SecurityEvent;
import com.vantage.domain.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SecurityEventRepository")
class SecurityEventRepositoryTest {

    @Mock
    private NamedParameterJdbcTemplate jdbcTemplate;

    @Captor
    private ArgumentCaptor<String> sqlCaptor;

    @Captor
    private ArgumentCaptor<RowMapper<SecurityEvent>> rowMapperCaptor;

    @Captor
    private ArgumentCaptor<MapSqlParameterSource> parametersCaptor;

    private SecurityEventRepository repository;

    @BeforeEach
    void setUp() {
        repository = new SecurityEventRepository(jdbcTemplate);
    }

    @Test
    @DisplayName("should not query for an empty key list")
    void shouldSkipEmptyBatches() {
        assertThat(repository.findByIds(List.of())).isEmpty();
        assertThat(repository.findByCorrelationIds(List.of())).isEmpty();

        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    @DisplayName("should fetch a whole batch of ids in one statement")
    void shouldFetchBatchInOneQuery() {
        // When
        repository.findByIds(List.of("e1", "e2", "e3"));

        // Then
        verify(jdbcTemplate).query(sqlCaptor.capture(), eq(Map.of("ids", List.of("e1", "e2", "e3"))),
                rowMapperCaptor.capture());
        assertThat(sqlCaptor.getValue()).contains("FROM security_events WHERE id IN (:ids)");
    }

    @Test
    @DisplayName("should map a row to a security event")
    void shouldMapRows() throws SQLException {
        // Given
        repository.findByIds(List.of("e1"));
        verify(jdbcTemplate).query(anyString(), eq(Map.of("ids", List.of("e1"))), rowMapperCaptor.capture());
        ResultSet resultSet = mock(ResultSet.class);
        OffsetDateTime eventTime = OffsetDateTime.of(2026, 3, 1, 9, 55, 0, 0, ZoneOffset.UTC);
        when(resultSet.getString("id")).thenReturn("e1");
        when(resultSet.getString("tenant_id")).thenReturn("tenant-a");
        when(resultSet.getObject("event_time", OffsetDateTime.class)).thenReturn(eventTime);
        when(resultSet.getString("severity")).thenReturn("HIGH");
        when(resultSet.getString("event_type")).thenReturn("port_scan");
        when(resultSet.getString("device_vendor")).thenReturn("paloalto");
        when(resultSet.getString("device_product")).thenReturn("pan-os");
        when(resultSet.getString("source_ip")).thenReturn("203.0.113.7");
        when(resultSet.getString("destination_ip")).thenReturn("10.0.0.4");
        when(resultSet.getString("message")).thenReturn("TCP SYN sweep");
        when(resultSet.getObject("risk_score", Double.class)).thenReturn(73.5);
        when(resultSet.getString("correlation_id")).thenReturn("corr-7");

        // When
        SecurityEvent event = rowMapperCaptor.getValue().mapRow(resultSet, 0);

        // Then
        assertThat(event.getId()).isEqualTo("e1");
        assertThat(event.getTenantId()).isEqualTo("tenant-a");
        assertThat(event.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(event.getEventType()).isEqualTo("port_scan");
        assertThat(event.getCorrelationId()).isEqualTo("corr-7");
        assertThat(event.getRiskScore()).isEqualTo(73.5);
        assertThat(event.getTimestamp()).isEqualTo(eventTime);
        assertThat(event.getDeviceVendor()).isEqualTo("paloalto");
        assertThat(event.getSourceIp()).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("should report a missing event as empty")
    void shouldReturnEmptyForMissingEvent() {
        assertThat(repository.findById("missing")).isEmpty();
    }

    @Test
    @DisplayName("should bind the severity by name on insert")
    void shouldInsertEvent() {
        // Given
        SecurityEvent event = new SecurityEvent();
        event.setId("e1");
        event.setTenantId("tenant-a");
        event.setSeverity(Severity.CRITICAL);
        event.setEventType("ransomware");

        // When
        SecurityEvent stored = repository.insert(event);

        // Then
        assertThat(stored).isSameAs(event);
        verify(jdbcTemplate).update(sqlCaptor.capture(), parametersCaptor.capture());
        assertThat(sqlCaptor.getValue()).startsWith("INSERT INTO security_events");
        assertThat(parametersCaptor.getValue().getValue("severity")).isEqualTo("CRITICAL");
        assertThat(parametersCaptor.getValue().getValue("tenantId")).isEqualTo("tenant-a");
        assertThat(parametersCaptor.getValue().getValue("correlationId")).isNull();
    }

    @Test
    @DisplayName("should report whether a delete removed a row")
    void shouldDeleteById() {
        // Given
        when(jdbcTemplate.update(anyString(), any(SqlParameterSource.class))).thenReturn(1, 0);

        // When
        boolean first = repository.delete("e1");
        boolean second = repository.delete("e1");

        // Then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        verify(jdbcTemplate, times(2)).update(sqlCaptor.capture(), parametersCaptor.capture());
        assertThat(sqlCaptor.getValue()).isEqualTo("DELETE FROM security_events WHERE id = :id");
        assertThat(parametersCaptor.getValue().getValue("id")).isEqualTo("e1");
    }
}

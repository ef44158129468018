package com.vantage.secops;

import com.vantage.correlation.CorrelationGraph;
import com.vantage.correlation.CorrelationGraphWalker;
import com.vantage.domain.CaseChange;
import com.vantage.domain.CaseChangeType;
import com.vantage.domain.CaseStatus;
import com.vantage.domain.Ioc;
import com.vantage.domain.IocChange;
import com.vantage.domain.IocInput;
import com.vantage.domain.SecurityCase;
import com.vantage.domain.SecurityCaseInput;
import com.vantage.domain.SecurityEvent;
import com.vantage.domain.SecurityEventFilter;
import com.vantage.domain.SecurityEventInput;
import com.vantage.domain.SecurityEventUpdate;
import com.vantage.domain.Severity;
import com.vantage.error.NotFoundException;
import com.vantage.error.UpstreamFailureException;
import com.vantage.error.ValidationException;
import com.vantage.fanout.EventSubscription;
import com.vantage.fanout.FanoutEngine;
import com.vantage.fanout.FanoutMetrics;
import com.vantage.invalidation.CacheInvalidationBus;
import com.vantage.kafka.SecurityEventForwarder;
import com.vantage.loader.LoaderCatalog;
import com.vantage.loader.LoaderMetrics;
import com.vantage.loader.LoaderScope;
import com.vantage.loader.LoaderScopeFactory;
import com.vantage.loader.PartialBatchFailureException;
import com.vantage.security.AccessGate;
import com.vantage.security.AuthorizationException;
import com.vantage.security.Permission;
import com.vantage.security.RequestPrincipal;
import com.vantage.storage.IocRepository;
import com.vantage.storage.SecurityCaseRepository;
import com.vantage.storage.SecurityEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.dataloader.Try;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SecurityOperationsService")
class SecurityOperationsServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2026, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private SecurityEventRepository eventRepository;

    @Mock
    private SecurityCaseRepository caseRepository;

    @Mock
    private IocRepository iocRepository;

    @Mock
    private SecurityEventForwarder eventForwarder;

    @Mock
    private CorrelationGraphWalker correlationWalker;

    private FanoutEngine fanoutEngine;
    private LoaderScope scope;
    private SecurityOperationsService service;
    private RequestPrincipal analyst;
    private RequestPrincipal otherTenantAnalyst;

    @BeforeEach
    void setUp() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        fanoutEngine = new FanoutEngine(16, Schedulers.immediate(), new FanoutMetrics(meterRegistry));

        SecurityLoaders loaders = new SecurityLoaders();
        LoaderCatalog catalog = new LoaderCatalog(List.of(
                loaders.securityEventByIdLoader(eventRepository),
                loaders.securityEventsByCorrelationIdLoader(eventRepository),
                loaders.securityCaseByIdLoader(caseRepository),
                loaders.securityCasesByEventIdLoader(caseRepository),
                loaders.iocByIdLoader(iocRepository),
                loaders.iocsByEventIdLoader(iocRepository)));
        scope = new LoaderScopeFactory(catalog, Runnable::run, Duration.ofSeconds(1),
                new LoaderMetrics(meterRegistry), new CacheInvalidationBus("process")).openScope();

        service = new SecurityOperationsService(new AccessGate(meterRegistry), eventRepository, caseRepository,
                iocRepository, fanoutEngine, correlationWalker, eventForwarder,
                Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC));

        analyst = new RequestPrincipal("analyst-1", "tenant-a", EnumSet.allOf(Permission.class));
        otherTenantAnalyst = new RequestPrincipal("analyst-9", "tenant-b", EnumSet.allOf(Permission.class));
    }

    private static SecurityEventInput input(Severity severity, String eventType) {
        SecurityEventInput input = new SecurityEventInput();
        input.setSeverity(severity);
        input.setEventType(eventType);
        input.setDeviceVendor("paloalto");
        input.setRiskScore(42.0);
        return input;
    }

    private static SecurityEvent event(String id, String tenantId, Severity severity, String correlationId) {
        SecurityEvent event = new SecurityEvent();
        event.setId(id);
        event.setTenantId(tenantId);
        event.setSeverity(severity);
        event.setEventType("auth_failure");
        event.setCorrelationId(correlationId);
        event.setTimestamp(NOW.minusMinutes(5));
        return event;
    }

    private static SecurityCase securityCase(String id, String tenantId, String assigneeId, CaseStatus status,
                                             String... eventIds) {
        SecurityCase securityCase = new SecurityCase();
        securityCase.setId(id);
        securityCase.setTenantId(tenantId);
        securityCase.setTitle("Brute force on vpn-gw-1");
        securityCase.setAssigneeId(assigneeId);
        securityCase.setStatus(status);
        securityCase.setPriority(Severity.HIGH);
        securityCase.setEventIds(new ArrayList<>(Arrays.asList(eventIds)));
        return securityCase;
    }

    private static Ioc ioc(String id, String tenantId) {
        Ioc ioc = new Ioc();
        ioc.setId(id);
        ioc.setTenantId(tenantId);
        ioc.setType("ip");
        ioc.setValue("203.0.113.7");
        return ioc;
    }

    private <T> T resolve(CompletableFuture<T> future) {
        scope.dispatch();
        return future.join();
    }

    // Writes

    @Test
    @DisplayName("should store an ingested event before any subscriber sees it")
    void shouldStoreBeforePublishing() {
        // Given
        EventSubscription<SecurityEvent> stream = service.subscribeEventStream(analyst, null);
        EventSubscription<SecurityEvent> critical = service.subscribeCriticalAlerts(analyst);
        when(eventRepository.insert(any(SecurityEvent.class))).thenAnswer(invocation -> {
            assertThat(stream.pendingCount()).isZero();
            assertThat(critical.pendingCount()).isZero();
            return invocation.getArgument(0);
        });

        // When
        SecurityEvent event = service.ingestEvent(analyst, scope, input(Severity.CRITICAL, "ransomware"));

        // Then
        assertThat(event.getId()).isNotBlank();
        assertThat(event.getTenantId()).isEqualTo("tenant-a");
        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(stream.pendingCount()).isEqualTo(1);
        assertThat(critical.pendingCount()).isEqualTo(1);
        verify(eventForwarder).forward(event);
    }

    @Test
    @DisplayName("should publish non-critical events only on the main stream")
    void shouldRouteOnlyCriticalEventsToAlerts() {
        // Given
        EventSubscription<SecurityEvent> critical = service.subscribeCriticalAlerts(analyst);
        EventSubscription<SecurityEvent> stream = service.subscribeEventStream(analyst, null);

        // When
        service.ingestEvent(analyst, scope, input(Severity.HIGH, "port_scan"));

        // Then
        assertThat(stream.pendingCount()).isEqualTo(1);
        assertThat(critical.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should check authorization before any store, loader or channel access")
    void shouldAuthorizeBeforeAnyIo() {
        // Given
        RequestPrincipal readOnly = new RequestPrincipal("viewer", "tenant-a", EnumSet.of(Permission.READ_SECURITY_EVENTS));
        EventSubscription<SecurityEvent> stream = service.subscribeEventStream(readOnly, null);

        // When / Then
        assertThatThrownBy(() -> service.ingestEvent(readOnly, scope, input(Severity.CRITICAL, "ransomware")))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> service.assignCase(readOnly, scope, "case-1", "analyst-2"))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> service.getCase(null, scope, "case-1"))
                .isInstanceOf(AuthorizationException.class);

        verifyNoInteractions(eventRepository, caseRepository, eventForwarder);
        assertThat(stream.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should reject invalid event input without writing")
    void shouldValidateIngestInput() {
        SecurityEventInput noSeverity = input(null, "port_scan");
        SecurityEventInput badScore = input(Severity.LOW, "port_scan");
        badScore.setRiskScore(101.0);

        assertThatThrownBy(() -> service.ingestEvent(analyst, scope, noSeverity))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("severity");
        assertThatThrownBy(() -> service.ingestEvent(analyst, scope, badScore))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("riskScore"));
        assertThatThrownBy(() -> service.ingestEvent(analyst, scope, input(Severity.LOW, " ")))
                .isInstanceOf(ValidationException.class);

        verifyNoInteractions(eventRepository, eventForwarder);
    }

    @Test
    @DisplayName("should forward a batch without storing it")
    void shouldForwardBatch() {
        // When
        int forwarded = service.ingestEventBatch(analyst,
                List.of(input(Severity.LOW, "dns_query"), input(Severity.MEDIUM, "http_request")));

        // Then
        assertThat(forwarded).isEqualTo(2);
        verify(eventForwarder, times(2)).forward(any(SecurityEvent.class));
        verifyNoInteractions(eventRepository);
    }

    @Test
    @DisplayName("should reject empty and oversized batches")
    void shouldLimitBatchSize() {
        List<SecurityEventInput> oversized = Collections.nCopies(SecurityOperationsService.MAX_BATCH_INGEST + 1,
                input(Severity.LOW, "dns_query"));

        assertThatThrownBy(() -> service.ingestEventBatch(analyst, List.of()))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.ingestEventBatch(analyst, oversized))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("10000");
        verifyNoInteractions(eventForwarder);
    }

    @Test
    @DisplayName("should make an update visible to the next read in the same request")
    void shouldInvalidateCachedEventOnUpdate() {
        // Given
        when(eventRepository.findByIds(anyList()))
                .thenReturn(List.of(event("e1", "tenant-a", Severity.LOW, null)))
                .thenReturn(List.of(event("e1", "tenant-a", Severity.HIGH, null)));
        when(eventRepository.findById("e1")).thenReturn(Optional.of(event("e1", "tenant-a", Severity.LOW, null)));
        assertThat(resolve(service.getEvent(analyst, scope, "e1")).getSeverity()).isEqualTo(Severity.LOW);

        SecurityEventUpdate update = new SecurityEventUpdate();
        update.setSeverity(Severity.HIGH);

        // When
        SecurityEvent updated = service.updateEvent(analyst, scope, "e1", update);
        SecurityEvent reread = resolve(service.getEvent(analyst, scope, "e1"));

        // Then
        assertThat(updated.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(reread.getSeverity()).isEqualTo(Severity.HIGH);
        verify(eventRepository).update(updated);
        verify(eventRepository, times(2)).findByIds(anyList());
    }

    @Test
    @DisplayName("should treat updates of missing or foreign events as not found")
    void shouldRejectUpdateOfUnknownEvent() {
        // Given
        when(eventRepository.findById("missing")).thenReturn(Optional.empty());
        when(eventRepository.findById("foreign")).thenReturn(Optional.of(event("foreign", "tenant-b", Severity.LOW, null)));
        SecurityEventUpdate update = new SecurityEventUpdate();
        update.setMessage("triaged");

        // When / Then
        assertThatThrownBy(() -> service.updateEvent(analyst, scope, "missing", update))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.updateEvent(analyst, scope, "foreign", update))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("SecurityEvent foreign not found");
        verify(eventRepository, never()).update(any());
    }

    @Test
    @DisplayName("should create an unassigned case as OPEN with default priority")
    void shouldCreateOpenCase() {
        // Given
        EventSubscription<CaseChange> updates = service.subscribeCaseUpdates(analyst, null);
        SecurityCaseInput input = new SecurityCaseInput();
        input.setTitle("  Suspicious logins  ");
        input.setEventIds(List.of("e1", "e2", "e1"));

        // When
        SecurityCase created = service.createCase(analyst, scope, input);

        // Then
        assertThat(created.getStatus()).isEqualTo(CaseStatus.OPEN);
        assertThat(created.getPriority()).isEqualTo(Severity.MEDIUM);
        assertThat(created.getTitle()).isEqualTo("Suspicious logins");
        assertThat(created.getEventIds()).containsExactly("e1", "e2");
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        verify(caseRepository).insert(created);

        StepVerifier.create(updates.messages())
                .assertNext(change -> {
                    assertThat(change.getChangeType()).isEqualTo(CaseChangeType.CREATED);
                    assertThat(change.getSecurityCase()).isSameAs(created);
                    assertThat(change.getActorId()).isEqualTo("analyst-1");
                })
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("should require a case title")
    void shouldRequireCaseTitle() {
        SecurityCaseInput input = new SecurityCaseInput();
        input.setTitle(" ");

        assertThatThrownBy(() -> service.createCase(analyst, scope, input))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("title");
        verifyNoInteractions(caseRepository);
    }

    @Test
    @DisplayName("should move an assigned OPEN case to IN_PROGRESS and notify the assignee")
    void shouldAssignCase() {
        // Given
        when(caseRepository.findById("case-1"))
                .thenReturn(Optional.of(securityCase("case-1", "tenant-a", null, CaseStatus.OPEN, "e1")));
        EventSubscription<CaseChange> assignee = service.subscribeCaseAssignments(analyst, "analyst-2");
        EventSubscription<CaseChange> someoneElse = service.subscribeCaseAssignments(analyst, null);
        EventSubscription<CaseChange> foreign = service.subscribeCaseAssignments(otherTenantAnalyst, "analyst-2");

        // When
        SecurityCase assigned = service.assignCase(analyst, scope, "case-1", "analyst-2");

        // Then
        assertThat(assigned.getStatus()).isEqualTo(CaseStatus.IN_PROGRESS);
        assertThat(assigned.getAssigneeId()).isEqualTo("analyst-2");
        verify(caseRepository).updateAssignee("case-1", "analyst-2", CaseStatus.IN_PROGRESS, NOW);
        assertThat(someoneElse.pendingCount()).isZero();
        assertThat(foreign.pendingCount()).isZero();

        StepVerifier.create(assignee.messages())
                .assertNext(change -> {
                    assertThat(change.getChangeType()).isEqualTo(CaseChangeType.ASSIGNED);
                    assertThat(change.getPreviousAssigneeId()).isNull();
                })
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("should keep the status of a case already past OPEN when reassigning")
    void shouldKeepStatusOnReassign() {
        // Given
        when(caseRepository.findById("case-2"))
                .thenReturn(Optional.of(securityCase("case-2", "tenant-a", "analyst-3", CaseStatus.RESOLVED)));

        // When
        SecurityCase assigned = service.assignCase(analyst, scope, "case-2", "analyst-4");

        // Then
        assertThat(assigned.getStatus()).isEqualTo(CaseStatus.RESOLVED);
        verify(caseRepository).updateAssignee(eq("case-2"), eq("analyst-4"), eq(CaseStatus.RESOLVED), any());
    }

    @Test
    @DisplayName("should whitelist an IOC and refresh the IOC lists of linked events")
    void shouldWhitelistIoc() {
        // Given
        when(iocRepository.findByIds(List.of("ioc-1"))).thenReturn(List.of(ioc("ioc-1", "tenant-a")));
        when(iocRepository.findByEventIds(anyList()))
                .thenReturn(Map.of("e1", List.of(ioc("ioc-1", "tenant-a"))))
                .thenReturn(Map.of("e1", List.of()));
        when(iocRepository.findEventIds("ioc-1")).thenReturn(List.of("e1"));
        SecurityEvent linked = event("e1", "tenant-a", Severity.HIGH, null);
        assertThat(resolve(service.getIocsForEvent(analyst, scope, linked))).hasSize(1);
        EventSubscription<IocChange> updates = service.subscribeIocUpdates(analyst);

        // When
        Ioc whitelisted = service.whitelistIoc(analyst, scope, "ioc-1", "internal scanner");

        // Then
        assertThat(whitelisted.isWhitelisted()).isTrue();
        assertThat(whitelisted.getWhitelistReason()).isEqualTo("internal scanner");
        verify(iocRepository).whitelist("ioc-1", "internal scanner");
        assertThat(resolve(service.getIocsForEvent(analyst, scope, linked))).isEmpty();
        assertThat(updates.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should require a whitelist reason and an existing IOC")
    void shouldValidateWhitelist() {
        when(iocRepository.findByIds(List.of("ioc-404"))).thenReturn(List.of());

        assertThatThrownBy(() -> service.whitelistIoc(analyst, scope, "ioc-1", ""))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.whitelistIoc(analyst, scope, "ioc-404", "noise"))
                .isInstanceOf(NotFoundException.class);
        verify(iocRepository, never()).whitelist(anyString(), anyString());
    }

    @Test
    @DisplayName("should delete an event, drop it from the request caches and announce the deletion")
    void shouldDeleteEvent() {
        // Given
        SecurityEvent stored = event("e1", "tenant-a", Severity.HIGH, "corr-1");
        when(eventRepository.findById("e1")).thenReturn(Optional.of(stored));
        when(eventRepository.delete("e1")).thenReturn(true);
        when(eventRepository.findByIds(anyList())).thenReturn(List.of(stored)).thenReturn(List.of());
        when(eventRepository.findByCorrelationIds(List.of("corr-1")))
                .thenReturn(List.of(stored))
                .thenReturn(List.of());
        assertThat(resolve(service.getEvent(analyst, scope, "e1"))).isSameAs(stored);
        SecurityEvent sibling = event("e2", "tenant-a", Severity.LOW, "corr-1");
        assertThat(resolve(service.getCorrelatedEvents(analyst, scope, sibling)))
                .extracting(SecurityEvent::getId).containsExactly("e1");
        EventSubscription<SecurityEvent> deletions = service.subscribeEventDeletions(analyst);
        EventSubscription<SecurityEvent> foreignDeletions = service.subscribeEventDeletions(otherTenantAnalyst);

        // When
        boolean deleted = service.deleteEvent(analyst, scope, "e1");

        // Then
        assertThat(deleted).isTrue();
        verify(eventRepository).delete("e1");
        assertThat(resolve(service.getEvent(analyst, scope, "e1"))).isNull();
        assertThat(resolve(service.getCorrelatedEvents(analyst, scope, sibling))).isEmpty();
        assertThat(deletions.pendingCount()).isEqualTo(1);
        assertThat(foreignDeletions.pendingCount()).isZero();
    }

    @Test
    @DisplayName("should report deleting a missing or foreign event as not found")
    void shouldRejectDeleteOfForeignEvent() {
        when(eventRepository.findById("e2")).thenReturn(Optional.of(event("e2", "tenant-b", Severity.LOW, null)));
        when(eventRepository.findById("e404")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteEvent(analyst, scope, "e2")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> service.deleteEvent(analyst, scope, "e404")).isInstanceOf(NotFoundException.class);
        verify(eventRepository, never()).delete(anyString());
    }

    @Test
    @DisplayName("should require the delete permission before touching the store")
    void shouldGateDelete() {
        RequestPrincipal reader = new RequestPrincipal("analyst-2", "tenant-a", EnumSet.of(Permission.READ_SECURITY_EVENTS));

        assertThatThrownBy(() -> service.deleteEvent(reader, scope, "e1")).isInstanceOf(AuthorizationException.class);
        verifyNoInteractions(eventRepository);
    }

    @Test
    @DisplayName("should create an IOC linked to its events and publish it")
    void shouldCreateIoc() {
        // Given
        when(eventRepository.findByIds(List.of("e1"))).thenReturn(List.of(event("e1", "tenant-a", Severity.HIGH, null)));
        when(iocRepository.findByEventIds(anyList()))
                .thenReturn(Map.of())
                .thenReturn(Map.of("e1", List.of(ioc("ioc-new", "tenant-a"))));
        SecurityEvent linked = event("e1", "tenant-a", Severity.HIGH, null);
        assertThat(resolve(service.getIocsForEvent(analyst, scope, linked))).isEmpty();
        EventSubscription<IocChange> updates = service.subscribeIocUpdates(analyst);
        IocInput input = new IocInput();
        input.setType("domain");
        input.setValue(" evil.example ");
        input.setConfidence(0.9);
        input.setEventIds(List.of("e1", "e1"));

        // When
        Ioc created = service.createIoc(analyst, scope, input);

        // Then
        assertThat(created.getTenantId()).isEqualTo("tenant-a");
        assertThat(created.getValue()).isEqualTo("evil.example");
        assertThat(created.isWhitelisted()).isFalse();
        assertThat(created.getFirstSeen()).isEqualTo(NOW);
        verify(iocRepository).insert(created);
        verify(iocRepository).linkEvents(created.getId(), List.of("e1"));
        assertThat(resolve(service.getIocsForEvent(analyst, scope, linked))).hasSize(1);
        StepVerifier.create(updates.messages())
                .assertNext(change -> {
                    assertThat(change.getChangeType()).isEqualTo("CREATED");
                    assertThat(change.getIoc()).isSameAs(created);
                })
                .thenCancel()
                .verify();
    }

    @Test
    @DisplayName("should reject IOCs linked to unknown events or with an invalid confidence")
    void shouldValidateIocInput() {
        // Given
        when(eventRepository.findByIds(List.of("e9"))).thenReturn(List.of(event("e9", "tenant-b", Severity.LOW, null)));
        IocInput foreignLink = new IocInput();
        foreignLink.setType("ip");
        foreignLink.setValue("198.51.100.4");
        foreignLink.setEventIds(List.of("e9"));
        IocInput overconfident = new IocInput();
        overconfident.setType("ip");
        overconfident.setValue("198.51.100.4");
        overconfident.setConfidence(1.5);

        // Then
        assertThatThrownBy(() -> service.createIoc(analyst, scope, foreignLink))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("e9");
        assertThatThrownBy(() -> service.createIoc(analyst, scope, overconfident))
                .isInstanceOf(ValidationException.class);
        verify(iocRepository, never()).insert(any(Ioc.class));
    }

    // Reads

    @Test
    @DisplayName("should hide entities of another tenant")
    void shouldIsolateTenants() {
        // Given
        when(eventRepository.findByIds(anyList())).thenReturn(List.of(
                event("e1", "tenant-a", Severity.LOW, null),
                event("e2", "tenant-b", Severity.LOW, null)));

        // When
        CompletableFuture<SecurityEvent> foreign = service.getEvent(analyst, scope, "e2");
        CompletableFuture<List<Try<SecurityEvent>>> many = service.getEvents(analyst, scope, List.of("e2", "e1", "e3"));
        scope.dispatch();

        // Then
        assertThat(foreign.join()).isNull();
        assertThat(many.join()).allMatch(Try::isSuccess)
                .extracting(entry -> entry.get() == null ? null : entry.get().getId())
                .containsExactly(null, "e1", null);
        verify(eventRepository, times(1)).findByIds(anyList());
    }

    @Test
    @DisplayName("should keep the other events when one id of a multi-get fails")
    void shouldIsolateFailedIdInMultiGet() {
        // Given
        when(eventRepository.findByIds(anyList())).thenThrow(new PartialBatchFailureException(
                Map.of("e1", event("e1", "tenant-a", Severity.LOW, null)),
                Map.of("e2", new IllegalStateException("shard 2 offline"))));

        // When
        List<Try<SecurityEvent>> entries = resolve(service.getEvents(analyst, scope, List.of("e1", "e2", "e3")));

        // Then
        assertThat(entries).hasSize(3);
        assertThat(entries.get(0).get().getId()).isEqualTo("e1");
        assertThat(entries.get(1).isFailure()).isTrue();
        assertThat(entries.get(1).getThrowable()).isInstanceOf(UpstreamFailureException.class);
        assertThat(entries.get(2).isSuccess()).isTrue();
        assertThat(entries.get(2).get()).isNull();
    }

    @Test
    @DisplayName("should keep failed lookups of case events as failures")
    void shouldReportFailedCaseEvents() {
        // Given
        when(eventRepository.findByIds(anyList())).thenThrow(new IllegalStateException("database unavailable"));

        // When
        List<Try<SecurityEvent>> entries = resolve(service.getEventsForCase(analyst, scope,
                securityCase("c1", "tenant-a", null, CaseStatus.OPEN, "e1", "e2")));

        // Then
        assertThat(entries).hasSize(2).allMatch(Try::isFailure);
    }

    @Test
    @DisplayName("should cap the number of ids per query")
    void shouldCapIdsPerQuery() {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i <= SecurityOperationsService.MAX_IDS_PER_QUERY; i++) {
            ids.add("e" + i);
        }

        assertThatThrownBy(() -> service.getEvents(analyst, scope, ids)).isInstanceOf(ValidationException.class);
        verifyNoInteractions(eventRepository);
    }

    @Test
    @DisplayName("should list correlated events without the event itself")
    void shouldResolveCorrelatedEvents() {
        // Given
        SecurityEvent seed = event("e1", "tenant-a", Severity.HIGH, "corr-1");
        when(eventRepository.findByCorrelationIds(List.of("corr-1"))).thenReturn(List.of(
                seed,
                event("e2", "tenant-a", Severity.LOW, "corr-1"),
                event("e3", "tenant-b", Severity.LOW, "corr-1")));

        // When
        List<SecurityEvent> correlated = resolve(service.getCorrelatedEvents(analyst, scope, seed));
        List<SecurityEvent> none = resolve(service.getCorrelatedEvents(analyst, scope,
                event("e4", "tenant-a", Severity.LOW, null)));

        // Then
        assertThat(correlated).extracting(SecurityEvent::getId).containsExactly("e2");
        assertThat(none).isEmpty();
    }

    @Test
    @DisplayName("should batch the events of several cases into one query")
    void shouldBatchCaseEvents() {
        // Given
        when(eventRepository.findByIds(anyList())).thenReturn(List.of(
                event("e1", "tenant-a", Severity.LOW, null),
                event("e2", "tenant-a", Severity.HIGH, null)));

        // When
        CompletableFuture<List<Try<SecurityEvent>>> first = service.getEventsForCase(analyst, scope,
                securityCase("c1", "tenant-a", null, CaseStatus.OPEN, "e1", "e2", "e7"));
        CompletableFuture<List<Try<SecurityEvent>>> second = service.getEventsForCase(analyst, scope,
                securityCase("c2", "tenant-a", null, CaseStatus.OPEN, "e2"));
        scope.dispatch();

        // Then
        assertThat(first.join()).extracting(entry -> entry.get().getId()).containsExactly("e1", "e2");
        assertThat(second.join()).extracting(entry -> entry.get().getId()).containsExactly("e2");
        verify(eventRepository, times(1)).findByIds(anyList());
    }

    @Test
    @DisplayName("should return no correlation graph for an invisible seed")
    void shouldNotWalkFromInvisibleSeed() {
        // Given
        when(eventRepository.findByIds(anyList())).thenReturn(List.of(event("e9", "tenant-b", Severity.LOW, null)));

        // When
        CorrelationGraph graph = service.getCorrelationGraph(analyst, scope, "e9", null, null);

        // Then
        assertThat(graph).isNull();
        verify(correlationWalker).validate("e9", 3, 0.7);
        verify(correlationWalker, never()).walk(anyString(), anyInt(), anyDouble(), any(LoaderScope.class));
    }

    @Test
    @DisplayName("should walk the correlation graph in the request scope with defaults applied")
    void shouldWalkCorrelationGraph() {
        // Given
        CorrelationGraph expected = mock(CorrelationGraph.class);
        when(eventRepository.findByIds(anyList())).thenReturn(List.of(event("e1", "tenant-a", Severity.LOW, null)));
        when(correlationWalker.walk("e1", 2, 0.7, scope)).thenReturn(expected);

        // When
        CorrelationGraph graph = service.getCorrelationGraph(analyst, scope, "e1", 2, null);

        // Then
        assertThat(graph).isSameAs(expected);
    }

    @Test
    @DisplayName("should walk an entity graph without a score threshold")
    void shouldWalkEntityGraph() {
        // Given
        CorrelationGraph expected = mock(CorrelationGraph.class);
        when(correlationWalker.walk("host-7", 2, 0.0, scope)).thenReturn(expected);
        when(correlationWalker.walk("host-7", 4, 0.0, scope)).thenReturn(expected);

        // When
        CorrelationGraph byDefault = service.getEntityGraph(analyst, scope, "host-7", null);
        CorrelationGraph deeper = service.getEntityGraph(analyst, scope, "host-7", 4);

        // Then
        assertThat(byDefault).isSameAs(expected);
        assertThat(deeper).isSameAs(expected);
    }

    @Test
    @DisplayName("should require the correlation permission for entity graphs")
    void shouldGateEntityGraph() {
        RequestPrincipal reader = new RequestPrincipal("analyst-2", "tenant-a", EnumSet.of(Permission.READ_SECURITY_EVENTS));

        assertThatThrownBy(() -> service.getEntityGraph(reader, scope, "host-7", null))
                .isInstanceOf(AuthorizationException.class);
        verifyNoInteractions(correlationWalker);
    }

    // Subscriptions

    @Test
    @DisplayName("should apply the subscriber's event filter on top of tenant isolation")
    void shouldFilterEventStream() {
        // Given
        SecurityEventFilter filter = new SecurityEventFilter();
        filter.setSeverities(List.of(Severity.HIGH, Severity.CRITICAL));
        EventSubscription<SecurityEvent> filtered = service.subscribeEventStream(analyst, filter);
        EventSubscription<SecurityEvent> foreign = service.subscribeEventStream(otherTenantAnalyst, null);

        // When
        service.ingestEvent(analyst, scope, input(Severity.LOW, "dns_query"));
        service.ingestEvent(analyst, scope, input(Severity.HIGH, "port_scan"));

        // Then
        assertThat(foreign.pendingCount()).isZero();
        StepVerifier.create(filtered.messages())
                .assertNext(event -> assertThat(event.getEventType()).isEqualTo("port_scan"))
                .thenCancel()
                .verify();
    }
}

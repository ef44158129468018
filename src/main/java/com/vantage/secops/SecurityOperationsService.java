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
import com.vantage.error.ValidationException;
import com.vantage.fanout.EventSubscription;
import com.vantage.fanout.FanoutEngine;
import com.vantage.fanout.SubscriberContext;
import com.vantage.fanout.SubscriptionFilter;
import com.vantage.kafka.SecurityEventForwarder;
import com.vantage.loader.LoaderScope;
import com.vantage.security.AccessGate;
import com.vantage.security.Permission;
import com.vantage.security.RequestPrincipal;
import com.vantage.storage.IocRepository;
import com.vantage.storage.SecurityCaseRepository;
import com.vantage.storage.SecurityEventRepository;
import org.dataloader.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read, write and streaming operations behind the security operations dashboard.
 *
 * Every operation starts with the access gate. Reads go through the request's
 * loader scope. Writes follow a fixed order on the calling thread: store
 * write, cache invalidation, then publish. A reader of the same or a later
 * request therefore never sees a stale value once a subscriber has been
 * told about the change.
 *
 * Tenant isolation: entities of another tenant read as absent, and every
 * subscription only receives messages of the subscriber's tenant.
 */
@Service
public class SecurityOperationsService {

    private static final Logger logger = LoggerFactory.getLogger(SecurityOperationsService.class);

    static final int MAX_IDS_PER_QUERY = 1000;
    static final int MAX_BATCH_INGEST = 10_000;
    static final int DEFAULT_CORRELATION_DEPTH = 3;
    static final double DEFAULT_MIN_CORRELATION_SCORE = 0.7;
    static final int DEFAULT_ENTITY_GRAPH_DEPTH = 2;

    private final AccessGate accessGate;
    private final SecurityEventRepository eventRepository;
    private final SecurityCaseRepository caseRepository;
    private final IocRepository iocRepository;
    private final FanoutEngine fanoutEngine;
    private final CorrelationGraphWalker correlationWalker;
    private final SecurityEventForwarder eventForwarder;
    private final Clock clock;

    public SecurityOperationsService(AccessGate accessGate,
                                     SecurityEventRepository eventRepository,
                                     SecurityCaseRepository caseRepository,
                                     IocRepository iocRepository,
                                     FanoutEngine fanoutEngine,
                                     CorrelationGraphWalker correlationWalker,
                                     SecurityEventForwarder eventForwarder,
                                     Clock clock) {
        this.accessGate = accessGate;
        this.eventRepository = eventRepository;
        this.caseRepository = caseRepository;
        this.iocRepository = iocRepository;
        this.fanoutEngine = fanoutEngine;
        this.correlationWalker = correlationWalker;
        this.eventForwarder = eventForwarder;
        this.clock = clock;
    }

    // Reads

    public CompletableFuture<SecurityEvent> getEvent(RequestPrincipal principal, LoaderScope scope, String id) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        return SecurityLoaders.eventById(scope).load(id)
                .thenApply(event -> visible(principal, event, SecurityEvent::getTenantId));
    }

    /**
     * @return one entry per requested id, in request order: the event, null where
     * the event is absent or not visible, or the failure of that id alone
     */
    public CompletableFuture<List<Try<SecurityEvent>>> getEvents(RequestPrincipal principal, LoaderScope scope,
                                                                 List<String> ids) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        requireIdCount(ids);
        return SecurityLoaders.eventById(scope).loadManyTry(ids)
                .thenApply(entries -> visibleEntries(principal, entries, SecurityEvent::getTenantId));
    }

    /**
     * Other events sharing the event's correlation id.
     */
    public CompletableFuture<List<SecurityEvent>> getCorrelatedEvents(RequestPrincipal principal, LoaderScope scope,
                                                                      SecurityEvent event) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        if (event.getCorrelationId() == null || event.getCorrelationId().isBlank()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return SecurityLoaders.eventsByCorrelationId(scope).load(event.getCorrelationId())
                .thenApply(events -> {
                    List<SecurityEvent> others = new ArrayList<>();
                    for (SecurityEvent candidate : events) {
                        if (!candidate.getId().equals(event.getId())
                                && principal.getTenantId().equals(candidate.getTenantId())) {
                            others.add(candidate);
                        }
                    }
                    return others;
                });
    }

    public CompletableFuture<List<Ioc>> getIocsForEvent(RequestPrincipal principal, LoaderScope scope, SecurityEvent event) {
        accessGate.check(principal, Permission.READ_IOCS);
        return SecurityLoaders.iocsByEventId(scope).load(event.getId())
                .thenApply(iocs -> visibleOnly(principal, iocs, Ioc::getTenantId));
    }

    public CompletableFuture<List<SecurityCase>> getCasesForEvent(RequestPrincipal principal, LoaderScope scope,
                                                                  SecurityEvent event) {
        accessGate.check(principal, Permission.READ_CASES);
        return SecurityLoaders.casesByEventId(scope).load(event.getId())
                .thenApply(cases -> visibleOnly(principal, cases, SecurityCase::getTenantId));
    }

    /**
     * Events linked to a case. Absent and foreign events are left out; a failed
     * lookup stays in the list as a failure so the other events still resolve.
     */
    public CompletableFuture<List<Try<SecurityEvent>>> getEventsForCase(RequestPrincipal principal, LoaderScope scope,
                                                                        SecurityCase securityCase) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        if (securityCase.getEventIds() == null || securityCase.getEventIds().isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return SecurityLoaders.eventById(scope).loadManyTry(securityCase.getEventIds())
                .thenApply(entries -> {
                    List<Try<SecurityEvent>> linked = new ArrayList<>(entries.size());
                    for (Try<SecurityEvent> entry : visibleEntries(principal, entries, SecurityEvent::getTenantId)) {
                        if (entry.isFailure() || entry.get() != null) {
                            linked.add(entry);
                        }
                    }
                    return linked;
                });
    }

    public CompletableFuture<SecurityCase> getCase(RequestPrincipal principal, LoaderScope scope, String id) {
        accessGate.check(principal, Permission.READ_CASES);
        return SecurityLoaders.caseById(scope).load(id)
                .thenApply(securityCase -> visible(principal, securityCase, SecurityCase::getTenantId));
    }

    public CompletableFuture<Ioc> getIoc(RequestPrincipal principal, LoaderScope scope, String id) {
        accessGate.check(principal, Permission.READ_IOCS);
        return SecurityLoaders.iocById(scope).load(id)
                .thenApply(ioc -> visible(principal, ioc, Ioc::getTenantId));
    }

    /**
     * Correlation subgraph around an event, or null when the event is not visible.
     */
    public CorrelationGraph getCorrelationGraph(RequestPrincipal principal, LoaderScope scope, String eventId,
                                                Integer maxDepth, Double minScore) {
        accessGate.check(principal, Permission.READ_CORRELATIONS);
        int depth = maxDepth != null ? maxDepth : DEFAULT_CORRELATION_DEPTH;
        double score = minScore != null ? minScore : DEFAULT_MIN_CORRELATION_SCORE;
        correlationWalker.validate(eventId, depth, score);

        CompletableFuture<SecurityEvent> seed = SecurityLoaders.eventById(scope).load(eventId);
        scope.dispatch();
        SecurityEvent event = visible(principal, seed.join(), SecurityEvent::getTenantId);
        if (event == null) {
            logger.debug("Correlation seed {} not visible to tenant {}", eventId, principal.getTenantId());
            return null;
        }
        return correlationWalker.walk(eventId, depth, score, scope);
    }

    /**
     * Every relationship around a graph entity up to {@code depth} hops,
     * whatever its score. Graph entities carry no tenant, so only the
     * permission is checked.
     */
    public CorrelationGraph getEntityGraph(RequestPrincipal principal, LoaderScope scope, String entityId,
                                           Integer depth) {
        accessGate.check(principal, Permission.READ_CORRELATIONS);
        int hops = depth != null ? depth : DEFAULT_ENTITY_GRAPH_DEPTH;
        return correlationWalker.walk(entityId, hops, 0.0, scope);
    }

    // Writes

    public SecurityEvent ingestEvent(RequestPrincipal principal, LoaderScope scope, SecurityEventInput input) {
        accessGate.check(principal, Permission.INGEST_EVENTS);
        SecurityEvent event = toEvent(principal, input);

        eventRepository.insert(event);
        if (event.getCorrelationId() != null) {
            scope.invalidation().invalidate(SecurityLoaders.EVENTS_BY_CORRELATION_ID, event.getCorrelationId());
        }
        fanoutEngine.publish(SecurityChannels.EVENT_STREAM, event);
        if (event.getSeverity() == Severity.CRITICAL) {
            fanoutEngine.publish(SecurityChannels.CRITICAL_ALERTS, event);
        }
        eventForwarder.forward(event);

        logger.info("Ingested {} event {} for tenant {}", event.getSeverity(), event.getId(), event.getTenantId());
        return event;
    }

    /**
     * Hands a batch of events to the ingestion pipeline through Kafka. The
     * events are not stored here; the pipeline consumer does that.
     *
     * @return the number of events forwarded
     */
    public int ingestEventBatch(RequestPrincipal principal, List<SecurityEventInput> inputs) {
        accessGate.check(principal, Permission.INGEST_EVENTS);
        if (inputs == null || inputs.isEmpty()) {
            throw new ValidationException("events", "At least one event is required");
        }
        if (inputs.size() > MAX_BATCH_INGEST) {
            throw new ValidationException("events",
                    "A batch may contain at most " + MAX_BATCH_INGEST + " events, got " + inputs.size());
        }
        List<SecurityEvent> events = new ArrayList<>(inputs.size());
        for (SecurityEventInput input : inputs) {
            events.add(toEvent(principal, input));
        }
        events.forEach(eventForwarder::forward);
        logger.info("Forwarded batch of {} events for tenant {}", events.size(), principal.getTenantId());
        return events.size();
    }

    public SecurityEvent updateEvent(RequestPrincipal principal, LoaderScope scope, String id, SecurityEventUpdate update) {
        accessGate.check(principal, Permission.UPDATE_EVENTS);
        requireId(id, "id");
        if (update.getRiskScore() != null) {
            requireRiskScore(update.getRiskScore());
        }
        SecurityEvent event = eventRepository.findById(id)
                .filter(existing -> principal.getTenantId().equals(existing.getTenantId()))
                .orElseThrow(() -> new NotFoundException("SecurityEvent", id));

        if (update.getSeverity() != null) {
            event.setSeverity(update.getSeverity());
        }
        if (update.getRiskScore() != null) {
            event.setRiskScore(update.getRiskScore());
        }
        if (update.getMessage() != null) {
            event.setMessage(update.getMessage());
        }

        eventRepository.update(event);
        scope.invalidation().invalidate(SecurityLoaders.EVENT_BY_ID, id);
        if (event.getCorrelationId() != null) {
            scope.invalidation().invalidate(SecurityLoaders.EVENTS_BY_CORRELATION_ID, event.getCorrelationId());
        }
        fanoutEngine.publish(SecurityChannels.EVENT_STREAM, event);
        logger.info("Updated security event {} by {}", id, principal.getUserId());
        return event;
    }

    public boolean deleteEvent(RequestPrincipal principal, LoaderScope scope, String id) {
        accessGate.check(principal, Permission.DELETE_EVENTS);
        requireId(id, "id");
        SecurityEvent event = eventRepository.findById(id)
                .filter(existing -> principal.getTenantId().equals(existing.getTenantId()))
                .orElseThrow(() -> new NotFoundException("SecurityEvent", id));

        if (!eventRepository.delete(id)) {
            throw new NotFoundException("SecurityEvent", id);
        }
        scope.invalidation().invalidate(SecurityLoaders.EVENT_BY_ID, id);
        if (event.getCorrelationId() != null) {
            scope.invalidation().invalidate(SecurityLoaders.EVENTS_BY_CORRELATION_ID, event.getCorrelationId());
        }
        fanoutEngine.publish(SecurityChannels.EVENT_DELETIONS, event);
        logger.info("Deleted security event {} by {}", id, principal.getUserId());
        return true;
    }

    public SecurityCase createCase(RequestPrincipal principal, LoaderScope scope, SecurityCaseInput input) {
        accessGate.check(principal, Permission.CREATE_CASES);
        if (input.getTitle() == null || input.getTitle().isBlank()) {
            throw new ValidationException("title", "Case title must not be empty");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        SecurityCase securityCase = new SecurityCase();
        securityCase.setId(UUID.randomUUID().toString());
        securityCase.setTenantId(principal.getTenantId());
        securityCase.setTitle(input.getTitle().trim());
        securityCase.setDescription(input.getDescription());
        securityCase.setPriority(input.getPriority() != null ? input.getPriority() : Severity.MEDIUM);
        securityCase.setAssigneeId(blankToNull(input.getAssigneeId()));
        securityCase.setStatus(securityCase.getAssigneeId() != null ? CaseStatus.IN_PROGRESS : CaseStatus.OPEN);
        securityCase.setEventIds(input.getEventIds() != null
                ? new ArrayList<>(input.getEventIds().stream().distinct().toList())
                : new ArrayList<>());
        securityCase.setCreatedAt(now);
        securityCase.setUpdatedAt(now);

        caseRepository.insert(securityCase);
        for (String eventId : securityCase.getEventIds()) {
            scope.invalidation().invalidate(SecurityLoaders.CASES_BY_EVENT_ID, eventId);
        }
        CaseChange change = caseChange(CaseChangeType.CREATED, securityCase, null, principal, now);
        fanoutEngine.publish(SecurityChannels.CASE_UPDATES, change);
        if (securityCase.getAssigneeId() != null) {
            fanoutEngine.publish(SecurityChannels.CASE_ASSIGNMENTS, change);
        }
        logger.info("Created case {} for tenant {}", securityCase.getId(), securityCase.getTenantId());
        return securityCase;
    }

    public SecurityCase assignCase(RequestPrincipal principal, LoaderScope scope, String caseId, String assigneeId) {
        accessGate.check(principal, Permission.ASSIGN_CASES);
        requireId(caseId, "caseId");
        requireId(assigneeId, "assigneeId");
        SecurityCase securityCase = caseRepository.findById(caseId)
                .filter(existing -> principal.getTenantId().equals(existing.getTenantId()))
                .orElseThrow(() -> new NotFoundException("SecurityCase", caseId));

        OffsetDateTime now = OffsetDateTime.now(clock);
        String previousAssignee = securityCase.getAssigneeId();
        securityCase.setAssigneeId(assigneeId);
        if (securityCase.getStatus() == CaseStatus.OPEN) {
            securityCase.setStatus(CaseStatus.IN_PROGRESS);
        }
        securityCase.setUpdatedAt(now);

        caseRepository.updateAssignee(caseId, assigneeId, securityCase.getStatus(), now);
        scope.invalidation().invalidate(SecurityLoaders.CASE_BY_ID, caseId);
        for (String eventId : securityCase.getEventIds()) {
            scope.invalidation().invalidate(SecurityLoaders.CASES_BY_EVENT_ID, eventId);
        }
        CaseChange change = caseChange(CaseChangeType.ASSIGNED, securityCase, previousAssignee, principal, now);
        fanoutEngine.publish(SecurityChannels.CASE_ASSIGNMENTS, change);
        fanoutEngine.publish(SecurityChannels.CASE_UPDATES, change);
        logger.info("Assigned case {} to {} (was {})", caseId, assigneeId, previousAssignee);
        return securityCase;
    }

    public Ioc whitelistIoc(RequestPrincipal principal, LoaderScope scope, String iocId, String reason) {
        accessGate.check(principal, Permission.WHITELIST_IOCS);
        requireId(iocId, "id");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("reason", "A whitelist reason is required");
        }
        Ioc ioc = iocRepository.findByIds(List.of(iocId)).stream()
                .filter(existing -> principal.getTenantId().equals(existing.getTenantId()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Ioc", iocId));

        iocRepository.whitelist(iocId, reason);
        ioc.setWhitelisted(true);
        ioc.setWhitelistReason(reason);
        scope.invalidation().invalidate(SecurityLoaders.IOC_BY_ID, iocId);
        for (String eventId : iocRepository.findEventIds(iocId)) {
            scope.invalidation().invalidate(SecurityLoaders.IOCS_BY_EVENT_ID, eventId);
        }

        fanoutEngine.publish(SecurityChannels.IOC_UPDATES, iocChange("WHITELISTED", ioc, principal));
        logger.info("IOC {} whitelisted by {}", iocId, principal.getUserId());
        return ioc;
    }

    /**
     * Stores a new indicator, optionally linked to events of the caller's tenant.
     */
    public Ioc createIoc(RequestPrincipal principal, LoaderScope scope, IocInput input) {
        accessGate.check(principal, Permission.CREATE_IOCS);
        if (input == null) {
            throw new ValidationException("input", "IOC input must not be null");
        }
        requireId(input.getType(), "type");
        requireId(input.getValue(), "value");
        if (input.getConfidence() != null && (input.getConfidence() < 0 || input.getConfidence() > 1)) {
            throw new ValidationException("confidence", "Confidence must be between 0 and 1, got " + input.getConfidence());
        }
        List<String> eventIds = input.getEventIds() != null
                ? input.getEventIds().stream().distinct().toList()
                : List.of();
        requireIdCount(eventIds);
        if (!eventIds.isEmpty()) {
            Set<String> known = eventRepository.findByIds(eventIds).stream()
                    .filter(event -> principal.getTenantId().equals(event.getTenantId()))
                    .map(SecurityEvent::getId)
                    .collect(Collectors.toSet());
            for (String eventId : eventIds) {
                if (!known.contains(eventId)) {
                    throw new ValidationException("eventIds", "Unknown security event " + eventId);
                }
            }
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Ioc ioc = new Ioc();
        ioc.setId(UUID.randomUUID().toString());
        ioc.setTenantId(principal.getTenantId());
        ioc.setType(input.getType().trim());
        ioc.setValue(input.getValue().trim());
        ioc.setConfidence(input.getConfidence());
        ioc.setFirstSeen(now);
        ioc.setLastSeen(now);

        iocRepository.insert(ioc);
        iocRepository.linkEvents(ioc.getId(), eventIds);
        for (String eventId : eventIds) {
            scope.invalidation().invalidate(SecurityLoaders.IOCS_BY_EVENT_ID, eventId);
        }
        fanoutEngine.publish(SecurityChannels.IOC_UPDATES, iocChange("CREATED", ioc, principal));
        logger.info("Created {} IOC {} for tenant {}", ioc.getType(), ioc.getId(), ioc.getTenantId());
        return ioc;
    }

    // Subscriptions

    public EventSubscription<SecurityEvent> subscribeEventStream(RequestPrincipal principal, SecurityEventFilter filter) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        SubscriptionFilter<SecurityEvent> tenant = sameTenant(SecurityEvent::getTenantId);
        SubscriptionFilter<SecurityEvent> criteria = filter == null
                ? tenant
                : tenant.and((event, context) -> filter.matches(event));
        return fanoutEngine.subscribe(SecurityChannels.EVENT_STREAM, contextOf(principal), criteria);
    }

    public EventSubscription<SecurityEvent> subscribeEventDeletions(RequestPrincipal principal) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        return fanoutEngine.subscribe(SecurityChannels.EVENT_DELETIONS, contextOf(principal),
                sameTenant(SecurityEvent::getTenantId));
    }

    public EventSubscription<SecurityEvent> subscribeCriticalAlerts(RequestPrincipal principal) {
        accessGate.check(principal, Permission.READ_SECURITY_EVENTS);
        return fanoutEngine.subscribe(SecurityChannels.CRITICAL_ALERTS, contextOf(principal),
                sameTenant(SecurityEvent::getTenantId));
    }

    public EventSubscription<CaseChange> subscribeCaseUpdates(RequestPrincipal principal, String caseId) {
        accessGate.check(principal, Permission.READ_CASES);
        SubscriptionFilter<CaseChange> tenant = sameTenant(change -> change.getSecurityCase().getTenantId());
        SubscriptionFilter<CaseChange> criteria = caseId == null
                ? tenant
                : tenant.and((change, context) -> caseId.equals(change.getSecurityCase().getId()));
        return fanoutEngine.subscribe(SecurityChannels.CASE_UPDATES, contextOf(principal), criteria);
    }

    /**
     * Assignments to one analyst; defaults to the caller.
     */
    public EventSubscription<CaseChange> subscribeCaseAssignments(RequestPrincipal principal, String analystId) {
        accessGate.check(principal, Permission.READ_CASES);
        String analyst = analystId != null ? analystId : principal.getUserId();
        SubscriptionFilter<CaseChange> criteria = this.<CaseChange>sameTenant(change -> change.getSecurityCase().getTenantId())
                .and((change, context) -> analyst.equals(change.getSecurityCase().getAssigneeId()));
        return fanoutEngine.subscribe(SecurityChannels.CASE_ASSIGNMENTS, contextOf(principal), criteria);
    }

    public EventSubscription<IocChange> subscribeIocUpdates(RequestPrincipal principal) {
        accessGate.check(principal, Permission.READ_IOCS);
        return fanoutEngine.subscribe(SecurityChannels.IOC_UPDATES, contextOf(principal),
                sameTenant(change -> change.getIoc().getTenantId()));
    }

    private SecurityEvent toEvent(RequestPrincipal principal, SecurityEventInput input) {
        if (input == null) {
            throw new ValidationException("event", "Event input must not be null");
        }
        if (input.getSeverity() == null) {
            throw new ValidationException("severity", "Event severity is required");
        }
        if (input.getEventType() == null || input.getEventType().isBlank()) {
            throw new ValidationException("eventType", "Event type is required");
        }
        if (input.getRiskScore() != null) {
            requireRiskScore(input.getRiskScore());
        }
        SecurityEvent event = new SecurityEvent();
        event.setId(UUID.randomUUID().toString());
        event.setTenantId(principal.getTenantId());
        event.setTimestamp(input.getTimestamp() != null ? input.getTimestamp() : OffsetDateTime.now(clock));
        event.setSeverity(input.getSeverity());
        event.setEventType(input.getEventType());
        event.setDeviceVendor(input.getDeviceVendor());
        event.setDeviceProduct(input.getDeviceProduct());
        event.setSourceIp(input.getSourceIp());
        event.setDestinationIp(input.getDestinationIp());
        event.setMessage(input.getMessage());
        event.setRiskScore(input.getRiskScore());
        event.setCorrelationId(blankToNull(input.getCorrelationId()));
        return event;
    }

    private CaseChange caseChange(CaseChangeType type, SecurityCase securityCase, String previousAssignee,
                                  RequestPrincipal principal, OffsetDateTime now) {
        CaseChange change = new CaseChange();
        change.setChangeType(type);
        change.setSecurityCase(securityCase);
        change.setPreviousAssigneeId(previousAssignee);
        change.setActorId(principal.getUserId());
        change.setOccurredAt(now);
        return change;
    }

    private IocChange iocChange(String type, Ioc ioc, RequestPrincipal principal) {
        IocChange change = new IocChange();
        change.setChangeType(type);
        change.setIoc(ioc);
        change.setActorId(principal.getUserId());
        change.setOccurredAt(OffsetDateTime.now(clock));
        return change;
    }

    private <M> SubscriptionFilter<M> sameTenant(Function<M, String> tenantOf) {
        return (message, context) -> Objects.equals(context.getTenantId(), tenantOf.apply(message));
    }

    private static SubscriberContext contextOf(RequestPrincipal principal) {
        return new SubscriberContext(principal.getUserId(), principal.getTenantId());
    }

    private static <T> T visible(RequestPrincipal principal, T entity, Function<T, String> tenantOf) {
        if (entity == null || !principal.getTenantId().equals(tenantOf.apply(entity))) {
            return null;
        }
        return entity;
    }

    private static <T> List<Try<T>> visibleEntries(RequestPrincipal principal, List<Try<T>> entries,
                                                   Function<T, String> tenantOf) {
        List<Try<T>> result = new ArrayList<>(entries.size());
        for (Try<T> entry : entries) {
            result.add(entry.isSuccess() ? Try.succeeded(visible(principal, entry.get(), tenantOf)) : entry);
        }
        return result;
    }

    private static <T> List<T> visibleOnly(RequestPrincipal principal, List<T> entities, Function<T, String> tenantOf) {
        List<T> result = new ArrayList<>(entities.size());
        for (T entity : entities) {
            if (visible(principal, entity, tenantOf) != null) {
                result.add(entity);
            }
        }
        return result;
    }

    private static void requireIdCount(List<String> ids) {
        if (ids == null) {
            throw new ValidationException("ids", "Id list must not be null");
        }
        if (ids.size() > MAX_IDS_PER_QUERY) {
            throw new ValidationException("ids",
                    "At most " + MAX_IDS_PER_QUERY + " ids may be requested at once, got " + ids.size());
        }
    }

    private static void requireId(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " must not be empty");
        }
    }

    private static void requireRiskScore(double riskScore) {
        if (riskScore < 0 || riskScore > 100) {
            throw new ValidationException("riskScore", "Risk score must be between 0 and 100, got " + riskScore);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}

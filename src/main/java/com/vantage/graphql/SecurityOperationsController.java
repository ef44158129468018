package com.vantage.graphql;

import com.vantage.correlation.CorrelationGraph;
import com.vantage.domain.CaseChange;
import com.vantage.domain.Ioc;
import com.vantage.domain.IocChange;
import com.vantage.domain.IocInput;
import com.vantage.domain.SecurityCase;
import com.vantage.domain.SecurityCaseInput;
import com.vantage.domain.SecurityEvent;
import com.vantage.domain.SecurityEventFilter;
import com.vantage.domain.SecurityEventInput;
import com.vantage.domain.SecurityEventUpdate;
import com.vantage.loader.LoaderScope;
import com.vantage.secops.SecurityOperationsService;
import com.vantage.security.RequestPrincipal;
import graphql.execution.DataFetcherResult;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.ContextValue;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.graphql.data.method.annotation.SubscriptionMapping;
import org.springframework.stereotype.Controller;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * GraphQL entry points of the security operations dashboard.
 *
 * The controller only binds arguments and context values; permission checks,
 * tenant isolation and cache invalidation live in {@link SecurityOperationsService}.
 * Field resolvers return futures from the request's loaders so sibling fields
 * of a list share one batch per level.
 */
@Controller
public class SecurityOperationsController {

    private static final Logger logger = LoggerFactory.getLogger(SecurityOperationsController.class);

    private final SecurityOperationsService service;
    private final ListEntryResults listEntryResults;

    public SecurityOperationsController(SecurityOperationsService service, ListEntryResults listEntryResults) {
        this.service = service;
        this.listEntryResults = listEntryResults;
    }

    @QueryMapping
    public CompletableFuture<SecurityEvent> securityEvent(@Argument String id,
                                                          @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                          @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getEvent(principal, scope, id);
    }

    @QueryMapping
    public CompletableFuture<DataFetcherResult<List<SecurityEvent>>> securityEvents(@Argument List<String> ids,
                                                                                    @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                                                    @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal,
                                                                                    DataFetchingEnvironment env) {
        return service.getEvents(principal, scope, ids)
                .thenApply(entries -> listEntryResults.positional(entries, env));
    }

    @QueryMapping
    public CompletableFuture<SecurityCase> securityCase(@Argument String id,
                                                        @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                        @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getCase(principal, scope, id);
    }

    @QueryMapping
    public CompletableFuture<Ioc> ioc(@Argument String id,
                                      @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                      @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getIoc(principal, scope, id);
    }

    @QueryMapping
    public CorrelationGraph eventCorrelationGraph(@Argument String eventId,
                                                  @Argument Integer maxDepth,
                                                  @Argument Double minCorrelationScore,
                                                  @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                  @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        logger.debug("eventCorrelationGraph called with eventId={}, maxDepth={}, minCorrelationScore={}",
                eventId, maxDepth, minCorrelationScore);
        return service.getCorrelationGraph(principal, scope, eventId, maxDepth, minCorrelationScore);
    }

    @QueryMapping
    public CorrelationGraph entityRelationshipGraph(@Argument String entityId,
                                                    @Argument Integer depth,
                                                    @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                    @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getEntityGraph(principal, scope, entityId, depth);
    }

    @SchemaMapping(typeName = "SecurityEvent", field = "correlatedEvents")
    public CompletableFuture<List<SecurityEvent>> correlatedEvents(SecurityEvent event,
                                                                   @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                                   @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getCorrelatedEvents(principal, scope, event);
    }

    @SchemaMapping(typeName = "SecurityEvent", field = "iocs")
    public CompletableFuture<List<Ioc>> iocs(SecurityEvent event,
                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getIocsForEvent(principal, scope, event);
    }

    @SchemaMapping(typeName = "SecurityEvent", field = "cases")
    public CompletableFuture<List<SecurityCase>> cases(SecurityEvent event,
                                                       @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                       @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getCasesForEvent(principal, scope, event);
    }

    @SchemaMapping(typeName = "SecurityCase", field = "events")
    public CompletableFuture<DataFetcherResult<List<SecurityEvent>>> caseEvents(SecurityCase securityCase,
                                                                                @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                                                @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal,
                                                                                DataFetchingEnvironment env) {
        return service.getEventsForCase(principal, scope, securityCase)
                .thenApply(entries -> listEntryResults.resolvedOnly(entries, env));
    }

    @MutationMapping
    public SecurityEvent ingestSecurityEvent(@Argument SecurityEventInput input,
                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.ingestEvent(principal, scope, input);
    }

    @MutationMapping
    public int ingestSecurityEventBatch(@Argument List<SecurityEventInput> events,
                                        @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.ingestEventBatch(principal, events);
    }

    @MutationMapping
    public SecurityEvent updateSecurityEvent(@Argument String id,
                                             @Argument SecurityEventUpdate input,
                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.updateEvent(principal, scope, id, input);
    }

    @MutationMapping
    public boolean deleteSecurityEvent(@Argument String id,
                                       @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                       @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.deleteEvent(principal, scope, id);
    }

    @MutationMapping
    public SecurityCase createSecurityCase(@Argument SecurityCaseInput input,
                                           @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                           @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.createCase(principal, scope, input);
    }

    @MutationMapping
    public SecurityCase assignCase(@Argument String caseId,
                                   @Argument String assigneeId,
                                   @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                   @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.assignCase(principal, scope, caseId, assigneeId);
    }

    @MutationMapping
    public Ioc whitelistIoc(@Argument String id,
                            @Argument String reason,
                            @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                            @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.whitelistIoc(principal, scope, id, reason);
    }

    @MutationMapping("createIOC")
    public Ioc createIoc(@Argument IocInput input,
                         @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                         @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.createIoc(principal, scope, input);
    }

    @SubscriptionMapping
    public Flux<SecurityEvent> securityEventStream(@Argument SecurityEventFilter filter,
                                                   @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeEventStream(principal, filter).messages();
    }

    @SubscriptionMapping
    public Flux<SecurityEvent> securityEventDeleted(
            @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeEventDeletions(principal).messages();
    }

    @SubscriptionMapping
    public Flux<SecurityEvent> criticalSecurityAlerts(
            @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeCriticalAlerts(principal).messages();
    }

    @SubscriptionMapping
    public Flux<CaseChange> caseUpdates(@Argument String caseId,
                                        @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeCaseUpdates(principal, caseId).messages();
    }

    @SubscriptionMapping
    public Flux<CaseChange> caseAssignments(@Argument String analystId,
                                            @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeCaseAssignments(principal, analystId).messages();
    }

    @SubscriptionMapping
    public Flux<IocChange> iocUpdates(@ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeIocUpdates(principal).messages();
    }
}

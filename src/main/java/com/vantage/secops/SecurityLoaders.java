package com.vantage.secops;

import com.vantage.domain.Ioc;
import com.vantage.domain.SecurityCase;
import com.vantage.domain.SecurityEvent;
import com.vantage.loader.BatchFetchers;
import com.vantage.loader.LoaderDefinition;
import com.vantage.loader.LoaderScope;
import com.vantage.loader.RequestLoader;
import com.vantage.storage.IocRepository;
import com.vantage.storage.SecurityCaseRepository;
import com.vantage.storage.SecurityEventRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Batch loaders for the security operations dashboard.
 *
 * Each bean declares one named loader; every request scope gets its own cache
 * for each of them. The names double as cache names on the invalidation bus.
 * Batch sizes follow the cost of the underlying query: IOC lookups are cheap
 * primary-key reads, case lookups pull their event links as well.
 */
@Configuration
public class SecurityLoaders {

    public static final String EVENT_BY_ID = "security-event-by-id";
    public static final String EVENTS_BY_CORRELATION_ID = "security-events-by-correlation-id";
    public static final String CASE_BY_ID = "security-case-by-id";
    public static final String CASES_BY_EVENT_ID = "security-cases-by-event-id";
    public static final String IOC_BY_ID = "ioc-by-id";
    public static final String IOCS_BY_EVENT_ID = "iocs-by-event-id";

    @Bean
    public LoaderDefinition<String, SecurityEvent> securityEventByIdLoader(SecurityEventRepository repository) {
        return LoaderDefinition.<String, SecurityEvent>single(EVENT_BY_ID,
                        BatchFetchers.indexedBy(repository::findByIds, SecurityEvent::getId))
                .withMaxBatchSize(100);
    }

    @Bean
    public LoaderDefinition<String, List<SecurityEvent>> securityEventsByCorrelationIdLoader(
            SecurityEventRepository repository) {
        return LoaderDefinition.<String, SecurityEvent>grouped(EVENTS_BY_CORRELATION_ID,
                        BatchFetchers.groupedBy(repository::findByCorrelationIds, SecurityEvent::getCorrelationId))
                .withMaxBatchSize(50);
    }

    @Bean
    public LoaderDefinition<String, SecurityCase> securityCaseByIdLoader(SecurityCaseRepository repository) {
        return LoaderDefinition.<String, SecurityCase>single(CASE_BY_ID,
                        BatchFetchers.indexedBy(repository::findByIds, SecurityCase::getId))
                .withMaxBatchSize(50);
    }

    @Bean
    public LoaderDefinition<String, List<SecurityCase>> securityCasesByEventIdLoader(SecurityCaseRepository repository) {
        return LoaderDefinition.<String, SecurityCase>grouped(CASES_BY_EVENT_ID, repository::findByEventIds)
                .withMaxBatchSize(100);
    }

    @Bean
    public LoaderDefinition<String, Ioc> iocByIdLoader(IocRepository repository) {
        return LoaderDefinition.<String, Ioc>single(IOC_BY_ID, BatchFetchers.indexedBy(repository::findByIds, Ioc::getId))
                .withMaxBatchSize(200);
    }

    @Bean
    public LoaderDefinition<String, List<Ioc>> iocsByEventIdLoader(IocRepository repository) {
        return LoaderDefinition.<String, Ioc>grouped(IOCS_BY_EVENT_ID, repository::findByEventIds)
                .withMaxBatchSize(100);
    }

    public static RequestLoader<String, SecurityEvent> eventById(LoaderScope scope) {
        return scope.loader(EVENT_BY_ID);
    }

    public static RequestLoader<String, List<SecurityEvent>> eventsByCorrelationId(LoaderScope scope) {
        return scope.loader(EVENTS_BY_CORRELATION_ID);
    }

    public static RequestLoader<String, SecurityCase> caseById(LoaderScope scope) {
        return scope.loader(CASE_BY_ID);
    }

    public static RequestLoader<String, List<SecurityCase>> casesByEventId(LoaderScope scope) {
        return scope.loader(CASES_BY_EVENT_ID);
    }

    public static RequestLoader<String, Ioc> iocById(LoaderScope scope) {
        return scope.loader(IOC_BY_ID);
    }

    public static RequestLoader<String, List<Ioc>> iocsByEventId(LoaderScope scope) {
        return scope.loader(IOCS_BY_EVENT_ID);
    }
}

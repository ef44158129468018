package com.vantage.graphql;

import graphql.scalars.ExtendedScalars;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.graphql.ExecutionGraphQlService;
import org.springframework.graphql.execution.BatchLoaderRegistry;
import org.springframework.graphql.execution.DefaultExecutionGraphQlService;
import org.springframework.graphql.execution.GraphQlSource;
import org.springframework.graphql.execution.RuntimeWiringConfigurer;

/**
 * Configuration class for GraphQL setup.
 *
 * Registers the custom scalars and replaces the auto-configured execution
 * service so that every execution gets its own {@link com.vantage.loader.LoaderScope}.
 */
@Configuration
public class GraphQLConfig {

    @Bean
    public RuntimeWiringConfigurer runtimeWiringConfigurer() {
        return wiringBuilder -> wiringBuilder
                // ISO 8601 timestamps
                .scalar(ExtendedScalars.DateTime)
                // node attributes and edge evidence
                .scalar(ExtendedScalars.Json);
    }

    /**
     * Execution service with the loader scope registrar added next to the
     * annotated batch loader registry.
     */
    @Bean
    public ExecutionGraphQlService executionGraphQlService(GraphQlSource graphQlSource,
                                                           BatchLoaderRegistry batchLoaderRegistry,
                                                           LoaderScopeRegistrar loaderScopeRegistrar) {
        DefaultExecutionGraphQlService service = new DefaultExecutionGraphQlService(graphQlSource);
        service.addDataLoaderRegistrar(batchLoaderRegistry);
        service.addDataLoaderRegistrar(loaderScopeRegistrar);
        return service;
    }
}

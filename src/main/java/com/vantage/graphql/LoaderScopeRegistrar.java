package com.vantage.graphql;

import com.vantage.loader.LoaderScope;
import com.vantage.loader.LoaderScopeFactory;
import graphql.GraphQLContext;
import org.dataloader.DataLoaderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataLoaderRegistrar;
import org.springframework.stereotype.Component;

/**
 * Opens one {@link LoaderScope} per GraphQL execution.
 *
 * The scope's loaders join the execution's {@link DataLoaderRegistry} so
 * graphql-java dispatches them level by level, and the scope itself is
 * stored in the GraphQL context under {@link LoaderScope#CONTEXT_KEY}, where
 * {@link LoaderScopeCloser} closes it once the execution has responded.
 */
@Component
public class LoaderScopeRegistrar implements DataLoaderRegistrar {

    private static final Logger logger = LoggerFactory.getLogger(LoaderScopeRegistrar.class);

    private final LoaderScopeFactory scopeFactory;

    public LoaderScopeRegistrar(LoaderScopeFactory scopeFactory) {
        this.scopeFactory = scopeFactory;
    }

    @Override
    public void registerDataLoaders(DataLoaderRegistry registry, GraphQLContext context) {
        LoaderScope scope = scopeFactory.openScope();
        scope.registry().getDataLoadersMap().forEach(registry::register);
        context.put(LoaderScope.CONTEXT_KEY, scope);
        logger.debug("Registered loader scope {} with {} loaders", scope.getId(), scope.loaders().size());
    }
}

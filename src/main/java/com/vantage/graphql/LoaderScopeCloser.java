package com.vantage.graphql;

import com.vantage.loader.LoaderScope;
import graphql.GraphQLContext;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Closes the execution's {@link LoaderScope} once a query or mutation has
 * produced its response, or when the execution fails.
 *
 * A subscription's response carries a stream rather than data; its scope
 * stays open for the lifetime of that stream.
 */
@Component
public class LoaderScopeCloser implements WebGraphQlInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(LoaderScopeCloser.class);

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        AtomicReference<GraphQLContext> context = new AtomicReference<>();
        request.configureExecutionInput((input, builder) -> {
            context.set(input.getGraphQLContext());
            return input;
        });
        return chain.next(request)
                .doOnNext(response -> {
                    if (!(response.getExecutionResult().getData() instanceof Publisher)) {
                        close(context.get());
                    }
                })
                .doOnError(error -> close(context.get()));
    }

    private void close(GraphQLContext context) {
        if (context == null) {
            return;
        }
        LoaderScope scope = context.get(LoaderScope.CONTEXT_KEY);
        if (scope != null) {
            scope.close();
            logger.debug("Closed loader scope {}", scope.getId());
        }
    }
}

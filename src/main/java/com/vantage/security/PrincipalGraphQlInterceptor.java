package com.vantage.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.server.WebGraphQlInterceptor;
import org.springframework.graphql.server.WebGraphQlRequest;
import org.springframework.graphql.server.WebGraphQlResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * Puts the caller's {@link RequestPrincipal} into the GraphQL context.
 *
 * Requests without a usable token still execute; the principal is simply
 * absent and every operation then fails at the {@link AccessGate} with an
 * UNAUTHORIZED error. Works for HTTP requests and for the WebSocket handshake
 * of subscriptions.
 */
@Component
public class PrincipalGraphQlInterceptor implements WebGraphQlInterceptor {

    private static final Logger log = LoggerFactory.getLogger(PrincipalGraphQlInterceptor.class);

    private final BearerTokenDecoder tokenDecoder;

    public PrincipalGraphQlInterceptor(BearerTokenDecoder tokenDecoder) {
        this.tokenDecoder = tokenDecoder;
    }

    @Override
    public Mono<WebGraphQlResponse> intercept(WebGraphQlRequest request, Chain chain) {
        Optional<RequestPrincipal> principal = tokenDecoder.decode(request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        if (principal.isPresent()) {
            RequestPrincipal resolved = principal.get();
            log.debug("GraphQL request {} from user {} (tenant {})",
                    request.getId(), resolved.getUserId(), resolved.getTenantId());
            request.configureExecutionInput((input, builder) ->
                    builder.graphQLContext(Map.<String, Object>of(RequestPrincipal.CONTEXT_KEY, resolved)).build());
        } else {
            log.debug("GraphQL request {} without principal", request.getId());
        }
        return chain.next(request);
    }
}

package com.vantage.graphql;

import com.vantage.error.NotFoundException;
import com.vantage.error.UpstreamFailureException;
import com.vantage.error.UpstreamTimeoutException;
import com.vantage.error.ValidationException;
import com.vantage.security.AuthorizationException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Turns exceptions raised while resolving a field into GraphQL errors.
 *
 * Supported error types:
 * - BAD_REQUEST: validation failures and illegal arguments
 * - UNAUTHORIZED / FORBIDDEN: access gate rejections
 * - NOT_FOUND: a mutation targeted a missing entity
 * - INTERNAL_ERROR: downstream failures, timeouts and anything unexpected
 *
 * Downstream failures never leak their cause to the client; the message is
 * generic and the loader or store name is only logged.
 */
@Component
public class GraphQLErrorHandler extends DataFetcherExceptionResolverAdapter {

    private static final Logger logger = LoggerFactory.getLogger(GraphQLErrorHandler.class);

    static final String UNAVAILABLE_MESSAGE = "The data source is temporarily unavailable, please retry";
    static final String TIMEOUT_MESSAGE = "The data source did not answer in time, please retry";

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        Throwable error = unwrap(ex);

        if (error instanceof ValidationException) {
            ValidationException validation = (ValidationException) error;
            Map<String, Object> extensions = extensions("VALIDATION_FAILED");
            if (validation.getField() != null) {
                extensions.put("field", validation.getField());
            }
            return build(env, ErrorType.BAD_REQUEST, formatErrorMessage(validation), extensions);
        }
        if (error instanceof AuthorizationException) {
            return handleAuthorization((AuthorizationException) error, env);
        }
        if (error instanceof NotFoundException) {
            NotFoundException notFound = (NotFoundException) error;
            Map<String, Object> extensions = extensions("NOT_FOUND");
            extensions.put("entityType", notFound.getEntityType());
            return build(env, ErrorType.NOT_FOUND, formatErrorMessage(notFound), extensions);
        }
        if (error instanceof UpstreamTimeoutException) {
            UpstreamTimeoutException timeout = (UpstreamTimeoutException) error;
            logger.warn("Resolving {} timed out in {}", path(env), timeout.getSource());
            return build(env, ErrorType.INTERNAL_ERROR, TIMEOUT_MESSAGE, extensions("UPSTREAM_TIMEOUT"));
        }
        if (error instanceof UpstreamFailureException) {
            UpstreamFailureException failure = (UpstreamFailureException) error;
            logger.warn("Resolving {} failed in {}: {}", path(env), failure.getSource(), failure.getMessage());
            return build(env, ErrorType.INTERNAL_ERROR, UNAVAILABLE_MESSAGE, extensions("UPSTREAM_UNAVAILABLE"));
        }
        if (error instanceof IllegalArgumentException) {
            return build(env, ErrorType.BAD_REQUEST, formatErrorMessage(error), extensions("INVALID_ARGUMENT"));
        }
        if (error instanceof NullPointerException) {
            logger.error("Null value while resolving {}", path(env), error);
            return build(env, ErrorType.INTERNAL_ERROR, "An unexpected null value was encountered",
                    extensions("NULL_POINTER"));
        }

        logger.error("Unexpected error while resolving {}", path(env), error);
        Map<String, Object> extensions = extensions("INTERNAL_ERROR");
        extensions.put("exceptionType", error.getClass().getSimpleName());
        return build(env, ErrorType.INTERNAL_ERROR, "An internal error occurred while processing your request",
                extensions);
    }

    /**
     * Maps the failure of one list entry, pointing the error path at the entry's index.
     */
    GraphQLError resolveEntryError(Throwable ex, DataFetchingEnvironment env, int index) {
        GraphQLError error = resolveToSingleError(ex, env);
        GraphqlErrorBuilder<?> builder = GraphqlErrorBuilder.newError()
                .message(error.getMessage())
                .locations(error.getLocations())
                .errorType(error.getErrorType())
                .extensions(error.getExtensions());
        if (env.getExecutionStepInfo() != null) {
            builder.path(env.getExecutionStepInfo().getPath().segment(index));
        }
        return builder.build();
    }

    private GraphQLError handleAuthorization(AuthorizationException ex, DataFetchingEnvironment env) {
        if (ex.getReason() == AuthorizationException.Reason.UNAUTHENTICATED) {
            return build(env, ErrorType.UNAUTHORIZED, formatErrorMessage(ex), extensions("UNAUTHENTICATED"));
        }
        Map<String, Object> extensions = extensions("FORBIDDEN");
        if (ex.getPermission() != null) {
            extensions.put("permission", ex.getPermission().name());
        }
        return build(env, ErrorType.FORBIDDEN, formatErrorMessage(ex), extensions);
    }

    private GraphQLError build(DataFetchingEnvironment env, ErrorType type, String message,
                               Map<String, Object> extensions) {
        return GraphqlErrorBuilder.newError(env)
                .errorType(type)
                .message(message)
                .extensions(extensions)
                .build();
    }

    private static Map<String, Object> extensions(String errorCode) {
        Map<String, Object> extensions = new HashMap<>();
        extensions.put("errorCode", errorCode);
        return extensions;
    }

    private static Object path(DataFetchingEnvironment env) {
        return env.getExecutionStepInfo() != null ? env.getExecutionStepInfo().getPath() : "<unknown>";
    }

    private static Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Keeps the first line of a message and drops stack trace references.
     */
    private String formatErrorMessage(Throwable ex) {
        String message = ex.getMessage();
        if (message == null || message.isEmpty()) {
            return "An error occurred: " + ex.getClass().getSimpleName();
        }
        message = message.split("\n")[0];
        message = message.replaceAll("\\bat [\\w.$]+\\(.*", "");
        return message.trim();
    }
}

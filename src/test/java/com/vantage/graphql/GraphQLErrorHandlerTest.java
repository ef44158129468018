package com.vantage.graphql;

import com.vantage.error.NotFoundException;
import com.vantage.error.UpstreamFailureException;
import com.vantage.error.UpstreamTimeoutException;
import com.vantage.error.ValidationException;
import com.vantage.security.AuthorizationException;
import com.vantage.security.Permission;
import graphql.GraphQLError;
import graphql.Scalars;
import graphql.execution.ExecutionStepInfo;
import graphql.execution.ResultPath;
import graphql.language.Field;
import graphql.language.SourceLocation;
import graphql.schema.DataFetchingEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.graphql.execution.ErrorType;

import java.time.Duration;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("GraphQLErrorHandler")
class GraphQLErrorHandlerTest {

    private GraphQLErrorHandler errorHandler;
    private DataFetchingEnvironment env;

    @BeforeEach
    void setUp() {
        errorHandler = new GraphQLErrorHandler();
        env = mock(DataFetchingEnvironment.class);
        when(env.getField()).thenReturn(Field.newField("securityEvent")
                .sourceLocation(new SourceLocation(1, 3))
                .build());
        when(env.getExecutionStepInfo()).thenReturn(ExecutionStepInfo.newExecutionStepInfo()
                .type(Scalars.GraphQLString)
                .path(ResultPath.rootPath().segment("securityEvent"))
                .build());
    }

    @Test
    @DisplayName("should map validation failures to BAD_REQUEST with the offending field")
    void shouldHandleValidationException() {
        // When
        GraphQLError error = errorHandler.resolveToSingleError(
                new ValidationException("riskScore", "riskScore must be within [0, 100]"), env);

        // Then
        assertThat(error.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        assertThat(error.getMessage()).isEqualTo("riskScore must be within [0, 100]");
        assertThat(error.getExtensions())
                .containsEntry("errorCode", "VALIDATION_FAILED")
                .containsEntry("field", "riskScore");
        assertThat(error.getPath()).containsExactly("securityEvent");
    }

    @Test
    @DisplayName("should map a missing principal to UNAUTHORIZED")
    void shouldHandleUnauthenticated() {
        GraphQLError error = errorHandler.resolveToSingleError(AuthorizationException.unauthenticated(), env);

        assertThat(error.getErrorType()).isEqualTo(ErrorType.UNAUTHORIZED);
        assertThat(error.getExtensions()).containsEntry("errorCode", "UNAUTHENTICATED");
    }

    @Test
    @DisplayName("should map a missing permission to FORBIDDEN naming the permission")
    void shouldHandleForbidden() {
        GraphQLError error = errorHandler.resolveToSingleError(
                AuthorizationException.forbidden(Permission.ASSIGN_CASES), env);

        assertThat(error.getErrorType()).isEqualTo(ErrorType.FORBIDDEN);
        assertThat(error.getExtensions())
                .containsEntry("errorCode", "FORBIDDEN")
                .containsEntry("permission", "ASSIGN_CASES");
    }

    @Test
    @DisplayName("should map missing entities to NOT_FOUND")
    void shouldHandleNotFound() {
        GraphQLError error = errorHandler.resolveToSingleError(new NotFoundException("SecurityCase", "c-9"), env);

        assertThat(error.getErrorType()).isEqualTo(ErrorType.NOT_FOUND);
        assertThat(error.getMessage()).isEqualTo("SecurityCase c-9 not found");
        assertThat(error.getExtensions()).containsEntry("entityType", "SecurityCase");
    }

    @Test
    @DisplayName("should hide upstream failure details behind a generic message")
    void shouldHandleUpstreamFailure() {
        // Given
        UpstreamFailureException failure = new UpstreamFailureException("event-by-id",
                "jdbc:postgresql://db-internal:5432 refused connection", new IllegalStateException("down"));

        // When
        GraphQLError error = errorHandler.resolveToSingleError(new CompletionException(failure), env);

        // Then
        assertThat(error.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        assertThat(error.getMessage()).isEqualTo(GraphQLErrorHandler.UNAVAILABLE_MESSAGE);
        assertThat(error.getMessage()).doesNotContain("db-internal");
        assertThat(error.getExtensions()).containsEntry("errorCode", "UPSTREAM_UNAVAILABLE");
    }

    @Test
    @DisplayName("should report upstream timeouts with their own code")
    void shouldHandleUpstreamTimeout() {
        GraphQLError error = errorHandler.resolveToSingleError(
                new UpstreamTimeoutException("ioc-by-id", Duration.ofMillis(1000)), env);

        assertThat(error.getMessage()).isEqualTo(GraphQLErrorHandler.TIMEOUT_MESSAGE);
        assertThat(error.getExtensions()).containsEntry("errorCode", "UPSTREAM_TIMEOUT");
    }

    @Test
    @DisplayName("should map plain illegal arguments to INVALID_ARGUMENT")
    void shouldHandleIllegalArgumentException() {
        GraphQLError error = errorHandler.resolveToSingleError(new IllegalArgumentException("Unknown loader: x"), env);

        assertThat(error.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
        assertThat(error.getExtensions()).containsEntry("errorCode", "INVALID_ARGUMENT");
    }

    @Test
    @DisplayName("should not leak null pointer details")
    void shouldHandleNullPointerException() {
        GraphQLError error = errorHandler.resolveToSingleError(new NullPointerException("field x of y"), env);

        assertThat(error.getMessage()).isEqualTo("An unexpected null value was encountered");
        assertThat(error.getExtensions()).containsEntry("errorCode", "NULL_POINTER");
    }

    @Test
    @DisplayName("should fall back to INTERNAL_ERROR with the exception type")
    void shouldHandleUnexpectedException() {
        GraphQLError error = errorHandler.resolveToSingleError(new IllegalStateException("boom"), env);

        assertThat(error.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
        assertThat(error.getMessage()).isEqualTo("An internal error occurred while processing your request");
        assertThat(error.getExtensions())
                .containsEntry("errorCode", "INTERNAL_ERROR")
                .containsEntry("exceptionType", "IllegalStateException");
    }

    @Test
    @DisplayName("should keep only the first line of multi-line messages")
    void shouldTrimMultiLineMessages() {
        GraphQLError error = errorHandler.resolveToSingleError(
                new ValidationException("title is required\n\tat com.vantage.secops.Foo.bar(Foo.java:10)"), env);

        assertThat(error.getMessage()).isEqualTo("title is required");
    }

    @Test
    @DisplayName("should describe exceptions without a message by type")
    void shouldHandleEmptyMessage() {
        GraphQLError error = errorHandler.resolveToSingleError(new IllegalArgumentException(), env);

        assertThat(error.getMessage()).isEqualTo("An error occurred: IllegalArgumentException");
    }
}

package com.vantage.graphql;

import graphql.GraphQLError;
import graphql.execution.DataFetcherResult;
import graphql.schema.DataFetchingEnvironment;
import org.dataloader.Try;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns per-entry loader outcomes into a list field result that carries the
 * resolved entries as data and each failed entry as its own GraphQL error.
 */
@Component
public class ListEntryResults {

    private final GraphQLErrorHandler errorHandler;

    public ListEntryResults(GraphQLErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    /**
     * For lists with nullable elements: every position is kept, a failed entry
     * becomes null and its error path ends with the entry's index.
     */
    public <T> DataFetcherResult<List<T>> positional(List<Try<T>> entries, DataFetchingEnvironment env) {
        List<T> data = new ArrayList<>(entries.size());
        List<GraphQLError> errors = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Try<T> entry = entries.get(i);
            if (entry.isSuccess()) {
                data.add(entry.get());
            } else {
                data.add(null);
                errors.add(errorHandler.resolveEntryError(entry.getThrowable(), env, i));
            }
        }
        return DataFetcherResult.<List<T>>newResult().data(data).errors(errors).build();
    }

    /**
     * For lists with non-null elements: failed and absent entries are left
     * out, and each failure is reported against the list field.
     */
    public <T> DataFetcherResult<List<T>> resolvedOnly(List<Try<T>> entries, DataFetchingEnvironment env) {
        List<T> data = new ArrayList<>(entries.size());
        List<GraphQLError> errors = new ArrayList<>();
        for (Try<T> entry : entries) {
            if (entry.isFailure()) {
                errors.add(errorHandler.resolveToSingleError(entry.getThrowable(), env));
            } else if (entry.get() != null) {
                data.add(entry.get());
            }
        }
        return DataFetcherResult.<List<T>>newResult().data(data).errors(errors).build();
    }
}

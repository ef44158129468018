package com.vantage.graphql;

import com.vantage.domain.Item;
import com.vantage.domain.ItemValuation;
import com.vantage.domain.PortfolioSummary;
import com.vantage.domain.PriceAlert;
import com.vantage.domain.PriceAlertType;
import com.vantage.domain.PriceChangeInput;
import com.vantage.domain.PriceRecord;
import com.vantage.domain.ValuationInput;
import com.vantage.domain.ValuationUpdate;
import com.vantage.domain.ValuationUpdateInput;
import com.vantage.loader.LoaderScope;
import com.vantage.security.RequestPrincipal;
import com.vantage.valuation.ValuationService;
import graphql.execution.DataFetcherResult;
import graphql.schema.DataFetchingEnvironment;
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

@Controller
public class ValuationController {

    private final ValuationService service;
    private final ListEntryResults listEntryResults;

    public ValuationController(ValuationService service, ListEntryResults listEntryResults) {
        this.service = service;
        this.listEntryResults = listEntryResults;
    }

    @QueryMapping
    public CompletableFuture<Item> item(@Argument String id,
                                        @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                        @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getItem(principal, scope, id);
    }

    @QueryMapping
    public CompletableFuture<DataFetcherResult<List<Item>>> items(@Argument List<String> ids,
                                                                  @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                                  @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal,
                                                                  DataFetchingEnvironment env) {
        return service.getItems(principal, scope, ids)
                .thenApply(entries -> listEntryResults.positional(entries, env));
    }

    @QueryMapping
    public PortfolioSummary portfolioSummary(
            @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getPortfolioSummary(principal);
    }

    @SchemaMapping(typeName = "Item", field = "valuations")
    public CompletableFuture<List<ItemValuation>> valuations(Item item,
                                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getValuations(principal, scope, item);
    }

    @SchemaMapping(typeName = "Item", field = "currentValuation")
    public CompletableFuture<ItemValuation> currentValuation(Item item,
                                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getCurrentValuation(principal, scope, item);
    }

    @SchemaMapping(typeName = "Item", field = "priceHistory")
    public CompletableFuture<List<PriceRecord>> priceHistory(Item item,
                                                             @Argument Integer limit,
                                                             @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                                             @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.getPriceHistory(principal, scope, item, limit);
    }

    @MutationMapping
    public ItemValuation createValuation(@Argument ValuationInput input,
                                         @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                         @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.createValuation(principal, scope, input);
    }

    @MutationMapping
    public ItemValuation updateValuation(@Argument String id,
                                         @Argument ValuationUpdateInput input,
                                         @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                         @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.updateValuation(principal, scope, id, input);
    }

    @MutationMapping
    public PriceRecord recordPriceChange(@Argument PriceChangeInput input,
                                         @ContextValue(name = LoaderScope.CONTEXT_KEY) LoaderScope scope,
                                         @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.recordPriceChange(principal, scope, input);
    }

    @SubscriptionMapping
    public Flux<ValuationUpdate> valuationUpdated(@Argument List<String> itemIds,
                                                  @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribeValuationUpdates(principal, itemIds).messages();
    }

    @SubscriptionMapping
    public Flux<PriceAlert> priceAlert(@Argument List<String> itemIds,
                                       @Argument List<PriceAlertType> alertTypes,
                                       @Argument Double minChangePercent,
                                       @ContextValue(name = RequestPrincipal.CONTEXT_KEY, required = false) RequestPrincipal principal) {
        return service.subscribePriceAlerts(principal, itemIds, alertTypes, minChangePercent).messages();
    }
}

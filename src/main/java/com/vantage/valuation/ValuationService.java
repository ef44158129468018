package com.vantage.valuation;

import com.vantage.domain.Item;
import com.vantage.domain.ItemValuation;
import com.vantage.domain.PortfolioSummary;
import com.vantage.domain.PriceAlert;
import com.vantage.domain.PriceAlertType;
import com.vantage.domain.PriceChangeInput;
import com.vantage.domain.PriceRecord;
import com.vantage.domain.ValuationInput;
import com.vantage.domain.ValuationMethod;
import com.vantage.domain.ValuationUpdate;
import com.vantage.domain.ValuationUpdateInput;
import com.vantage.error.NotFoundException;
import com.vantage.error.ValidationException;
import com.vantage.fanout.EventSubscription;
import com.vantage.fanout.FanoutEngine;
import com.vantage.fanout.SubscriberContext;
import com.vantage.fanout.SubscriptionFilter;
import com.vantage.loader.LoaderScope;
import com.vantage.security.AccessGate;
import com.vantage.security.Permission;
import com.vantage.security.RequestPrincipal;
import com.vantage.storage.PriceHistoryRepository;
import com.vantage.storage.ValuationRepository;
import org.dataloader.Try;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Item valuation reads, writes and live updates.
 *
 * Writes store first, then invalidate every cache the change affects on the
 * request bus (which forwards to the process bus), then publish.
 */
@Service
public class ValuationService {

    private static final Logger logger = LoggerFactory.getLogger(ValuationService.class);

    static final double PRICE_ALERT_THRESHOLD_PERCENT = 10.0;
    static final String DEFAULT_CURRENCY = "USD";
    static final String DEFAULT_PRICE_TYPE = "market";

    private final AccessGate accessGate;
    private final ValuationRepository valuationRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final PortfolioSummaryCache summaryCache;
    private final FanoutEngine fanoutEngine;
    private final Clock clock;

    public ValuationService(AccessGate accessGate,
                            ValuationRepository valuationRepository,
                            PriceHistoryRepository priceHistoryRepository,
                            PortfolioSummaryCache summaryCache,
                            FanoutEngine fanoutEngine,
                            Clock clock) {
        this.accessGate = accessGate;
        this.valuationRepository = valuationRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.summaryCache = summaryCache;
        this.fanoutEngine = fanoutEngine;
        this.clock = clock;
    }

    public CompletableFuture<Item> getItem(RequestPrincipal principal, LoaderScope scope, String id) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        return ValuationLoaders.itemById(scope).load(id);
    }

    /**
     * @return one entry per id in request order; an item that failed to load
     * does not fail the others
     */
    public CompletableFuture<List<Try<Item>>> getItems(RequestPrincipal principal, LoaderScope scope, List<String> ids) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        if (ids == null || ids.size() > 1000) {
            throw new ValidationException("ids", "Between 0 and 1000 item ids may be requested at once");
        }
        return ValuationLoaders.itemById(scope).loadManyTry(ids);
    }

    public CompletableFuture<List<ItemValuation>> getValuations(RequestPrincipal principal, LoaderScope scope, Item item) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        return ValuationLoaders.valuationsByItemId(scope).load(item.getId());
    }

    public CompletableFuture<ItemValuation> getCurrentValuation(RequestPrincipal principal, LoaderScope scope, Item item) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        return ValuationLoaders.currentValuationByItemId(scope).load(item.getId());
    }

    /**
     * Price history of an item, newest first, optionally cut to {@code limit} entries.
     */
    public CompletableFuture<List<PriceRecord>> getPriceHistory(RequestPrincipal principal, LoaderScope scope,
                                                                Item item, Integer limit) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        if (limit != null && limit < 0) {
            throw new ValidationException("limit", "limit must not be negative, got " + limit);
        }
        return ValuationLoaders.priceHistoryByItemId(scope).load(item.getId())
                .thenApply(history -> limit == null || history.size() <= limit ? history : history.subList(0, limit));
    }

    public PortfolioSummary getPortfolioSummary(RequestPrincipal principal) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        return summaryCache.get(valuationRepository::summarizeCurrentValues);
    }

    public ItemValuation createValuation(RequestPrincipal principal, LoaderScope scope, ValuationInput input) {
        accessGate.check(principal, Permission.WRITE_VALUATIONS);
        if (input.getItemId() == null || input.getItemId().isBlank()) {
            throw new ValidationException("itemId", "itemId must not be empty");
        }
        requireValue(input.getValue());
        requireConfidence(input.getConfidence());

        ItemValuation previous = loadNow(ValuationLoaders.currentValuationByItemId(scope).load(input.getItemId()), scope);

        ItemValuation valuation = new ItemValuation();
        valuation.setId(UUID.randomUUID().toString());
        valuation.setItemId(input.getItemId());
        valuation.setValue(input.getValue());
        valuation.setCurrency(input.getCurrency() != null ? input.getCurrency() : DEFAULT_CURRENCY);
        valuation.setMethod(input.getMethod() != null ? input.getMethod() : ValuationMethod.MANUAL);
        valuation.setConfidence(input.getConfidence());
        valuation.setNotes(input.getNotes());
        valuation.setValuedBy(principal.getUserId());
        valuation.setValuedAt(OffsetDateTime.now(clock));

        valuationRepository.insert(valuation);
        invalidateItemValuations(scope, valuation.getItemId());
        publishUpdate(valuation, previous != null ? previous.getValue() : null, "New valuation", principal);
        return valuation;
    }

    public ItemValuation updateValuation(RequestPrincipal principal, LoaderScope scope, String id,
                                         ValuationUpdateInput input) {
        accessGate.check(principal, Permission.WRITE_VALUATIONS);
        if (id == null || id.isBlank()) {
            throw new ValidationException("id", "id must not be empty");
        }
        if (input.getValue() != null) {
            requireValue(input.getValue());
        }
        requireConfidence(input.getConfidence());
        ItemValuation valuation = valuationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("ItemValuation", id));

        double previousValue = valuation.getValue();
        if (input.getValue() != null) {
            valuation.setValue(input.getValue());
        }
        if (input.getConfidence() != null) {
            valuation.setConfidence(input.getConfidence());
        }
        if (input.getMethod() != null) {
            valuation.setMethod(input.getMethod());
        }
        if (input.getNotes() != null) {
            valuation.setNotes(input.getNotes());
        }
        valuation.setValuedBy(principal.getUserId());
        valuation.setValuedAt(OffsetDateTime.now(clock));

        valuationRepository.update(valuation);
        scope.invalidation().invalidate(ValuationLoaders.VALUATION_BY_ID, id);
        invalidateItemValuations(scope, valuation.getItemId());
        publishUpdate(valuation, previousValue, "Manual update", principal);
        return valuation;
    }

    /**
     * Stores a price observation and raises a price alert when it moved at
     * least {@value #PRICE_ALERT_THRESHOLD_PERCENT} percent from the previous
     * observation of the same price type.
     */
    public PriceRecord recordPriceChange(RequestPrincipal principal, LoaderScope scope, PriceChangeInput input) {
        accessGate.check(principal, Permission.RECORD_PRICES);
        if (input.getItemId() == null || input.getItemId().isBlank()) {
            throw new ValidationException("itemId", "itemId must not be empty");
        }
        if (input.getPrice() == null || input.getPrice().isNaN() || input.getPrice() <= 0) {
            throw new ValidationException("price", "price must be positive, got " + input.getPrice());
        }
        String priceType = input.getPriceType() != null ? input.getPriceType() : DEFAULT_PRICE_TYPE;
        Optional<PriceRecord> latest = priceHistoryRepository.findLatest(input.getItemId(), priceType);

        PriceRecord record = new PriceRecord();
        record.setId(UUID.randomUUID().toString());
        record.setItemId(input.getItemId());
        record.setPrice(input.getPrice());
        record.setPriceType(priceType);
        record.setSource(input.getSource());
        record.setRecordedAt(OffsetDateTime.now(clock));

        priceHistoryRepository.insert(record);
        scope.invalidation().invalidate(ValuationLoaders.PRICE_HISTORY_BY_ITEM_ID, record.getItemId());

        latest.filter(previous -> previous.getPrice() > 0)
                .ifPresent(previous -> alertIfSignificant(previous, record));
        return record;
    }

    public EventSubscription<ValuationUpdate> subscribeValuationUpdates(RequestPrincipal principal, List<String> itemIds) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        SubscriptionFilter<ValuationUpdate> filter = itemIds == null || itemIds.isEmpty()
                ? SubscriptionFilter.acceptAll()
                : itemFilter(Set.copyOf(itemIds));
        return fanoutEngine.subscribe(ValuationChannels.VALUATION_UPDATED, contextOf(principal), filter);
    }

    public EventSubscription<PriceAlert> subscribePriceAlerts(RequestPrincipal principal, List<String> itemIds,
                                                              List<PriceAlertType> alertTypes, Double minChangePercent) {
        accessGate.check(principal, Permission.READ_VALUATIONS);
        Set<String> items = itemIds == null || itemIds.isEmpty() ? null : Set.copyOf(itemIds);
        Set<PriceAlertType> types = alertTypes == null || alertTypes.isEmpty() ? null : Set.copyOf(alertTypes);
        SubscriptionFilter<PriceAlert> filter = (alert, context) ->
                (items == null || items.contains(alert.getItemId()))
                        && (types == null || types.contains(alert.getAlertType()))
                        && (minChangePercent == null || Math.abs(alert.getChangePercent()) >= minChangePercent);
        return fanoutEngine.subscribe(ValuationChannels.PRICE_ALERTS, contextOf(principal), filter);
    }

    private void alertIfSignificant(PriceRecord previous, PriceRecord current) {
        double changePercent = (current.getPrice() - previous.getPrice()) / previous.getPrice() * 100.0;
        if (Math.abs(changePercent) < PRICE_ALERT_THRESHOLD_PERCENT) {
            return;
        }
        PriceAlert alert = new PriceAlert();
        alert.setItemId(current.getItemId());
        alert.setAlertType(changePercent > 0 ? PriceAlertType.PRICE_SPIKE : PriceAlertType.PRICE_DROP);
        alert.setPreviousPrice(previous.getPrice());
        alert.setCurrentPrice(current.getPrice());
        alert.setChangePercent(changePercent);
        alert.setMessage(String.format(Locale.ROOT, "Price %s by %.1f%%",
                changePercent > 0 ? "increased" : "decreased", Math.abs(changePercent)));
        alert.setTriggeredAt(current.getRecordedAt());
        int delivered = fanoutEngine.publish(ValuationChannels.PRICE_ALERTS, alert);
        logger.info("{} for item {} ({}), delivered to {} subscribers",
                alert.getAlertType(), alert.getItemId(), alert.getMessage(), delivered);
    }

    private void invalidateItemValuations(LoaderScope scope, String itemId) {
        scope.invalidation().invalidate(ValuationLoaders.VALUATIONS_BY_ITEM_ID, itemId);
        scope.invalidation().invalidate(ValuationLoaders.CURRENT_VALUATION_BY_ITEM_ID, itemId);
        scope.invalidation().invalidateAll(PortfolioSummaryCache.CACHE_NAME);
    }

    private void publishUpdate(ItemValuation valuation, Double previousValue, String reason, RequestPrincipal principal) {
        ValuationUpdate update = new ValuationUpdate();
        update.setItemId(valuation.getItemId());
        update.setValuation(valuation);
        update.setPreviousValue(previousValue);
        update.setNewValue(valuation.getValue());
        update.setChangeReason(reason);
        update.setUpdatedBy(principal.getUserId());
        update.setUpdatedAt(valuation.getValuedAt());
        fanoutEngine.publish(ValuationChannels.VALUATION_UPDATED, update);
        logger.info("Valuation {} of item {} now {} {} ({})", valuation.getId(), valuation.getItemId(),
                valuation.getValue(), valuation.getCurrency(), reason);
    }

    private static <T> T loadNow(CompletableFuture<T> future, LoaderScope scope) {
        scope.dispatch();
        return future.join();
    }

    private static SubscriptionFilter<ValuationUpdate> itemFilter(Set<String> itemIds) {
        return (update, context) -> itemIds.contains(update.getItemId());
    }

    private static SubscriberContext contextOf(RequestPrincipal principal) {
        return new SubscriberContext(principal.getUserId(), principal.getTenantId());
    }

    private static void requireValue(Double value) {
        if (value == null || value.isNaN() || value <= 0) {
            throw new ValidationException("value", "Valuation value must be positive, got " + value);
        }
    }

    private static void requireConfidence(Double confidence) {
        if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
            throw new ValidationException("confidence", "confidence must be within [0, 1], got " + confidence);
        }
    }
}

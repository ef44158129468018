package com.vantage.valuation;

import com.vantage.domain.Item;
import com.vantage.domain.ItemValuation;
import com.vantage.domain.PriceRecord;
import com.vantage.loader.BatchFetchers;
import com.vantage.loader.LoaderDefinition;
import com.vantage.loader.LoaderScope;
import com.vantage.loader.RequestLoader;
import com.vantage.storage.ItemRepository;
import com.vantage.storage.PriceHistoryRepository;
import com.vantage.storage.ValuationRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Batch loaders for the item valuation dashboard.
 */
@Configuration
public class ValuationLoaders {

    public static final String ITEM_BY_ID = "item-by-id";
    public static final String VALUATION_BY_ID = "valuation-by-id";
    public static final String VALUATIONS_BY_ITEM_ID = "valuations-by-item-id";
    public static final String CURRENT_VALUATION_BY_ITEM_ID = "current-valuation-by-item-id";
    public static final String PRICE_HISTORY_BY_ITEM_ID = "price-history-by-item-id";

    @Bean
    public LoaderDefinition<String, Item> itemByIdLoader(ItemRepository repository) {
        return LoaderDefinition.<String, Item>single(ITEM_BY_ID, BatchFetchers.indexedBy(repository::findByIds, Item::getId))
                .withMaxBatchSize(100);
    }

    @Bean
    public LoaderDefinition<String, ItemValuation> valuationByIdLoader(ValuationRepository repository) {
        return LoaderDefinition.<String, ItemValuation>single(VALUATION_BY_ID,
                        BatchFetchers.indexedBy(repository::findByIds, ItemValuation::getId))
                .withMaxBatchSize(100);
    }

    @Bean
    public LoaderDefinition<String, List<ItemValuation>> valuationsByItemIdLoader(ValuationRepository repository) {
        return LoaderDefinition.<String, ItemValuation>grouped(VALUATIONS_BY_ITEM_ID,
                        BatchFetchers.groupedBy(repository::findByItemIds, ItemValuation::getItemId))
                .withMaxBatchSize(50);
    }

    // rows come back newest first per item, and indexedBy keeps the first row
    @Bean
    public LoaderDefinition<String, ItemValuation> currentValuationByItemIdLoader(ValuationRepository repository) {
        return LoaderDefinition.<String, ItemValuation>single(CURRENT_VALUATION_BY_ITEM_ID,
                        BatchFetchers.indexedBy(repository::findCurrentByItemIds, ItemValuation::getItemId))
                .withMaxBatchSize(100);
    }

    @Bean
    public LoaderDefinition<String, List<PriceRecord>> priceHistoryByItemIdLoader(PriceHistoryRepository repository) {
        return LoaderDefinition.<String, PriceRecord>grouped(PRICE_HISTORY_BY_ITEM_ID,
                        BatchFetchers.groupedBy(repository::findByItemIds, PriceRecord::getItemId))
                .withMaxBatchSize(50);
    }

    public static RequestLoader<String, Item> itemById(LoaderScope scope) {
        return scope.loader(ITEM_BY_ID);
    }

    public static RequestLoader<String, ItemValuation> valuationById(LoaderScope scope) {
        return scope.loader(VALUATION_BY_ID);
    }

    public static RequestLoader<String, List<ItemValuation>> valuationsByItemId(LoaderScope scope) {
        return scope.loader(VALUATIONS_BY_ITEM_ID);
    }

    public static RequestLoader<String, ItemValuation> currentValuationByItemId(LoaderScope scope) {
        return scope.loader(CURRENT_VALUATION_BY_ITEM_ID);
    }

    public static RequestLoader<String, List<PriceRecord>> priceHistoryByItemId(LoaderScope scope) {
        return scope.loader(PRICE_HISTORY_BY_ITEM_ID);
    }
}

package com.vantage.valuation;

import com.vantage.domain.PriceAlert;
import com.vantage.domain.ValuationUpdate;
import com.vantage.fanout.EventChannel;

public final class ValuationChannels {

    public static final EventChannel<ValuationUpdate> VALUATION_UPDATED =
            EventChannel.of("valuation-updated", ValuationUpdate.class);
    public static final EventChannel<PriceAlert> PRICE_ALERTS =
            EventChannel.of("price-alerts", PriceAlert.class);

    private ValuationChannels() {
    }
}

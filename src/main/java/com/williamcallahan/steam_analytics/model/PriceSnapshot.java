package com.williamcallahan.steam_analytics.model;

import java.math.BigDecimal;

/**
 * The price state attached to every fact row of a game within one run.
 */
public record PriceSnapshot(BigDecimal currentPrice, BigDecimal originalPrice, Integer discountPercent, Boolean discountActive) {

    public static final PriceSnapshot EMPTY = new PriceSnapshot(null, null, null, null);

    public static PriceSnapshot from(PricingRecord pricing) {
        return new PriceSnapshot(pricing.currentPrice(), pricing.originalPrice(), pricing.discountPercent(),
            pricing.discountPercent() == null ? null : pricing.discountActive());
    }

    public static PriceSnapshot from(MetadataRecord metadata) {
        if (!metadata.hasPriceData() && metadata.discountPercent() == null) {
            return EMPTY;
        }
        Integer discount = metadata.discountPercent();
        return new PriceSnapshot(metadata.currentPrice(), metadata.originalPrice(), discount,
            discount == null ? null : discount > 0);
    }
}

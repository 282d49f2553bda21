package com.alphaguard.pool;

import java.util.Optional;

/**
 * The structural filters, declared in the order they are applied:
 * ownership, dividend yield, volume floor, sector exclusion, market-cap
 * floor, minimum price, maximum price.
 *
 * <p>A symbol is checked against every configured filter and the first one it
 * fails is recorded as the reason, spelled
 * {@code structural_filter:<name> (<detail>)}.
 */
public enum StructuralFilter {
    EXCLUDE_STATE_OWNED_RATIO_GTE("exclude_state_owned_ratio_gte") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            Double threshold = filters.getExcludeStateOwnedRatioGte();
            if (threshold == null) {
                return null;
            }
            Double ratio = entry.getStateOwnedRatio();
            if (ratio == null) {
                return "state_owned_ratio missing";
            }
            return ratio >= threshold ? "ratio " + ratio + " >= " + threshold : null;
        }
    },
    EXCLUDE_DIVIDEND_YIELD_GTE("exclude_dividend_yield_gte") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            Double threshold = filters.getExcludeDividendYieldGte();
            if (threshold == null) {
                return null;
            }
            Double yield = entry.getDividendYield();
            if (yield == null) {
                return "dividend_yield missing";
            }
            return yield >= threshold ? "yield " + yield + " >= " + threshold : null;
        }
    },
    MIN_AVG_DOLLAR_VOLUME("min_avg_dollar_volume") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            return below("volume", entry.getAvgDollarVolume(), filters.getMinAvgDollarVolume());
        }
    },
    EXCLUDE_SECTORS("exclude_sectors") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            if (entry.getSector() == null || !filters.getExcludeSectors().contains(entry.getSector())) {
                return null;
            }
            return "sector '" + entry.getSector() + "' in exclusion list";
        }
    },
    MIN_MARKET_CAP("min_market_cap") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            return below("market_cap", entry.getMarketCap(), filters.getMinMarketCap());
        }
    },
    MIN_PRICE("min_price") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            return below("price", entry.getPrice(), filters.getMinPrice());
        }
    },
    MAX_PRICE("max_price") {
        @Override
        String check(UniverseEntry entry, StructuralFilters filters) {
            Double ceiling = filters.getMaxPrice();
            if (ceiling == null) {
                return null;
            }
            Double price = entry.getPrice();
            if (price == null) {
                return "price missing";
            }
            return price > ceiling ? "price " + price + " > " + ceiling : null;
        }
    };

    public static final String REASON_PREFIX = "structural_filter:";

    private final String filterName;

    StructuralFilter(String filterName) {
        this.filterName = filterName;
    }

    public String getFilterName() {
        return filterName;
    }

    /** Detail of the failure, or null when the entry passes or the filter is not configured. */
    abstract String check(UniverseEntry entry, StructuralFilters filters);

    /** Reason for the first filter the entry fails, in declaration order. */
    public static Optional<Rejection> firstFailure(UniverseEntry entry, StructuralFilters filters) {
        for (StructuralFilter filter : values()) {
            String detail = filter.check(entry, filters);
            if (detail != null) {
                return Optional.of(new Rejection(filter, REASON_PREFIX + filter.filterName + " (" + detail + ")"));
            }
        }
        return Optional.empty();
    }

    private static String below(String label, Double value, Double floor) {
        if (floor == null) {
            return null;
        }
        if (value == null) {
            return label + " missing";
        }
        return value < floor ? label + " " + value + " < " + floor : null;
    }

    public record Rejection(StructuralFilter filter, String reason) {}
}

package com.alphaguard.pool;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Hypothesis-independent hard filters on the base universe. A null threshold
 * disables its filter. See {@link StructuralFilter} for the order they run in.
 */
@Value
@Builder
@Jacksonized
public class StructuralFilters {

    public static final StructuralFilters NONE = StructuralFilters.builder().build();

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double excludeStateOwnedRatioGte;

    @PositiveOrZero
    Double excludeDividendYieldGte;

    @PositiveOrZero
    Double minAvgDollarVolume;

    @NotNull
    @Builder.Default
    List<String> excludeSectors = List.of();

    @PositiveOrZero
    Double minMarketCap;

    @PositiveOrZero
    Double minPrice;

    @PositiveOrZero
    Double maxPrice;
}

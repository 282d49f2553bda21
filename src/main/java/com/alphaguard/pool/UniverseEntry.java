package com.alphaguard.pool;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One symbol of the base universe with the reference data structural filters
 * look at. Volume, market cap and price may be missing; a filter that needs a
 * missing value excludes the symbol.
 */
@Value
@Builder
@Jacksonized
public class UniverseEntry {

    @NotBlank
    String symbol;

    String sector;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    @Builder.Default
    Double stateOwnedRatio = 0.0;

    @PositiveOrZero
    @Builder.Default
    Double dividendYield = 0.0;

    @PositiveOrZero
    Double avgDollarVolume;

    @PositiveOrZero
    Double marketCap;

    @PositiveOrZero
    Double price;
}

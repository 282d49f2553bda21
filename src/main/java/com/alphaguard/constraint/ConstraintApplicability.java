package com.alphaguard.constraint;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Symbols and strategies a constraint applies to. An empty list means all. */
@Value
@Builder
@Jacksonized
public class ConstraintApplicability {

    public static final ConstraintApplicability ALL = ConstraintApplicability.builder().build();

    @Builder.Default
    List<String> symbols = List.of();

    @Builder.Default
    List<String> strategies = List.of();

    public boolean coversSymbol(String symbol) {
        return symbols.isEmpty() || symbols.contains(symbol);
    }

    public boolean coversStrategy(String strategyId) {
        return strategies.isEmpty() || strategyId == null || strategies.contains(strategyId);
    }
}

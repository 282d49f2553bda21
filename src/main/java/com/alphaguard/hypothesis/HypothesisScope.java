package com.alphaguard.hypothesis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Symbols and sectors a hypothesis talks about. Both empty means the whole market.
 */
@Value
@Builder
@Jacksonized
public class HypothesisScope {

    public static final HypothesisScope ALL = HypothesisScope.builder().build();

    @Builder.Default
    List<String> symbols = List.of();

    @Builder.Default
    List<String> sectors = List.of();

    @JsonIgnore
    public boolean isUnrestricted() {
        return symbols.isEmpty() && sectors.isEmpty();
    }

    /** True if the scope is unrestricted, names the symbol, or names its sector. */
    public boolean covers(String symbol, String sector) {
        if (isUnrestricted()) {
            return true;
        }
        return symbols.contains(symbol) || (sector != null && sectors.contains(sector));
    }
}

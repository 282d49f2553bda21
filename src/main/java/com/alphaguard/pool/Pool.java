package com.alphaguard.pool;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * A built, versioned trading pool.
 *
 * <p>{@code symbols} is sorted and free of duplicates. {@code contentHash}
 * depends only on the build inputs, so equal inputs give an equal hash whenever
 * they are built; {@code version} prefixes it with the UTC build date.
 * Never empty: the builder throws instead of producing an empty pool.
 */
@Value
@Builder
public class Pool {

    List<String> symbols;

    /** Priority weights for prioritized symbols only. */
    Map<String, Double> weights;

    String version;

    String contentHash;

    Instant builtAt;

    List<PoolAuditEntry> auditTrail;

    public int size() {
        return symbols.size();
    }

    public boolean contains(String symbol) {
        return symbols.contains(symbol);
    }

    public double weightOf(String symbol) {
        return weights.getOrDefault(symbol, 1.0);
    }
}

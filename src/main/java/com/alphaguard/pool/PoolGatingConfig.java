package com.alphaguard.pool;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Which hypotheses gate the pool and how.
 *
 * <ul>
 *   <li>denylist: symbols in the hypothesis scope are excluded</li>
 *   <li>allowlist: the pool is restricted to scope symbols and sectors</li>
 *   <li>bias: symbols in scope sectors are prioritized with a weight</li>
 * </ul>
 * Only ACTIVE hypotheses take effect.
 */
@Value
@Builder
@Jacksonized
public class PoolGatingConfig {

    public static final PoolGatingConfig NONE = PoolGatingConfig.builder().build();

    @NotNull
    @Builder.Default
    List<String> denylistHypotheses = List.of();

    @NotNull
    @Builder.Default
    List<String> allowlistHypotheses = List.of();

    @NotNull
    @Builder.Default
    List<String> biasHypotheses = List.of();

    /** Weight for biased symbols when no linked constraint sets a pool_bias_multiplier. */
    @NotNull
    @Positive
    @Builder.Default
    Double biasMultiplier = 1.0;
}

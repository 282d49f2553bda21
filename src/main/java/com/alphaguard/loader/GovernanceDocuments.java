package com.alphaguard.loader;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.factor.Factor;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.pool.PoolGatingConfig;
import com.alphaguard.pool.StructuralFilters;
import com.alphaguard.pool.UniverseEntry;
import com.alphaguard.regime.RegimeConfig;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything read from one pass over the config directory, fully validated.
 * Nothing is published until a whole set has been read without error.
 */
@Value
@Builder
public class GovernanceDocuments {

    @Builder.Default
    List<Hypothesis> hypotheses = List.of();

    @Builder.Default
    List<Constraint> constraints = List.of();

    @Builder.Default
    List<Factor> factors = List.of();

    /** Null when the config directory has no pool/universe.yml. */
    List<UniverseEntry> universe;

    @Builder.Default
    StructuralFilters filters = StructuralFilters.NONE;

    @Builder.Default
    PoolGatingConfig gating = PoolGatingConfig.NONE;

    /** Null when the config directory has no regime/thresholds.yml. */
    RegimeConfig regime;
}

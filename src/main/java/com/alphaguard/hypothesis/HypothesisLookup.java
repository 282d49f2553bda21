package com.alphaguard.hypothesis;

import java.util.Optional;

/**
 * Read access to hypotheses by identifier. Implemented by the registry and by
 * its snapshots so activation checks can run against one consistent view.
 */
public interface HypothesisLookup {

    Optional<Hypothesis> find(String hypothesisId);
}

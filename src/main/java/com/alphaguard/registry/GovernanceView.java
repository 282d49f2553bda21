package com.alphaguard.registry;

import com.alphaguard.constraint.Constraint;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import lombok.Value;

/** Hypothesis and constraint snapshots captured together. */
@Value
public class GovernanceView {

    RegistrySnapshot<Hypothesis> hypotheses;
    RegistrySnapshot<Constraint> constraints;

    public HypothesisLookup hypothesisLookup() {
        return hypotheses::find;
    }

    public long hypothesisVersion() {
        return hypotheses.getVersion();
    }

    public long constraintVersion() {
        return constraints.getVersion();
    }
}

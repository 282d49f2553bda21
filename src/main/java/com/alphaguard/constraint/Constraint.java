package com.alphaguard.constraint;

import com.alphaguard.domain.enums.HypothesisStatus;
import com.alphaguard.hypothesis.Hypothesis;
import com.alphaguard.hypothesis.HypothesisLookup;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A risk/timing rule backed by one or more hypotheses.
 *
 * <p>Lower {@code priority} wins where action fields conflict. Guardrails are
 * ceilings that no action can exceed. Activation is never stored on the
 * constraint: {@link #isActive(HypothesisLookup)} recomputes it from current
 * hypothesis status every time.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Constraint {

    private static final Logger log = LoggerFactory.getLogger(Constraint.class);

    public static final int DEFAULT_PRIORITY = 100;

    @NotBlank
    @Pattern(regexp = Hypothesis.ID_PATTERN, message = "must match " + Hypothesis.ID_PATTERN)
    String id;

    @NotBlank
    String title;

    @NotNull
    @Builder.Default
    ConstraintApplicability appliesTo = ConstraintApplicability.ALL;

    @NotNull
    @Valid
    @Builder.Default
    ActivationRule activation = ActivationRule.ALWAYS;

    @NotNull
    @Valid
    @Builder.Default
    ConstraintActions actions = ConstraintActions.NONE;

    @NotNull
    @Valid
    @Builder.Default
    ConstraintGuardrails guardrails = ConstraintGuardrails.NONE;

    @NotNull
    @Min(1)
    @Builder.Default
    Integer priority = DEFAULT_PRIORITY;

    /**
     * True iff every hypothesis in the activation rule is currently ACTIVE.
     * A rule naming an unknown hypothesis fails closed.
     */
    public boolean isActive(HypothesisLookup hypotheses) {
        for (String hypothesisId : activation.getRequiresHypothesesActive()) {
            Optional<Hypothesis> hypothesis = hypotheses.find(hypothesisId);
            if (hypothesis.isEmpty()) {
                log.warn("Constraint {} requires unknown hypothesis {}; treating as inactive", id, hypothesisId);
                return false;
            }
            if (hypothesis.get().getStatus() != HypothesisStatus.ACTIVE) {
                return false;
            }
        }
        return true;
    }

    public boolean dependsOn(String hypothesisId) {
        return activation.getRequiresHypothesesActive().contains(hypothesisId);
    }
}

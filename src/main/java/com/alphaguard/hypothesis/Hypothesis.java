package com.alphaguard.hypothesis;

import com.alphaguard.domain.enums.HypothesisStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A human-authored market belief with the rules that would falsify it.
 *
 * <p>Immutable. Status changes produce a new instance via {@code toBuilder()}
 * and are published by {@link HypothesisRegistry}; nothing else writes
 * hypotheses.
 *
 * <p>The statement and evidence are opaque text. The engine only ever reads the
 * identifier, scope, status, falsifiers and linked constraint ids.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Hypothesis {

    public static final String ID_PATTERN = "^[a-z0-9_]+$";

    @NotBlank
    @Pattern(regexp = ID_PATTERN, message = "must match " + ID_PATTERN)
    String id;

    @NotBlank
    String title;

    @NotBlank
    String statement;

    @NotNull
    @Valid
    @Builder.Default
    HypothesisScope scope = HypothesisScope.ALL;

    @NotBlank
    @Builder.Default
    String owner = "human";

    @NotNull
    @Builder.Default
    HypothesisStatus status = HypothesisStatus.DRAFT;

    @NotBlank
    @Pattern(regexp = Falsifier.WINDOW_PATTERN, message = "must be a count followed by d, w, m, q or y")
    @Builder.Default
    String reviewCycle = "30d";

    @NotNull
    LocalDate createdAt;

    @NotNull
    @Builder.Default
    Evidence evidence = Evidence.NONE;

    @NotNull
    @Valid
    @Builder.Default
    List<Falsifier> falsifiers = List.of();

    @NotNull
    @Builder.Default
    List<String> linkedConstraints = List.of();

    @JsonIgnore
    public boolean isActive() {
        return status == HypothesisStatus.ACTIVE;
    }

    public Hypothesis withStatus(HypothesisStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }
}

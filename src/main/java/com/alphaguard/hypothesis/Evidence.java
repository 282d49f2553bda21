package com.alphaguard.hypothesis;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Supporting material for a hypothesis. Opaque to the engine: stored and
 * displayed, never parsed or used in any decision.
 */
@Value
@Builder
@Jacksonized
public class Evidence {

    public static final Evidence NONE = Evidence.builder().build();

    @Builder.Default
    List<String> sources = List.of();

    String notes;
}

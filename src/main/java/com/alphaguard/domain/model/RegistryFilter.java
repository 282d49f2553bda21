package com.alphaguard.domain.model;

import com.alphaguard.domain.enums.HypothesisStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for listing registry entries. A null field matches everything.
 */
@Value
@Builder
public class RegistryFilter {

    public static final RegistryFilter ALL = RegistryFilter.builder().build();

    HypothesisStatus status;

    String symbol;

    /** Only meaningful for constraints. */
    String strategy;

    public static RegistryFilter byStatus(HypothesisStatus status) {
        return RegistryFilter.builder().status(status).build();
    }

    public static RegistryFilter bySymbol(String symbol) {
        return RegistryFilter.builder().symbol(symbol).build();
    }
}

package com.alphaguard.pool;

import java.util.List;
import lombok.Value;

/** The three documents a pool is built from. */
@Value
public class PoolInputs {

    List<UniverseEntry> universe;

    StructuralFilters filters;

    PoolGatingConfig gating;
}

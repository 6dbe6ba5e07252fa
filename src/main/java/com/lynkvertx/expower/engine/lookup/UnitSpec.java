package com.lynkvertx.expower.engine.lookup;

import com.lynkvertx.expower.engine.model.UnitDimensions;
import lombok.Value;

/**
 * Catalog enclosure size and mass for one installed-power rating.
 */
@Value
public class UnitSpec {

    UnitDimensions dimensions;

    /** Mass per unit (t) */
    double weight;
}

package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.lookup.CeilingLookupTable;
import com.lynkvertx.expower.engine.lookup.UnitSpec;
import com.lynkvertx.expower.engine.model.UnitSelectionParams;
import com.lynkvertx.expower.engine.model.UnitSelectionResult;
import com.lynkvertx.expower.engine.model.UtilityResult;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.Optional;

import static com.lynkvertx.expower.engine.StageChecks.requireFinite;

/**
 * Unit selection stage: installed power rating plus enclosure size and mass.
 *
 * <pre>
 * unitSelection = round(totalPowerGeneration × 1.1 / 100) × 100
 * </pre>
 * The quotient is rounded on its exact binary value with the configured rounding mode
 * (HALF_EVEN unless overridden).
 */
@Slf4j
public class UnitSelectionCalculator {

    static final double CAPACITY_MARGIN = 1.1;

    static final double CATALOG_STEP_KW = 100;

    private final CeilingLookupTable<UnitSpec> unitSpecTable;
    private final RoundingMode roundingMode;

    public UnitSelectionCalculator(CeilingLookupTable<UnitSpec> unitSpecTable) {
        this(unitSpecTable, RoundingMode.HALF_EVEN);
    }

    public UnitSelectionCalculator(CeilingLookupTable<UnitSpec> unitSpecTable, RoundingMode roundingMode) {
        this.unitSpecTable = Objects.requireNonNull(unitSpecTable, "unitSpecTable");
        this.roundingMode = Objects.requireNonNull(roundingMode, "roundingMode");
        if (roundingMode == RoundingMode.UNNECESSARY) {
            throw new IllegalArgumentException("Rounding mode UNNECESSARY cannot select a catalog step");
        }
    }

    public UnitSelectionResult compute(UtilityResult utility, UnitSelectionParams params) {
        Objects.requireNonNull(utility, "utility");
        Objects.requireNonNull(params, "params");

        double unitSelection = selectInstalledPower(utility.getTotalPowerGeneration());

        Optional<UnitSpec> spec = unitSpecTable.lookup(unitSelection);
        if (spec.isEmpty()) {
            log.warn("Unit dimensions table has no entries, using default dimensions {}", params.getDimensions());
        } else if (unitSpecTable.exceedsRange(unitSelection)) {
            log.warn("Installed power {} kW exceeds unit dimensions table, using largest enclosure", unitSelection);
        }

        UnitSelectionResult result = UnitSelectionResult.builder()
            .unitSelection(unitSelection)
            .unitDimensions(spec.map(UnitSpec::getDimensions).orElse(params.getDimensions()))
            .unitWeight(spec.map(UnitSpec::getWeight).orElse(params.getWeightPerUnit()))
            .lookupPower(unitSelection)
            .build();
        log.debug("Unit selection stage completed: {}", result);
        return result;
    }

    /**
     * Margined total generation rounded to the catalog step.
     */
    double selectInstalledPower(double totalPowerGeneration) {
        double steps = requireFinite("unitSelection", totalPowerGeneration * CAPACITY_MARGIN / CATALOG_STEP_KW);
        return requireFinite("unitSelection", roundToStep(steps) * CATALOG_STEP_KW);
    }

    /**
     * Round a step count to an integer. {@code new BigDecimal(double)} keeps the exact binary
     * value, so ties are only those quotients that are exactly representable halves.
     */
    double roundToStep(double steps) {
        return new BigDecimal(steps).setScale(0, roundingMode).doubleValue();
    }
}

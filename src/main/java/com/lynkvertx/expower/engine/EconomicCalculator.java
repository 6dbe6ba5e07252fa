package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.model.EconomicParams;
import com.lynkvertx.expower.engine.model.EconomicResult;
import com.lynkvertx.expower.engine.model.UtilityResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

import static com.lynkvertx.expower.engine.StageChecks.requireFinite;

/**
 * Economic stage: annual energy, income, coal and CO2 figures, all linear in net power.
 */
@Slf4j
public class EconomicCalculator {

    /** Annual energy is reported in 10⁴ kWh */
    static final double ENERGY_REPORTING_UNIT = 10000;

    public EconomicResult compute(UtilityResult utility, EconomicParams params) {
        Objects.requireNonNull(utility, "utility");
        Objects.requireNonNull(params, "params");

        double annualPowerGeneration = requireFinite("annualPowerGeneration",
            utility.getNetPowerOutput() * params.getAnnualOperatingHours() / ENERGY_REPORTING_UNIT);
        double annualCoalSavings = requireFinite("annualCoalSavings",
            annualPowerGeneration * params.getStandardCoalCoefficient());

        EconomicResult result = EconomicResult.builder()
            .annualPowerGeneration(annualPowerGeneration)
            .annualPowerIncome(requireFinite("annualPowerIncome", annualPowerGeneration * params.getElectricityPrice()))
            .annualCoalSavings(annualCoalSavings)
            .annualCoalCostSavings(requireFinite("annualCoalCostSavings", annualCoalSavings * params.getStandardCoalPrice()))
            .annualCo2Reduction(requireFinite("annualCo2Reduction", annualPowerGeneration * params.getCo2EmissionFactor()))
            .build();
        log.debug("Economic stage completed: {}", result);
        return result;
    }
}

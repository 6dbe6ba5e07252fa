package com.lynkvertx.expower.config;

import com.lynkvertx.expower.engine.EconomicCalculator;
import com.lynkvertx.expower.engine.MainEngineCalculator;
import com.lynkvertx.expower.engine.PowerCalculationPipeline;
import com.lynkvertx.expower.engine.UnitSelectionCalculator;
import com.lynkvertx.expower.engine.UtilityCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the calculation stages with the configured lookup tables.
 */
@Slf4j
@Configuration
public class CalculationEngineConfig {

    @Bean
    public UtilityCalculator utilityCalculator(PowerCalculationConfig config) {
        return new UtilityCalculator(config.buildOilPumpPowerTable());
    }

    @Bean
    public UnitSelectionCalculator unitSelectionCalculator(PowerCalculationConfig config) {
        log.info("Unit selection rounding mode: {}", config.getUnitRoundingMode());
        return new UnitSelectionCalculator(config.buildUnitSpecTable(), config.getUnitRoundingMode());
    }

    @Bean
    public PowerCalculationPipeline powerCalculationPipeline(UtilityCalculator utilityCalculator,
                                                             UnitSelectionCalculator unitSelectionCalculator) {
        return new PowerCalculationPipeline(
            new MainEngineCalculator(),
            utilityCalculator,
            new EconomicCalculator(),
            unitSelectionCalculator);
    }
}

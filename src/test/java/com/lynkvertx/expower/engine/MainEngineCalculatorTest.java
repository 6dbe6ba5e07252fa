package com.lynkvertx.expower.engine;

import com.lynkvertx.expower.engine.model.MainEngineParams;
import com.lynkvertx.expower.engine.model.MainEngineResult;
import org.junit.jupiter.api.Test;

import static com.lynkvertx.expower.engine.EngineFixtures.TOLERANCE;
import static com.lynkvertx.expower.engine.EngineFixtures.WORKED_EXAMPLE_MAIN_POWER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MainEngineCalculatorTest {

    private final MainEngineCalculator calculator = new MainEngineCalculator();

    @Test
    void shouldComputeWorkedExample() {
        MainEngineResult result = calculator.compute(MainEngineParams.of(WORKED_EXAMPLE_MAIN_POWER));

        assertThat(result.getMainOutputPower()).isCloseTo(62.62144735447999, within(TOLERANCE));
        assertThat(result.getMainLossPower()).isCloseTo(12.524289470895996, within(TOLERANCE));
        assertThat(result.getTotalPowerGeneration()).isCloseTo(45.24399571361179, within(TOLERANCE));
        assertThat(result.getInputPower()).isEqualTo(WORKED_EXAMPLE_MAIN_POWER);
    }

    @Test
    void shouldApplyEveryFactorOfTheChain() {
        MainEngineParams params = MainEngineParams.builder()
            .mainPower(1000)
            .wheelLossFactor(0.9)
            .generatorEfficiency(0.95)
            .mainLossFactor(0.75)
            .coolingLossFactor(0.5)
            .frequencyLossFactor(0.8)
            .wheelResistanceFactor(1.0)
            .build();

        MainEngineResult result = calculator.compute(params);

        assertThat(result.getMainOutputPower()).isCloseTo(400.0, within(TOLERANCE));
        assertThat(result.getMainLossPower()).isCloseTo(100.0, within(TOLERANCE));
        assertThat(result.getTotalPowerGeneration()).isCloseTo(342.0, within(TOLERANCE));
    }

    @Test
    void shouldLetMainLossFactorScaleOnlyLossPower() {
        MainEngineResult base = calculator.compute(MainEngineParams.of(1000));
        MainEngineResult lossier = calculator.compute(MainEngineParams.of(1000).toBuilder().mainLossFactor(0.5).build());

        assertThat(lossier.getMainOutputPower()).isEqualTo(base.getMainOutputPower());
        assertThat(lossier.getTotalPowerGeneration()).isEqualTo(base.getTotalPowerGeneration());
        assertThat(lossier.getMainLossPower()).isCloseTo(base.getMainLossPower() * 2.5, within(TOLERANCE));
    }

    @Test
    void shouldPropagateNegativeMainPowerSymmetrically() {
        MainEngineResult positive = calculator.compute(MainEngineParams.of(WORKED_EXAMPLE_MAIN_POWER));
        MainEngineResult negative = calculator.compute(MainEngineParams.of(-WORKED_EXAMPLE_MAIN_POWER));

        assertThat(negative.getMainOutputPower()).isNegative().isEqualTo(-positive.getMainOutputPower());
        assertThat(negative.getTotalPowerGeneration()).isNegative().isEqualTo(-positive.getTotalPowerGeneration());
        assertThat(negative.getMainLossPower()).isEqualTo(-positive.getMainLossPower());
    }

    @Test
    void shouldBeDeterministic() {
        MainEngineParams params = MainEngineParams.of(1234.5678);

        assertThat(calculator.compute(params)).isEqualTo(calculator.compute(params));
    }

    @Test
    void shouldRejectMissingParams() {
        assertThatThrownBy(() -> calculator.compute(null)).isInstanceOf(NullPointerException.class);
    }
}

package com.lynkvertx.expower.engine.model;

import com.lynkvertx.expower.engine.CalculationInputException;
import com.lynkvertx.expower.engine.CalculationInputException.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParameterRecordsTest {

    @Test
    void shouldApplyEngineeringDefaults() {
        MainEngineParams params = MainEngineParams.of(66.53419);

        assertThat(params.getMainPower()).isEqualTo(66.53419);
        assertThat(params.getWheelLossFactor()).isEqualTo(0.85);
        assertThat(params.getGeneratorEfficiency()).isEqualTo(0.85);
        assertThat(params.getMainLossFactor()).isEqualTo(0.80);
        assertThat(params.getCoolingLossFactor()).isEqualTo(0.98);
        assertThat(params.getFrequencyLossFactor()).isEqualTo(0.98);
        assertThat(params.getWheelResistanceFactor()).isEqualTo(0.98);

        UtilityParams utility = UtilityParams.defaults();
        assertThat(utility.getMechanicalLossRatio()).isEqualTo(0.04);
        assertThat(utility.getLubricationOilDensity()).isEqualTo(850);
        assertThat(utility.getNitrogenDemand()).isEqualTo(40);

        EconomicParams economics = EconomicParams.defaults();
        assertThat(economics.getAnnualOperatingHours()).isEqualTo(8000);
        assertThat(economics.getElectricityPrice()).isEqualTo(0.6);

        UnitSelectionParams unit = UnitSelectionParams.defaults();
        assertThat(unit.getDimensions().toArray()).containsExactly(3, 2.5, 2.5);
        assertThat(unit.getWeightPerUnit()).isEqualTo(15);
    }

    @Test
    void shouldAcceptNegativeMainPower() {
        assertThat(MainEngineParams.of(-12.5).getMainPower()).isEqualTo(-12.5);
    }

    @Test
    @DisplayName("Zero, NaN and infinite main power are invalid input")
    void shouldRejectUnusableMainPower() {
        for (double value : new double[]{0.0, Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
            assertThatThrownBy(() -> MainEngineParams.of(value))
                .isInstanceOfSatisfying(CalculationInputException.class, ex -> {
                    assertThat(ex.getKind()).isEqualTo(Kind.INVALID_INPUT);
                    assertThat(ex.getParameter()).isEqualTo("mainPower");
                });
        }
    }

    @Test
    void shouldRequireMainPowerWhenBuilding() {
        assertThatThrownBy(() -> MainEngineParams.builder().build())
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("mainPower");
    }

    @Test
    void shouldRejectFactorsOutsideUnitInterval() {
        assertThatThrownBy(() -> MainEngineParams.builder().mainPower(10).generatorEfficiency(0).build())
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("generatorEfficiency");
        assertThatThrownBy(() -> MainEngineParams.builder().mainPower(10).coolingLossFactor(-0.1).build())
            .isInstanceOf(CalculationInputException.class);
        assertThatThrownBy(() -> MainEngineParams.builder().mainPower(10).mainLossFactor(1.2).build())
            .isInstanceOf(CalculationInputException.class);
    }

    @Test
    void shouldAcceptFactorOfOne() {
        MainEngineParams params = MainEngineParams.builder().mainPower(10).wheelLossFactor(1.0).build();

        assertThat(params.getWheelLossFactor()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectNonPositiveUtilityConstants() {
        assertThatThrownBy(() -> UtilityParams.builder().lubricationOilDensity(0).build())
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("lubricationOilDensity");
        assertThatThrownBy(() -> UtilityParams.builder().coolingWaterSpecificHeat(Double.NaN).build())
            .isInstanceOf(CalculationInputException.class);
    }

    @Test
    void shouldRejectEconomicParametersOutOfRange() {
        assertThatThrownBy(() -> EconomicParams.builder().annualOperatingHours(8761).build())
            .isInstanceOfSatisfying(CalculationInputException.class,
                ex -> assertThat(ex.getKind()).isEqualTo(Kind.PARAMETER_RANGE));
        assertThatThrownBy(() -> EconomicParams.builder().annualOperatingHours(-1).build())
            .isInstanceOf(CalculationInputException.class);
        assertThatThrownBy(() -> EconomicParams.builder().electricityPrice(-0.6).build())
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("electricityPrice");
        assertThatThrownBy(() -> EconomicParams.builder().co2EmissionFactor(Double.POSITIVE_INFINITY).build())
            .isInstanceOf(CalculationInputException.class);
    }

    @Test
    void shouldAcceptEconomicBoundaries() {
        EconomicParams params = EconomicParams.builder()
            .annualOperatingHours(8760)
            .electricityPrice(0)
            .standardCoalPrice(0)
            .build();

        assertThat(params.getAnnualOperatingHours()).isEqualTo(8760);
        assertThat(EconomicParams.builder().annualOperatingHours(0).build().getAnnualOperatingHours()).isZero();
    }

    @Test
    void shouldRejectNonPositiveDimensions() {
        assertThatThrownBy(() -> new UnitDimensions(3, 0, 2.5))
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("width");
        assertThatThrownBy(() -> UnitSelectionParams.builder().weightPerUnit(-1).build())
            .isInstanceOf(CalculationInputException.class);
    }

    @Test
    void shouldCopyWithOverrides() {
        MainEngineParams base = MainEngineParams.of(100);
        MainEngineParams copy = base.toBuilder().mainPower(200).build();

        assertThat(copy.getMainPower()).isEqualTo(200);
        assertThat(copy.getWheelLossFactor()).isEqualTo(base.getWheelLossFactor());
        assertThat(base.getMainPower()).isEqualTo(100);
    }
}

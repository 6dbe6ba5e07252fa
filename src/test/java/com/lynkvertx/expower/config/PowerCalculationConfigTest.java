package com.lynkvertx.expower.config;

import com.lynkvertx.expower.config.PowerCalculationConfig.OilPumpRating;
import com.lynkvertx.expower.config.PowerCalculationConfig.UnitRating;
import com.lynkvertx.expower.engine.lookup.CeilingLookupTable;
import com.lynkvertx.expower.engine.lookup.UnitSpec;
import com.lynkvertx.expower.engine.model.UnitDimensions;
import org.junit.jupiter.api.Test;

import java.math.RoundingMode;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PowerCalculationConfigTest {

    @Test
    void shouldProvideBuiltInCatalog() {
        PowerCalculationConfig config = new PowerCalculationConfig();

        CeilingLookupTable<Double> oilPumps = config.buildOilPumpPowerTable();
        CeilingLookupTable<UnitSpec> units = config.buildUnitSpecTable();

        assertThat(oilPumps.lookup(79.578716)).contains(3.0);
        assertThat(oilPumps.lookup(1035)).contains(30.0);
        assertThat(oilPumps.exceedsRange(1035)).isFalse();
        assertThat(units.lookup(7000).map(UnitSpec::getWeight)).contains(50.0);
        assertThat(units.exceedsRange(7000.5)).isTrue();
        assertThat(units.lookup(250)).hasValueSatisfying(spec -> {
            assertThat(spec.getDimensions()).isEqualTo(new UnitDimensions(3, 2.5, 2.5));
            assertThat(spec.getWeight()).isEqualTo(15);
        });
        assertThat(config.getUnitRoundingMode()).isEqualTo(RoundingMode.HALF_EVEN);
        assertThat(config.getInvestmentCostPerKw()).isEqualTo(1.0);
    }

    @Test
    void shouldBuildConfiguredTables() {
        PowerCalculationConfig config = new PowerCalculationConfig();
        config.setOilPumpPowerTable(Arrays.asList(new OilPumpRating(50, 2), new OilPumpRating(500, 12)));
        config.setUnitDimensionsTable(Arrays.asList(new UnitRating(1000, 6, 3, 2.5, 25)));

        assertThat(config.buildOilPumpPowerTable().lookup(51)).contains(12.0);
        assertThat(config.buildUnitSpecTable().lookup(5000).map(UnitSpec::getWeight)).contains(25.0);
    }

    @Test
    void shouldRejectUnsortedConfiguredTable() {
        PowerCalculationConfig config = new PowerCalculationConfig();
        config.setOilPumpPowerTable(Arrays.asList(new OilPumpRating(500, 12), new OilPumpRating(50, 2)));

        assertThatThrownBy(config::buildOilPumpPowerTable)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("ascending");
    }
}

package com.lynkvertx.expower.config;

import com.lynkvertx.expower.engine.lookup.CeilingLookupTable;
import com.lynkvertx.expower.engine.lookup.UnitSpec;
import com.lynkvertx.expower.engine.model.UnitDimensions;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration properties for the power calculation.
 * Lookup tables and the selection policy are externalized here,
 * overridable via application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "expower.calculation")
public class PowerCalculationConfig {

    /** Rounding applied to the margined installed power quotient */
    private RoundingMode unitRoundingMode = RoundingMode.HALF_EVEN;

    /** Investment estimate per installed kW (10k yuan/kW) */
    private double investmentCostPerKw = 1.0;

    /**
     * Oil pump ratings keyed by lubrication oil amount (L/h), ascending.
     */
    private List<OilPumpRating> oilPumpPowerTable = defaultOilPumpPowerTable();

    /**
     * Skid enclosure size and mass keyed by installed power (kW), ascending.
     */
    private List<UnitRating> unitDimensionsTable = defaultUnitDimensionsTable();

    public CeilingLookupTable<Double> buildOilPumpPowerTable() {
        CeilingLookupTable.Builder<Double> builder = CeilingLookupTable.builder();
        for (OilPumpRating rating : oilPumpPowerTable) {
            builder.entry(rating.getOilAmount(), rating.getPowerKw());
        }
        return builder.build();
    }

    public CeilingLookupTable<UnitSpec> buildUnitSpecTable() {
        CeilingLookupTable.Builder<UnitSpec> builder = CeilingLookupTable.builder();
        for (UnitRating rating : unitDimensionsTable) {
            builder.entry(rating.getPowerKw(), new UnitSpec(
                new UnitDimensions(rating.getLength(), rating.getWidth(), rating.getHeight()),
                rating.getWeight()));
        }
        return builder.build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OilPumpRating {
        /** Upper bound of lubrication oil amount this pump covers (L/h) */
        private double oilAmount;
        private double powerKw;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UnitRating {
        private double powerKw;
        private double length;
        private double width;
        private double height;
        /** Mass per unit (t) */
        private double weight;
    }

    private static List<OilPumpRating> defaultOilPumpPowerTable() {
        return Arrays.asList(
            new OilPumpRating(28.4, 1.5),
            new OilPumpRating(37.9, 1.5),
            new OilPumpRating(60, 2.2),
            new OilPumpRating(80, 3),
            new OilPumpRating(108, 4),
            new OilPumpRating(157, 5.5),
            new OilPumpRating(189, 7.5),
            new OilPumpRating(225, 7.5),
            new OilPumpRating(277, 11),
            new OilPumpRating(319, 11),
            new OilPumpRating(401, 15),
            new OilPumpRating(471, 15),
            new OilPumpRating(536, 15),
            new OilPumpRating(596, 18.5),
            new OilPumpRating(662, 22),
            new OilPumpRating(846, 30),
            new OilPumpRating(1035, 30)
        );
    }

    private static List<UnitRating> defaultUnitDimensionsTable() {
        return Arrays.asList(
            new UnitRating(0, 3, 2.5, 2.5, 14),
            new UnitRating(250, 3, 2.5, 2.5, 15),
            new UnitRating(400, 3.5, 2.5, 2.5, 16),
            new UnitRating(450, 4, 2.5, 2.5, 17),
            new UnitRating(500, 4.5, 2.5, 2.5, 17),
            new UnitRating(560, 4.5, 3, 2.5, 18),
            new UnitRating(630, 5, 3, 2.5, 20),
            new UnitRating(710, 5.5, 3, 2.5, 22),
            new UnitRating(800, 6, 3, 2.5, 24),
            new UnitRating(900, 6.5, 3, 2.5, 25),
            new UnitRating(1120, 6.5, 3, 2.5, 26),
            new UnitRating(1250, 6.5, 3, 2.5, 27),
            new UnitRating(1400, 7, 3, 2.5, 28),
            new UnitRating(1600, 7.5, 3, 2.5, 29),
            new UnitRating(1800, 8, 3.5, 2.5, 30),
            new UnitRating(2000, 8.5, 3.5, 2.5, 31),
            new UnitRating(2240, 9, 3.5, 2.5, 32),
            new UnitRating(2500, 9.5, 4, 2.5, 33),
            new UnitRating(2800, 9.5, 4, 2.5, 34),
            new UnitRating(3150, 10.5, 4, 2.5, 35),
            new UnitRating(3550, 11, 4, 2.5, 38),
            new UnitRating(4000, 12, 4, 2.5, 40),
            new UnitRating(7000, 12, 6, 4, 50)
        );
    }
}

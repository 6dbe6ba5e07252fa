package com.lynkvertx.expower.service;

import com.lynkvertx.expower.config.PowerCalculationConfig;
import com.lynkvertx.expower.dto.CalculationParametersDTO;
import com.lynkvertx.expower.dto.PowerCalculationRequestDTO;
import com.lynkvertx.expower.dto.PowerCalculationResultDTO;
import com.lynkvertx.expower.dto.ScenarioPointDTO;
import com.lynkvertx.expower.dto.ScenarioSweepRequestDTO;
import com.lynkvertx.expower.engine.CalculationInputException;
import com.lynkvertx.expower.engine.EngineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PowerCalculationServiceTest {

    @Mock
    private CalculationRecordService recordService;

    private PowerCalculationConfig config;
    private PowerCalculationService service;

    @BeforeEach
    void setUp() {
        config = new PowerCalculationConfig();
        service = new PowerCalculationService(EngineFixtures.defaultPipeline(),
            new CalculationParameterMapper(), recordService, config);
    }

    @Test
    void shouldCalculateAndRecord() {
        when(recordService.record(eq("site A"), any(PowerCalculationResultDTO.class))).thenReturn(7L);

        PowerCalculationResultDTO result = service.calculate(PowerCalculationRequestDTO.builder()
            .mainPower(600.0)
            .label("site A")
            .build());

        assertThat(result.getRecordId()).isEqualTo(7L);
        assertThat(result.getUnitModel()).isEqualTo("TP400");
        assertThat(result.getInvestmentCost()).isEqualTo(400.0);
        // 400 / 190.2032 = 2.103
        assertThat(result.getPaybackPeriodYears()).isEqualTo(2.1);
        assertThat(result.getResult().getCalculationSummary().getFinalNetPower())
            .isCloseTo(396.25673199999994, within(1e-9));
        assertThat(result.getCalculationSteps()).hasSize(7);
        assertThat(result.getCalculationSteps().get(0)).startsWith("Step 1: Main power = ");
    }

    @Test
    void shouldPassCompletedResultToHistory() {
        ArgumentCaptor<PowerCalculationResultDTO> captor = ArgumentCaptor.forClass(PowerCalculationResultDTO.class);
        when(recordService.record(any(), captor.capture())).thenReturn(1L);

        service.calculate(PowerCalculationRequestDTO.builder().mainPower(1000.0).build());

        PowerCalculationResultDTO recorded = captor.getValue();
        assertThat(recorded.getUnitModel()).isEqualTo("TP700");
        assertThat(recorded.getResult().getUnitSelection().getUnitWeight()).isEqualTo(22);
    }

    @Test
    void shouldApplyParameterOverrides() {
        when(recordService.record(any(), any())).thenReturn(1L);

        PowerCalculationResultDTO result = service.calculate(PowerCalculationRequestDTO.builder()
            .mainPower(600.0)
            .parameters(CalculationParametersDTO.builder().annualOperatingHours(0.0).build())
            .build());

        assertThat(result.getResult().getEconomicAnalysis().getAnnualPowerIncome()).isEqualTo(0.0);
        assertThat(result.getPaybackPeriodYears()).isEqualTo(0.0);
    }

    @Test
    void shouldRejectZeroMainPowerWithoutRecording() {
        assertThatThrownBy(() -> service.calculate(PowerCalculationRequestDTO.builder().mainPower(0.0).build()))
            .isInstanceOf(CalculationInputException.class);

        verify(recordService, never()).record(any(), any());
    }

    @Test
    void shouldSweepInInputOrderWithoutRecording() {
        List<ScenarioPointDTO> points = service.sweep(ScenarioSweepRequestDTO.builder()
            .mainPowers(Arrays.asList(5000.0, 600.0, 1000.0, -66.53419))
            .build());

        assertThat(points).extracting(ScenarioPointDTO::getMainPower)
            .containsExactly(5000.0, 600.0, 1000.0, -66.53419);
        assertThat(points).extracting(ScenarioPointDTO::getUnitModel)
            .containsExactly("TP3700", "TP400", "TP700", "TP0");
        assertThat(points.get(1).getPaybackPeriodYears()).isEqualTo(2.1);
        assertThat(points.get(3).getPaybackPeriodYears()).isEqualTo(0.0);
        verify(recordService, never()).record(any(), any());
    }

    @Test
    void shouldFailWholeSweepOnInvalidValue() {
        ScenarioSweepRequestDTO request = ScenarioSweepRequestDTO.builder()
            .mainPowers(Arrays.asList(600.0, Double.NaN))
            .build();

        assertThatThrownBy(() -> service.sweep(request))
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("mainPower");
    }

    @Test
    void shouldRejectExtremeShaftPowerWithoutRecording() {
        assertThatThrownBy(() -> service.calculate(PowerCalculationRequestDTO.builder().mainPower(1e308).build()))
            .isInstanceOf(CalculationInputException.class)
            .hasMessageContaining("too large");

        verify(recordService, never()).record(any(), any());
    }

    @Test
    void shouldRejectPaybackThatOverflows() {
        assertThatThrownBy(() -> service.paybackPeriod(400, Double.MIN_VALUE))
            .isInstanceOfSatisfying(CalculationInputException.class,
                ex -> assertThat(ex.getParameter()).isEqualTo("paybackPeriodYears"));
    }

    @Test
    void shouldRoundPaybackHalfToEven() {
        assertThat(service.paybackPeriod(0.25, 1)).isEqualTo(0.2);
        assertThat(service.paybackPeriod(0.75, 1)).isEqualTo(0.8);
        assertThat(service.paybackPeriod(400, -5)).isEqualTo(0.0);
        assertThat(service.paybackPeriod(400, 0)).isEqualTo(0.0);
    }

    @Test
    void shouldScaleInvestmentWithConfiguredCost() {
        config.setInvestmentCostPerKw(0.8);

        assertThat(service.investmentCost(500)).isEqualTo(400.0);
        assertThat(service.unitModel(1200)).isEqualTo("TP1200");
    }
}

package com.lynkvertx.expower.service;

import com.lynkvertx.expower.config.PowerCalculationConfig;
import com.lynkvertx.expower.dto.CalculationParametersDTO;
import com.lynkvertx.expower.dto.PowerCalculationRequestDTO;
import com.lynkvertx.expower.dto.PowerCalculationResultDTO;
import com.lynkvertx.expower.dto.ScenarioPointDTO;
import com.lynkvertx.expower.dto.ScenarioSweepRequestDTO;
import com.lynkvertx.expower.engine.CalculationInputException;
import com.lynkvertx.expower.engine.PowerCalculationPipeline;
import com.lynkvertx.expower.engine.model.EconomicParams;
import com.lynkvertx.expower.engine.model.EconomicResult;
import com.lynkvertx.expower.engine.model.MainEngineParams;
import com.lynkvertx.expower.engine.model.MainEngineResult;
import com.lynkvertx.expower.engine.model.PowerCalculationResult;
import com.lynkvertx.expower.engine.model.UnitSelectionParams;
import com.lynkvertx.expower.engine.model.UnitSelectionResult;
import com.lynkvertx.expower.engine.model.UtilityParams;
import com.lynkvertx.expower.engine.model.UtilityResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Power Calculation Service
 *
 * Turns a shaft power from the process simulation into a sized generator skid.
 *
 * Steps:
 * 1. Main engine: loss power, output power, total generation
 * 2. Utility: oil and water circuits, oil pump lookup, self-consumption, net power
 * 3. Economics: annual energy, income, coal and CO2 savings
 * 4. Unit selection: installed power rating, enclosure size and mass
 * 5. Selection output: model code, investment estimate, payback period
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PowerCalculationService {

    static final String UNIT_MODEL_PREFIX = "TP";

    private final PowerCalculationPipeline pipeline;
    private final CalculationParameterMapper parameterMapper;
    private final CalculationRecordService recordService;
    private final PowerCalculationConfig config;

    /**
     * Run one calculation and record it in the history.
     */
    public PowerCalculationResultDTO calculate(PowerCalculationRequestDTO request) {
        double mainPower = request.getMainPower();
        CalculationParametersDTO overrides = request.getParameters();

        MainEngineParams mainParams = parameterMapper.toMainEngineParams(mainPower, overrides);
        UtilityParams utilityParams = parameterMapper.toUtilityParams(overrides);
        EconomicParams economicParams = parameterMapper.toEconomicParams(overrides);
        UnitSelectionParams unitParams = parameterMapper.toUnitSelectionParams(overrides);

        PowerCalculationResult result = pipeline.run(mainParams, utilityParams, economicParams, unitParams);

        double unitPower = result.getUnitSelection().getUnitSelection();
        double investmentCost = investmentCost(unitPower);
        double annualIncome = result.getEconomicAnalysis().getAnnualPowerIncome();
        double paybackPeriod = paybackPeriod(investmentCost, annualIncome);

        PowerCalculationResultDTO dto = PowerCalculationResultDTO.builder()
            .result(result)
            .unitModel(unitModel(unitPower))
            .investmentCost(investmentCost)
            .paybackPeriodYears(paybackPeriod)
            .calculationSteps(describeSteps(result, investmentCost, paybackPeriod))
            .build();

        dto.setRecordId(recordService.record(request.getLabel(), dto));
        log.info("Power calculation completed: main power {} kW -> net {} kW, unit {}",
            mainPower, result.getUtilityPower().getNetPowerOutput(), dto.getUnitModel());
        return dto;
    }

    /**
     * Run the pipeline for each shaft power with one shared parameter set.
     * Runs are independent and execute in parallel; results keep the input order.
     * Sweeps are not recorded in the history.
     */
    public List<ScenarioPointDTO> sweep(ScenarioSweepRequestDTO request) {
        CalculationParametersDTO overrides = request.getParameters();
        UtilityParams utilityParams = parameterMapper.toUtilityParams(overrides);
        EconomicParams economicParams = parameterMapper.toEconomicParams(overrides);
        UnitSelectionParams unitParams = parameterMapper.toUnitSelectionParams(overrides);

        // Validate every value up front so a bad entry fails the sweep before any run
        List<MainEngineParams> mainParams = request.getMainPowers().stream()
            .map(mainPower -> parameterMapper.toMainEngineParams(mainPower, overrides))
            .collect(Collectors.toList());

        List<ScenarioPointDTO> points = mainParams.parallelStream()
            .map(params -> toScenarioPoint(pipeline.run(params, utilityParams, economicParams, unitParams)))
            .collect(Collectors.toList());
        log.info("Scenario sweep completed: {} runs", points.size());
        return points;
    }

    public CalculationParametersDTO defaults() {
        return parameterMapper.defaults();
    }

    String unitModel(double unitPower) {
        return UNIT_MODEL_PREFIX + Math.round(unitPower);
    }

    double investmentCost(double unitPower) {
        double cost = unitPower * config.getInvestmentCostPerKw();
        if (!Double.isFinite(cost)) {
            throw CalculationInputException.nonFinite("investmentCost", cost);
        }
        return cost;
    }

    /**
     * Investment over annual income, rounded half-even to one decimal. 0 when there is no income.
     */
    double paybackPeriod(double investmentCost, double annualIncome) {
        if (annualIncome <= 0) {
            return 0;
        }
        double years = investmentCost / annualIncome;
        if (!Double.isFinite(years)) {
            throw CalculationInputException.nonFinite("paybackPeriodYears", years);
        }
        return new BigDecimal(years).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    private ScenarioPointDTO toScenarioPoint(PowerCalculationResult result) {
        double unitPower = result.getUnitSelection().getUnitSelection();
        double annualIncome = result.getEconomicAnalysis().getAnnualPowerIncome();
        return ScenarioPointDTO.builder()
            .mainPower(result.getCalculationSummary().getInputMainPower())
            .totalPowerGeneration(result.getMainEngine().getTotalPowerGeneration())
            .netPowerOutput(result.getUtilityPower().getNetPowerOutput())
            .annualIncome(annualIncome)
            .selectedUnitPower(unitPower)
            .unitModel(unitModel(unitPower))
            .paybackPeriodYears(paybackPeriod(investmentCost(unitPower), annualIncome))
            .build();
    }

    private List<String> describeSteps(PowerCalculationResult result, double investmentCost, double paybackPeriod) {
        MainEngineResult main = result.getMainEngine();
        UtilityResult utility = result.getUtilityPower();
        EconomicResult economics = result.getEconomicAnalysis();
        UnitSelectionResult unit = result.getUnitSelection();

        List<String> steps = new ArrayList<>();
        steps.add(String.format("Step 1: Main power = %.2fkW, loss power = %.2fkW, output power = %.2fkW, total generation = %.2fkW",
            main.getInputPower(), main.getMainLossPower(), main.getMainOutputPower(), main.getTotalPowerGeneration()));
        steps.add(String.format("Step 2: Lubrication oil amount = %.2f, oil cooler circulating water = %.2ft/h, oil pump (table) = %.2fkW",
            utility.getLubricationOilAmount(), utility.getOilCoolerCirculationWater(), utility.getOilPumpPower()));
        steps.add(String.format("Step 2a: Self-consumption = pump %.2f + heater %.2f + cooling loop %.2f + circulation %.2f = %.2fkW",
            utility.getComponentPowers().getLubricationPump(), utility.getComponentPowers().getLubricationHeater(),
            utility.getComponentPowers().getCoolingLoopPump(), utility.getComponentPowers().getCirculationPump(),
            utility.getUtilitySelfConsumption()));
        steps.add(String.format("Step 2b: Net power = %.2f - %.2f = %.2fkW",
            utility.getTotalPowerGeneration(), utility.getUtilitySelfConsumption(), utility.getNetPowerOutput()));
        steps.add(String.format("Step 3: Annual generation = %.4f (10k kWh), income = %.4f (10k yuan), coal saved = %.4f, coal cost saved = %.4f, CO2 reduced = %.4f",
            economics.getAnnualPowerGeneration(), economics.getAnnualPowerIncome(), economics.getAnnualCoalSavings(),
            economics.getAnnualCoalCostSavings(), economics.getAnnualCo2Reduction()));
        steps.add(String.format("Step 4: Unit selection = ROUND(%.2f × 1.1 / 100) × 100 = %.0fkW, dimensions %s m, weight %.1ft",
            utility.getTotalPowerGeneration(), unit.getUnitSelection(), unit.getUnitDimensions(), unit.getUnitWeight()));
        steps.add(String.format("Step 5: Investment = %.1f (10k yuan), payback period = %.1f years",
            investmentCost, paybackPeriod));
        return steps;
    }
}

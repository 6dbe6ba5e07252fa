package com.lynkvertx.expower.controller;

import com.lynkvertx.expower.dto.ApiResponse;
import com.lynkvertx.expower.dto.CalculationParametersDTO;
import com.lynkvertx.expower.dto.PowerCalculationRequestDTO;
import com.lynkvertx.expower.dto.PowerCalculationResultDTO;
import com.lynkvertx.expower.dto.ScenarioPointDTO;
import com.lynkvertx.expower.dto.ScenarioSweepRequestDTO;
import com.lynkvertx.expower.service.PowerCalculationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.List;

/**
 * Power Calculation REST Controller
 */
@RestController
@RequestMapping("/api/power-calculations")
@RequiredArgsConstructor
@Tag(name = "Power Calculation", description = "Generator skid sizing from simulated shaft power")
public class PowerCalculationController {

    private final PowerCalculationService calculationService;

    @PostMapping
    @Operation(summary = "Calculate skid", description = "Run the main engine, utility, economic and unit selection stages for one shaft power")
    public ResponseEntity<ApiResponse<PowerCalculationResultDTO>> calculate(
            @Valid @RequestBody PowerCalculationRequestDTO request) {
        PowerCalculationResultDTO result = calculationService.calculate(request);
        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(ApiResponse.created("Power calculation completed", result));
    }

    @PostMapping("/sweep")
    @Operation(summary = "Scenario sweep", description = "Run the calculation for several shaft powers with one parameter set")
    public ResponseEntity<ApiResponse<List<ScenarioPointDTO>>> sweep(
            @Valid @RequestBody ScenarioSweepRequestDTO request) {
        List<ScenarioPointDTO> points = calculationService.sweep(request);
        return ResponseEntity.ok(ApiResponse.success("Scenario sweep completed", points));
    }

    @GetMapping("/defaults")
    @Operation(summary = "Default parameters", description = "Engineering constants used when a request leaves a parameter unset")
    public ResponseEntity<ApiResponse<CalculationParametersDTO>> defaults() {
        return ResponseEntity.ok(ApiResponse.success(calculationService.defaults()));
    }
}

package com.lynkvertx.expower.controller;

import com.lynkvertx.expower.dto.ApiResponse;
import com.lynkvertx.expower.dto.CalculationRecordDTO;
import com.lynkvertx.expower.service.CalculationRecordService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Calculation History REST Controller
 */
@RestController
@RequestMapping("/api/power-calculations/history")
@RequiredArgsConstructor
@Tag(name = "Calculation History", description = "Recorded power calculations")
public class CalculationRecordController {

    private final CalculationRecordService recordService;

    @GetMapping
    @Operation(summary = "List records", description = "Most recent calculations, optionally filtered by label")
    public ResponseEntity<ApiResponse<List<CalculationRecordDTO>>> getRecords(
            @RequestParam(required = false) String label) {
        return ResponseEntity.ok(ApiResponse.success(recordService.getRecentRecords(label)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get record", description = "One calculation including its full result snapshot")
    public ResponseEntity<ApiResponse<CalculationRecordDTO>> getRecord(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success(recordService.getRecordById(id)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete record", description = "Remove a calculation from the history")
    public ResponseEntity<ApiResponse<Void>> deleteRecord(@PathVariable Long id) {
        recordService.deleteRecord(id);
        return ResponseEntity.ok(ApiResponse.success("Calculation record deleted", null));
    }
}

package com.lynkvertx.expower.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lynkvertx.expower.dto.CalculationRecordDTO;
import com.lynkvertx.expower.dto.PowerCalculationResultDTO;
import com.lynkvertx.expower.engine.model.CalculationSummary;
import com.lynkvertx.expower.entity.CalculationRecord;
import com.lynkvertx.expower.repository.CalculationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.persistence.EntityNotFoundException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Calculation Record Service
 * Stores and serves the history of completed calculations
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalculationRecordService {

    private final CalculationRecordRepository recordRepository;
    private final ObjectMapper objectMapper;

    /**
     * Persist a completed calculation, returns the new record id.
     * The id is set on {@code calculation} before its snapshot is written.
     */
    @Transactional
    public Long record(String label, PowerCalculationResultDTO calculation) {
        CalculationSummary summary = calculation.getResult().getCalculationSummary();
        CalculationRecord saved = recordRepository.save(CalculationRecord.builder()
            .label(label)
            .mainPower(summary.getInputMainPower())
            .netPowerOutput(summary.getFinalNetPower())
            .annualIncome(summary.getAnnualIncome())
            .selectedUnitPower(summary.getSelectedUnitPower())
            .unitModel(calculation.getUnitModel())
            .paybackPeriodYears(calculation.getPaybackPeriodYears())
            .build());
        calculation.setRecordId(saved.getId());
        saved.setResultSnapshot(writeSnapshot(calculation));
        log.info("Recorded calculation {} for main power {} kW", saved.getId(), saved.getMainPower());
        return saved.getId();
    }

    /**
     * Most recent records, optionally filtered by label
     */
    public List<CalculationRecordDTO> getRecentRecords(String label) {
        List<CalculationRecord> records = label == null || label.isBlank()
            ? recordRepository.findTop50ByOrderByCreatedAtDescIdDesc()
            : recordRepository.findTop50ByLabelContainingIgnoreCaseOrderByCreatedAtDescIdDesc(label.trim());
        return records.stream()
            .map(record -> toDTO(record, false))
            .collect(Collectors.toList());
    }

    public CalculationRecordDTO getRecordById(Long id) {
        CalculationRecord record = recordRepository.findById(id)
            .orElseThrow(() -> new EntityNotFoundException("Calculation record not found with id: " + id));
        return toDTO(record, true);
    }

    @Transactional
    public void deleteRecord(Long id) {
        if (!recordRepository.existsById(id)) {
            throw new EntityNotFoundException("Calculation record not found with id: " + id);
        }
        recordRepository.deleteById(id);
        log.info("Deleted calculation record with id: {}", id);
    }

    private String writeSnapshot(PowerCalculationResultDTO calculation) {
        try {
            return objectMapper.writeValueAsString(calculation);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize calculation snapshot", e);
        }
    }

    private JsonNode readSnapshot(CalculationRecord record) {
        if (record.getResultSnapshot() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(record.getResultSnapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt snapshot in calculation record " + record.getId(), e);
        }
    }

    private CalculationRecordDTO toDTO(CalculationRecord entity, boolean withSnapshot) {
        return CalculationRecordDTO.builder()
            .id(entity.getId())
            .label(entity.getLabel())
            .mainPower(entity.getMainPower())
            .netPowerOutput(entity.getNetPowerOutput())
            .annualIncome(entity.getAnnualIncome())
            .selectedUnitPower(entity.getSelectedUnitPower())
            .unitModel(entity.getUnitModel())
            .paybackPeriodYears(entity.getPaybackPeriodYears())
            .snapshot(withSnapshot ? readSnapshot(entity) : null)
            .createdAt(entity.getCreatedAt())
            .build();
    }
}

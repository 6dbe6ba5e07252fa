package com.lynkvertx.expower.repository;

import com.lynkvertx.expower.entity.CalculationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Calculation Record Repository
 */
@Repository
public interface CalculationRecordRepository extends JpaRepository<CalculationRecord, Long> {

    /**
     * Most recent records first
     */
    List<CalculationRecord> findTop50ByOrderByCreatedAtDescIdDesc();

    List<CalculationRecord> findTop50ByLabelContainingIgnoreCaseOrderByCreatedAtDescIdDesc(String label);
}

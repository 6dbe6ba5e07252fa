package com.lynkvertx.expower.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import javax.persistence.*;
import java.time.LocalDateTime;

/**
 * Calculation record entity
 * Snapshot of one completed power calculation
 */
@Entity
@Table(name = "calculation_record")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255)
    private String label;

    @Column(name = "main_power", nullable = false)
    private Double mainPower;

    @Column(name = "net_power_output", nullable = false)
    private Double netPowerOutput;

    @Column(name = "annual_income", nullable = false)
    private Double annualIncome;

    @Column(name = "selected_unit_power", nullable = false)
    private Double selectedUnitPower;

    @Column(name = "unit_model", length = 32)
    private String unitModel;

    @Column(name = "payback_period_years")
    private Double paybackPeriodYears;

    /** Full result serialized as JSON */
    @Lob
    @Column(name = "result_snapshot")
    private String resultSnapshot;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}

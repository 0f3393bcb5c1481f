package com.techportfolio.portfolio.model;

import com.techportfolio.common.model.MaturityLevel;
import com.techportfolio.common.model.RiskLevel;
import com.techportfolio.common.model.TechnologyType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A technology tracked inside one portfolio. Cost fields are optional; an absent
 * {@code annualCost} counts as zero in portfolio summaries.
 */
@Data
@NoArgsConstructor
@Table("technologies")
public class Technology {

    @Id
    private Long id;

    private Long portfolioId;

    private String name;

    private String description;

    private String category;

    private String version;

    private TechnologyType type;

    private MaturityLevel maturityLevel;

    private RiskLevel riskLevel;

    private BigDecimal annualCost;

    private BigDecimal licenseCost;

    private BigDecimal maintenanceCost;

    private String vendorName;

    private String vendorContact;

    private LocalDateTime supportContractExpiry;

    private Boolean isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}

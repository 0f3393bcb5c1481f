package com.techportfolio.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.techportfolio.common.model.MaturityLevel;
import com.techportfolio.common.model.RiskLevel;
import com.techportfolio.common.model.TechnologyType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Request body for POST /api/v1/portfolios/{id}/technologies.
 */
public record AddTechnologyRequest(
    @JsonProperty("name")            @NotBlank @Size(max = 255) String name,
    @JsonProperty("description")     String description,
    @JsonProperty("category")        @NotBlank @Size(max = 100) String category,
    @JsonProperty("version")         String version,
    @JsonProperty("type")            @NotNull TechnologyType type,
    @JsonProperty("maturityLevel")   @NotNull MaturityLevel maturityLevel,
    @JsonProperty("riskLevel")       @NotNull RiskLevel riskLevel,
    @JsonProperty("annualCost")      @DecimalMin("0.00") BigDecimal annualCost,
    @JsonProperty("licenseCost")     @DecimalMin("0.00") BigDecimal licenseCost,
    @JsonProperty("maintenanceCost") @DecimalMin("0.00") BigDecimal maintenanceCost,
    @JsonProperty("vendorName")      String vendorName,
    @JsonProperty("vendorContact")   @Size(max = 200) String vendorContact,
    @JsonProperty("supportContractExpiry") LocalDateTime supportContractExpiry
) {}

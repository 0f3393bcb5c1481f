package com.techportfolio.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} fields keep their current value.
 */
public record UpdatePortfolioRequest(
    @JsonProperty("name")        @Size(min = 1, max = 255) String name,
    @JsonProperty("description") String description,
    @JsonProperty("type")        PortfolioType type,
    @JsonProperty("status")      PortfolioStatus status
) {}

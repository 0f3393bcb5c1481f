package com.techportfolio.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.techportfolio.common.model.PortfolioType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/v1/portfolios. The owner is the authenticated caller,
 * never a body field.
 */
public record CreatePortfolioRequest(
    @JsonProperty("name")           @NotBlank @Size(max = 255) String name,
    @JsonProperty("description")    String description,
    @JsonProperty("type")           @NotNull PortfolioType type,
    @JsonProperty("organizationId") Long organizationId
) {}

package com.techportfolio.portfolio.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Derived view of a portfolio joined with its active technologies. Computed on every
 * request or stream tick and never persisted or cached.
 */
public record PortfolioSummary(
    @JsonProperty("id")              Long id,
    @JsonProperty("name")            String name,
    @JsonProperty("type")            PortfolioType type,
    @JsonProperty("status")          PortfolioStatus status,
    @JsonProperty("technologyCount") long technologyCount,
    @JsonProperty("totalAnnualCost") BigDecimal totalAnnualCost,
    @JsonProperty("lastUpdated")     LocalDateTime lastUpdated
) {

    public static PortfolioSummary of(Portfolio portfolio, long technologyCount,
                                      BigDecimal totalAnnualCost, LocalDateTime computedAt) {
        BigDecimal cost = totalAnnualCost != null ? totalAnnualCost : BigDecimal.ZERO;
        return new PortfolioSummary(
            portfolio.getId(),
            portfolio.getName(),
            portfolio.getType(),
            portfolio.getStatus(),
            technologyCount,
            cost.setScale(2, RoundingMode.HALF_UP),
            computedAt
        );
    }
}

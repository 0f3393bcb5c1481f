package com.techportfolio.portfolio.dto;

import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;

/**
 * Predicate for portfolio listings. Every field is optional; {@code null} means
 * "any". Only active portfolios ever match. {@code name} matches case-insensitively
 * as a substring.
 */
public record PortfolioFilter(
    PortfolioType type,
    PortfolioStatus status,
    Long organizationId,
    Long ownerId,
    String name
) {

    public static PortfolioFilter any() {
        return new PortfolioFilter(null, null, null, null, null);
    }

    public static PortfolioFilter byOwner(Long ownerId) {
        return new PortfolioFilter(null, null, null, ownerId, null);
    }
}

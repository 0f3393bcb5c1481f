package com.techportfolio.common.model;

/**
 * Lifecycle status of a portfolio. A logically deleted portfolio is moved to
 * {@link #INACTIVE} alongside its {@code isActive=false} flag.
 */
public enum PortfolioStatus {
    ACTIVE,
    INACTIVE,
    ARCHIVED,
    UNDER_REVIEW
}

package com.techportfolio.common.exception;

public class AggregationException extends PortfolioException {

    private final Long portfolioId;

    public AggregationException(Long portfolioId, Throwable cause) {
        super(ErrorKind.AGGREGATION, "Summary aggregation failed for portfolio " + portfolioId, cause);
        this.portfolioId = portfolioId;
    }

    public Long getPortfolioId() {
        return portfolioId;
    }
}

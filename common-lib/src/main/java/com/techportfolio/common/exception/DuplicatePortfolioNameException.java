package com.techportfolio.common.exception;

public class DuplicatePortfolioNameException extends ValidationException {

    private final String portfolioName;

    public DuplicatePortfolioNameException(String portfolioName) {
        super("Portfolio with name '" + portfolioName + "' already exists", true);
        this.portfolioName = portfolioName;
    }

    public DuplicatePortfolioNameException(String portfolioName, Throwable cause) {
        super("Portfolio with name '" + portfolioName + "' already exists", true, cause);
        this.portfolioName = portfolioName;
    }

    public String getPortfolioName() {
        return portfolioName;
    }
}

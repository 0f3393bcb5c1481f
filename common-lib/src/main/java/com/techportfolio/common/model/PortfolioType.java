package com.techportfolio.common.model;

public enum PortfolioType {
    ENTERPRISE,
    DEPARTMENTAL,
    PROJECT,
    PERSONAL
}

package com.techportfolio.portfolio;

import com.techportfolio.common.model.MaturityLevel;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;
import com.techportfolio.common.model.RiskLevel;
import com.techportfolio.common.model.TechnologyType;
import com.techportfolio.portfolio.model.Portfolio;
import com.techportfolio.portfolio.model.Technology;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public final class TestFixtures {

    private TestFixtures() {}

    public static Portfolio portfolio(Long id, String name) {
        Portfolio portfolio = new Portfolio();
        portfolio.setId(id);
        portfolio.setName(name);
        portfolio.setType(PortfolioType.ENTERPRISE);
        portfolio.setStatus(PortfolioStatus.ACTIVE);
        portfolio.setOwnerId(7L);
        portfolio.setIsActive(true);
        portfolio.setCreatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        portfolio.setUpdatedAt(LocalDateTime.of(2024, 1, 1, 0, 0));
        return portfolio;
    }

    public static Technology technology(Long id, Long portfolioId, String name, String annualCost) {
        Technology technology = new Technology();
        technology.setId(id);
        technology.setPortfolioId(portfolioId);
        technology.setName(name);
        technology.setCategory("Database");
        technology.setType(TechnologyType.PLATFORM);
        technology.setMaturityLevel(MaturityLevel.MATURE);
        technology.setRiskLevel(RiskLevel.LOW);
        technology.setAnnualCost(annualCost != null ? new BigDecimal(annualCost) : null);
        technology.setIsActive(true);
        return technology;
    }
}

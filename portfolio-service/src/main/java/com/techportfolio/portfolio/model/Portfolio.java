package com.techportfolio.portfolio.model;

import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A named technology portfolio. Technologies point at it through
 * {@code Technology.portfolioId}; the portfolio holds no collection of them.
 * Deletion is logical: {@code isActive=false} with status {@code INACTIVE}.
 */
@Data
@NoArgsConstructor
@Table("portfolios")
public class Portfolio {

    @Id
    private Long id;

    private String name;

    private String description;

    private PortfolioType type;

    private PortfolioStatus status;

    private Long ownerId;

    private Long organizationId;

    private Boolean isActive;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}

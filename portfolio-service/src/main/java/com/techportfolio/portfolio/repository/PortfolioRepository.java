package com.techportfolio.portfolio.repository;

import com.techportfolio.portfolio.model.Portfolio;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface PortfolioRepository extends ReactiveCrudRepository<Portfolio, Long> {

    @Query("SELECT * FROM portfolios WHERE id = :id AND is_active = TRUE")
    Mono<Portfolio> findActiveById(Long id);

    @Query("SELECT COUNT(*) FROM portfolios WHERE name = :name AND is_active = TRUE")
    Mono<Long> countActiveByName(String name);
}

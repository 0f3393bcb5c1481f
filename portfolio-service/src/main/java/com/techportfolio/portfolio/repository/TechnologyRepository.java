package com.techportfolio.portfolio.repository;

import com.techportfolio.portfolio.model.Technology;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface TechnologyRepository extends ReactiveCrudRepository<Technology, Long> {

    @Query("SELECT * FROM technologies WHERE id = :id AND is_active = TRUE")
    Mono<Technology> findActiveById(Long id);

    @Query("""
        SELECT * FROM technologies
        WHERE portfolio_id = :portfolioId
          AND is_active = TRUE
        ORDER BY id
        """)
    Flux<Technology> findActiveByPortfolioId(Long portfolioId);

    @Query("""
        SELECT COUNT(*) FROM technologies
        WHERE portfolio_id = :portfolioId
          AND is_active = TRUE
        """)
    Mono<Long> countActiveByPortfolioId(Long portfolioId);
}

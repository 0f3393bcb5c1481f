package com.techportfolio.portfolio.repository;

import com.techportfolio.portfolio.dto.PortfolioFilter;
import com.techportfolio.portfolio.model.Portfolio;
import com.techportfolio.portfolio.model.Technology;
import com.techportfolio.portfolio.recovery.StorageRecovery;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fetch stage of the pipeline: non-blocking point, collection, predicate and count
 * reads plus the mutation path, all routed through {@link StorageRecovery}.
 *
 * <p>Suspension point: every method returns before storage is contacted; the R2DBC
 * driver resumes the pipeline on its event loop once rows arrive. Logically deleted
 * rows are invisible to all reads. "Not found" is an empty {@link Mono}, never an
 * error; an unreachable store surfaces as
 * {@link com.techportfolio.common.exception.StorageException}.
 */
@Component
public class ReadRepository {

    private final PortfolioRepository portfolioRepository;
    private final TechnologyRepository technologyRepository;
    private final R2dbcEntityTemplate template;
    private final StorageRecovery recovery;

    public ReadRepository(PortfolioRepository portfolioRepository,
                          TechnologyRepository technologyRepository,
                          R2dbcEntityTemplate template,
                          StorageRecovery recovery) {
        this.portfolioRepository  = portfolioRepository;
        this.technologyRepository = technologyRepository;
        this.template             = template;
        this.recovery             = recovery;
    }

    // ── reads ───────────────────────────────────────────────────────────────

    public Mono<Portfolio> getById(Long portfolioId) {
        return recovery.recover(
            Mono.defer(() -> portfolioRepository.findActiveById(portfolioId)),
            "portfolio.getById");
    }

    public Flux<Technology> getCollectionByParent(Long portfolioId) {
        return recovery.recover(
            Flux.defer(() -> technologyRepository.findActiveByPortfolioId(portfolioId)),
            "technology.getCollectionByParent");
    }

    public Mono<Long> countByParent(Long portfolioId) {
        return recovery.recover(
            Mono.defer(() -> technologyRepository.countActiveByPortfolioId(portfolioId)),
            "technology.countByParent")
            .defaultIfEmpty(0L);
    }

    public Mono<Technology> getTechnologyById(Long technologyId) {
        return recovery.recover(
            Mono.defer(() -> technologyRepository.findActiveById(technologyId)),
            "technology.getById");
    }

    /**
     * Active portfolios matching {@code filter}, ordered by id.
     */
    public Flux<Portfolio> getByPredicate(PortfolioFilter filter) {
        Query query = Query.query(toCriteria(filter)).sort(Sort.by("id"));
        return recovery.recover(
            Flux.defer(() -> template.select(Portfolio.class).matching(query).all()),
            "portfolio.getByPredicate");
    }

    public Mono<Boolean> existsActiveByName(String name) {
        return recovery.recover(
            Mono.defer(() -> portfolioRepository.countActiveByName(name)),
            "portfolio.existsActiveByName")
            .map(count -> count > 0)
            .defaultIfEmpty(false);
    }

    // ── mutations ───────────────────────────────────────────────────────────

    public Mono<Portfolio> savePortfolio(Portfolio portfolio) {
        return recovery.recover(
            Mono.defer(() -> portfolioRepository.save(portfolio)),
            "portfolio.save");
    }

    public Mono<Technology> saveTechnology(Technology technology) {
        return recovery.recover(
            Mono.defer(() -> technologyRepository.save(technology)),
            "technology.save");
    }

    static Criteria toCriteria(PortfolioFilter filter) {
        Criteria criteria = Criteria.where("isActive").isTrue();
        if (filter == null) {
            return criteria;
        }
        if (filter.type() != null) {
            criteria = criteria.and("type").is(filter.type().name());
        }
        if (filter.status() != null) {
            criteria = criteria.and("status").is(filter.status().name());
        }
        if (filter.organizationId() != null) {
            criteria = criteria.and("organizationId").is(filter.organizationId());
        }
        if (filter.ownerId() != null) {
            criteria = criteria.and("ownerId").is(filter.ownerId());
        }
        if (filter.name() != null && !filter.name().isBlank()) {
            criteria = criteria.and("name").like("%" + filter.name().trim() + "%").ignoreCase(true);
        }
        return criteria;
    }
}

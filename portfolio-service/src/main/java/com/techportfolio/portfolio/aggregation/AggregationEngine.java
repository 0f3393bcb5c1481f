package com.techportfolio.portfolio.aggregation;

import com.techportfolio.common.exception.AggregationException;
import com.techportfolio.portfolio.config.PortfolioProperties;
import com.techportfolio.portfolio.dto.PortfolioFilter;
import com.techportfolio.portfolio.model.Portfolio;
import com.techportfolio.portfolio.model.PortfolioSummary;
import com.techportfolio.portfolio.model.Technology;
import com.techportfolio.portfolio.repository.ReadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Join stage: combines a portfolio with its active technologies into a
 * {@link PortfolioSummary}.
 *
 * <pre>
 *   getById(id) ──► empty? ──► empty result
 *        │
 *        └──► zip( countByParent(id), sum(annualCost of getCollectionByParent(id)) ) ──► summary
 * </pre>
 *
 * <p>The two dependent fetches run concurrently and the summary is emitted only once both
 * have resolved. An empty technology set resolves to {@code count=0, cost=0}. A failure of
 * either dependent fetch fails the whole computation with {@link AggregationException};
 * it is never reported as a zero.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final ReadRepository readRepository;
    private final int concurrency;
    private final Clock clock;

    @Autowired
    public AggregationEngine(ReadRepository readRepository, PortfolioProperties properties) {
        this(readRepository, properties.getStorage().getAggregationConcurrency(), Clock.systemUTC());
    }

    AggregationEngine(ReadRepository readRepository, int concurrency, Clock clock) {
        this.readRepository = readRepository;
        this.concurrency    = concurrency;
        this.clock          = clock;
    }

    /**
     * @return the summary of an active portfolio, or empty when it does not exist
     */
    public Mono<PortfolioSummary> computeSummary(Long portfolioId) {
        return readRepository.getById(portfolioId)
            .flatMap(this::join);
    }

    /**
     * Summaries of all active portfolios matching {@code filter}, in id order.
     * At most {@code aggregationConcurrency} joins run at the same time.
     */
    public Flux<PortfolioSummary> computeSummaries(PortfolioFilter filter) {
        return readRepository.getByPredicate(filter)
            .flatMapSequential(this::join, concurrency);
    }

    private Mono<PortfolioSummary> join(Portfolio portfolio) {
        Long portfolioId = portfolio.getId();

        Mono<Long> count = readRepository.countByParent(portfolioId);
        Mono<BigDecimal> totalCost = readRepository.getCollectionByParent(portfolioId)
            .map(AggregationEngine::annualCostOf)
            .reduce(BigDecimal.ZERO, BigDecimal::add);

        return Mono.zip(count, totalCost)
            .map(tuple -> PortfolioSummary.of(portfolio, tuple.getT1(), tuple.getT2(),
                                              LocalDateTime.now(clock)))
            .onErrorMap(e -> !(e instanceof AggregationException), e -> {
                log.error("Summary join failed. portfolioId={}", portfolioId, e);
                return new AggregationException(portfolioId, e);
            });
    }

    private static BigDecimal annualCostOf(Technology technology) {
        return technology.getAnnualCost() != null ? technology.getAnnualCost() : BigDecimal.ZERO;
    }
}

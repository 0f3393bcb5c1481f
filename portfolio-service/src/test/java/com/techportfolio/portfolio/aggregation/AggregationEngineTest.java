package com.techportfolio.portfolio.aggregation;

import com.techportfolio.common.exception.AggregationException;
import com.techportfolio.common.exception.StorageException;
import com.techportfolio.portfolio.dto.PortfolioFilter;
import com.techportfolio.portfolio.model.PortfolioSummary;
import com.techportfolio.portfolio.repository.ReadRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static com.techportfolio.portfolio.TestFixtures.portfolio;
import static com.techportfolio.portfolio.TestFixtures.technology;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AggregationEngineTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:15:30Z");

    @Mock
    private ReadRepository readRepository;

    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AggregationEngine(readRepository, 4, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("computeSummary()")
    class ComputeSummaryTests {

        @Test
        @DisplayName("count and cost cover active technologies; null cost counts as zero")
        void sumsActiveCosts() {
            when(readRepository.getById(1L)).thenReturn(Mono.just(portfolio(1L, "Edge Infra")));
            when(readRepository.countByParent(1L)).thenReturn(Mono.just(3L));
            when(readRepository.getCollectionByParent(1L)).thenReturn(Flux.just(
                technology(10L, 1L, "Postgres", "1200.00"),
                technology(11L, 1L, "Redis", null),
                technology(12L, 1L, "Kafka", "300.5")));

            StepVerifier.create(engine.computeSummary(1L))
                .assertNext(summary -> {
                    assertThat(summary.id()).isEqualTo(1L);
                    assertThat(summary.name()).isEqualTo("Edge Infra");
                    assertThat(summary.technologyCount()).isEqualTo(3);
                    assertThat(summary.totalAnnualCost()).isEqualTo(new BigDecimal("1500.50"));
                    assertThat(summary.lastUpdated()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no technologies → {0, 0.00}, never empty")
        void zeroTechnologies() {
            when(readRepository.getById(2L)).thenReturn(Mono.just(portfolio(2L, "Empty")));
            when(readRepository.countByParent(2L)).thenReturn(Mono.just(0L));
            when(readRepository.getCollectionByParent(2L)).thenReturn(Flux.empty());

            StepVerifier.create(engine.computeSummary(2L))
                .assertNext(summary -> {
                    assertThat(summary.technologyCount()).isZero();
                    assertThat(summary.totalAnnualCost()).isEqualTo(new BigDecimal("0.00"));
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("absent portfolio → empty, dependent fetches never issued")
        void absentPortfolio() {
            when(readRepository.getById(99L)).thenReturn(Mono.empty());

            StepVerifier.create(engine.computeSummary(99L)).verifyComplete();

            verify(readRepository, never()).countByParent(any());
            verify(readRepository, never()).getCollectionByParent(any());
        }

        @Test
        @DisplayName("failed dependent fetch → AggregationException, not a zero")
        void dependentFailure() {
            StorageException cause = new StorageException("technology.getCollectionByParent", 4,
                                                          new RuntimeException("connection reset"));
            when(readRepository.getById(1L)).thenReturn(Mono.just(portfolio(1L, "Edge Infra")));
            when(readRepository.countByParent(1L)).thenReturn(Mono.just(2L));
            when(readRepository.getCollectionByParent(1L)).thenReturn(Flux.error(cause));

            StepVerifier.create(engine.computeSummary(1L))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(AggregationException.class);
                    assertThat(((AggregationException) error).getPortfolioId()).isEqualTo(1L);
                    assertThat(error).hasCause(cause);
                })
                .verify();
        }

        @Test
        @DisplayName("failed primary fetch passes through unchanged")
        void primaryFailure() {
            StorageException cause = new StorageException("portfolio.getById", 4,
                                                          new RuntimeException("connection refused"));
            when(readRepository.getById(1L)).thenReturn(Mono.error(cause));

            StepVerifier.create(engine.computeSummary(1L))
                .expectErrorMatches(error -> error == cause)
                .verify();
        }
    }

    @Nested
    @DisplayName("computeSummaries()")
    class ComputeSummariesTests {

        @Test
        @DisplayName("one summary per matching portfolio, in storage order")
        void keepsOrder() {
            PortfolioFilter filter = PortfolioFilter.byOwner(7L);
            when(readRepository.getByPredicate(filter)).thenReturn(Flux.just(
                portfolio(1L, "Alpha"), portfolio(2L, "Beta")));
            when(readRepository.countByParent(1L)).thenReturn(Mono.just(1L));
            when(readRepository.getCollectionByParent(1L)).thenReturn(Flux.just(technology(5L, 1L, "Postgres", "10")));
            when(readRepository.countByParent(2L)).thenReturn(Mono.just(0L));
            when(readRepository.getCollectionByParent(2L)).thenReturn(Flux.empty());

            StepVerifier.create(engine.computeSummaries(filter).map(PortfolioSummary::name))
                .expectNext("Alpha", "Beta")
                .verifyComplete();
        }
    }
}

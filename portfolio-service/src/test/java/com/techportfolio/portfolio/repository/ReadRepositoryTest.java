package com.techportfolio.portfolio.repository;

import com.techportfolio.common.exception.StorageException;
import com.techportfolio.portfolio.config.PortfolioProperties;
import com.techportfolio.portfolio.model.Technology;
import com.techportfolio.portfolio.recovery.StorageRecovery;
import io.r2dbc.spi.R2dbcTransientResourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Duration;

import static com.techportfolio.portfolio.TestFixtures.technology;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReadRepositoryTest {

    @Mock private PortfolioRepository portfolioRepository;
    @Mock private TechnologyRepository technologyRepository;
    @Mock private R2dbcEntityTemplate template;

    private ReadRepository readRepository;

    @BeforeEach
    void setUp() {
        PortfolioProperties properties = new PortfolioProperties();
        properties.getStorage().setMaxRetries(1);
        properties.getStorage().setMinBackoff(Duration.ofMillis(1));
        properties.getStorage().setMaxBackoff(Duration.ofMillis(5));
        readRepository = new ReadRepository(portfolioRepository, technologyRepository, template,
                                            new StorageRecovery(properties));
    }

    private static Flux<Technology> resetAfterFirstRow(Technology first) {
        return Flux.concat(Flux.just(first), Flux.error(new R2dbcTransientResourceException("connection reset")));
    }

    @Test
    @DisplayName("connection lost mid-read → retried read yields each technology once")
    void midReadFailure_noDuplicateRows() {
        Technology postgres = technology(10L, 1L, "Postgres", "1200.00");
        when(technologyRepository.findActiveByPortfolioId(1L))
            .thenReturn(resetAfterFirstRow(postgres), Flux.just(postgres));

        StepVerifier.create(readRepository.getCollectionByParent(1L)
                .map(Technology::getAnnualCost)
                .reduce(BigDecimal.ZERO, BigDecimal::add))
            .assertNext(total -> assertThat(total).isEqualByComparingTo("1200.00"))
            .verifyComplete();

        verify(technologyRepository, times(2)).findActiveByPortfolioId(1L);
    }

    @Test
    @DisplayName("connection lost mid-read on every attempt → StorageException, no rows emitted")
    void midReadFailureExhausted() {
        Technology postgres = technology(10L, 1L, "Postgres", "1200.00");
        when(technologyRepository.findActiveByPortfolioId(1L))
            .thenReturn(resetAfterFirstRow(postgres), resetAfterFirstRow(postgres));

        StepVerifier.create(readRepository.getCollectionByParent(1L))
            .expectError(StorageException.class)
            .verify();
    }
}

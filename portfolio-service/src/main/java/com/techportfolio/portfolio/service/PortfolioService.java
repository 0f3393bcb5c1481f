package com.techportfolio.portfolio.service;

import com.techportfolio.common.event.ChangeEvent;
import com.techportfolio.common.event.ChangeKind;
import com.techportfolio.common.event.EntityType;
import com.techportfolio.common.exception.DuplicatePortfolioNameException;
import com.techportfolio.common.exception.ValidationException;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.publish.ChangeEventPublisher;
import com.techportfolio.common.trace.TraceContextUtil;
import com.techportfolio.portfolio.aggregation.AggregationEngine;
import com.techportfolio.portfolio.dto.AddTechnologyRequest;
import com.techportfolio.portfolio.dto.CreatePortfolioRequest;
import com.techportfolio.portfolio.dto.PortfolioFilter;
import com.techportfolio.portfolio.dto.UpdatePortfolioRequest;
import com.techportfolio.portfolio.dto.UpdateTechnologyRequest;
import com.techportfolio.portfolio.model.Portfolio;
import com.techportfolio.portfolio.model.PortfolioSummary;
import com.techportfolio.portfolio.model.Technology;
import com.techportfolio.portfolio.repository.ReadRepository;
import com.techportfolio.portfolio.stream.ChangeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Portfolio and technology use cases.
 *
 * <p>Every completed write is announced twice, after the row is stored: an in-process
 * signal to {@link ChangeNotifier} so live summaries refresh at once, and a
 * fire-and-forget {@link ChangeEvent} to the {@link ChangeEventPublisher}. Neither can
 * change the result returned to the caller.
 *
 * <p>"Not found" is an empty {@link Mono}; the web layer maps it to 404.
 */
@Service
public class PortfolioService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioService.class);

    private final ReadRepository readRepository;
    private final AggregationEngine aggregationEngine;
    private final ChangeNotifier changeNotifier;
    private final ChangeEventPublisher publisher;

    public PortfolioService(ReadRepository readRepository,
                            AggregationEngine aggregationEngine,
                            ChangeNotifier changeNotifier,
                            ChangeEventPublisher publisher) {
        this.readRepository    = readRepository;
        this.aggregationEngine = aggregationEngine;
        this.changeNotifier    = changeNotifier;
        this.publisher         = publisher;
    }

    // ── portfolios ──────────────────────────────────────────────────────────

    public Mono<Portfolio> createPortfolio(CreatePortfolioRequest request, Long ownerId) {
        String name = request.name().trim();
        return requireUniqueName(name)
            .then(Mono.defer(() -> {
                LocalDateTime now = LocalDateTime.now();
                Portfolio portfolio = new Portfolio();
                portfolio.setName(name);
                portfolio.setDescription(request.description());
                portfolio.setType(request.type());
                portfolio.setStatus(PortfolioStatus.ACTIVE);
                portfolio.setOwnerId(ownerId);
                portfolio.setOrganizationId(request.organizationId());
                portfolio.setIsActive(true);
                portfolio.setCreatedAt(now);
                portfolio.setUpdatedAt(now);
                return readRepository.savePortfolio(portfolio);
            }))
            .onErrorMap(DataIntegrityViolationException.class, e -> new DuplicatePortfolioNameException(name, e))
            .flatMap(saved -> announce(EntityType.PORTFOLIO, ChangeKind.CREATED, saved.getId(), saved.getId(), saved)
                .thenReturn(saved))
            .doOnNext(saved -> log.info("Portfolio created. portfolioId={} name={} ownerId={}",
                                        saved.getId(), saved.getName(), ownerId));
    }

    public Mono<Portfolio> getPortfolio(Long portfolioId) {
        return readRepository.getById(portfolioId);
    }

    public Mono<Portfolio> updatePortfolio(Long portfolioId, UpdatePortfolioRequest request) {
        return readRepository.getById(portfolioId)
            .flatMap(portfolio -> {
                String newName = request.name() != null ? request.name().trim() : null;
                boolean renamed = newName != null && !newName.equals(portfolio.getName());
                Mono<Void> nameCheck = renamed ? requireUniqueName(newName) : Mono.empty();
                Mono<Portfolio> saved = nameCheck.then(Mono.defer(() -> {
                    if (newName != null)               portfolio.setName(newName);
                    if (request.description() != null) portfolio.setDescription(request.description());
                    if (request.type() != null)        portfolio.setType(request.type());
                    if (request.status() != null)      portfolio.setStatus(request.status());
                    portfolio.setUpdatedAt(LocalDateTime.now());
                    return readRepository.savePortfolio(portfolio);
                }));
                // only a rename can collide with the active-name constraint
                return renamed
                    ? saved.onErrorMap(DataIntegrityViolationException.class,
                                       e -> new DuplicatePortfolioNameException(newName, e))
                    : saved;
            })
            .flatMap(saved -> announce(EntityType.PORTFOLIO, ChangeKind.UPDATED, saved.getId(), saved.getId(), saved)
                .thenReturn(saved));
    }

    /**
     * Logically deletes a portfolio. Refused while it still holds active technologies.
     *
     * @return the deactivated portfolio, or empty when it does not exist
     */
    public Mono<Portfolio> deletePortfolio(Long portfolioId) {
        return readRepository.getById(portfolioId)
            .flatMap(portfolio -> readRepository.countByParent(portfolioId)
                .flatMap(active -> {
                    if (active > 0) {
                        return Mono.error(new ValidationException(
                            "Portfolio " + portfolioId + " still has " + active + " active technologies", true));
                    }
                    portfolio.setIsActive(false);
                    portfolio.setStatus(PortfolioStatus.INACTIVE);
                    portfolio.setUpdatedAt(LocalDateTime.now());
                    return readRepository.savePortfolio(portfolio);
                }))
            .flatMap(saved -> announce(EntityType.PORTFOLIO, ChangeKind.DELETED, saved.getId(), saved.getId(), saved)
                .thenReturn(saved))
            .doOnNext(saved -> log.info("Portfolio deactivated. portfolioId={}", portfolioId));
    }

    // ── summaries ───────────────────────────────────────────────────────────

    public Mono<PortfolioSummary> getSummary(Long portfolioId) {
        return aggregationEngine.computeSummary(portfolioId);
    }

    public Flux<PortfolioSummary> listSummaries(PortfolioFilter filter) {
        return aggregationEngine.computeSummaries(filter);
    }

    // ── technologies ────────────────────────────────────────────────────────

    /**
     * @return the stored technology, or empty when the portfolio does not exist
     */
    public Mono<Technology> addTechnology(Long portfolioId, AddTechnologyRequest request) {
        return readRepository.getById(portfolioId)
            .flatMap(portfolio -> {
                LocalDateTime now = LocalDateTime.now();
                Technology technology = new Technology();
                technology.setPortfolioId(portfolioId);
                technology.setName(request.name().trim());
                technology.setDescription(request.description());
                technology.setCategory(request.category());
                technology.setVersion(request.version());
                technology.setType(request.type());
                technology.setMaturityLevel(request.maturityLevel());
                technology.setRiskLevel(request.riskLevel());
                technology.setAnnualCost(request.annualCost());
                technology.setLicenseCost(request.licenseCost());
                technology.setMaintenanceCost(request.maintenanceCost());
                technology.setVendorName(request.vendorName());
                technology.setVendorContact(request.vendorContact());
                technology.setSupportContractExpiry(request.supportContractExpiry());
                technology.setIsActive(true);
                technology.setCreatedAt(now);
                technology.setUpdatedAt(now);
                return readRepository.saveTechnology(technology);
            })
            .flatMap(saved -> announce(EntityType.TECHNOLOGY, ChangeKind.CREATED, saved.getId(), portfolioId, saved)
                .thenReturn(saved))
            .doOnNext(saved -> log.info("Technology added. portfolioId={} technologyId={} name={}",
                                        portfolioId, saved.getId(), saved.getName()));
    }

    public Mono<Technology> getTechnology(Long technologyId) {
        return readRepository.getTechnologyById(technologyId);
    }

    public Flux<Technology> getTechnologies(Long portfolioId) {
        return readRepository.getCollectionByParent(portfolioId);
    }

    public Mono<Technology> updateTechnology(Long technologyId, UpdateTechnologyRequest request) {
        return readRepository.getTechnologyById(technologyId)
            .flatMap(technology -> {
                if (request.name() != null)            technology.setName(request.name().trim());
                if (request.description() != null)     technology.setDescription(request.description());
                if (request.category() != null)        technology.setCategory(request.category());
                if (request.version() != null)         technology.setVersion(request.version());
                if (request.type() != null)            technology.setType(request.type());
                if (request.maturityLevel() != null)   technology.setMaturityLevel(request.maturityLevel());
                if (request.riskLevel() != null)       technology.setRiskLevel(request.riskLevel());
                if (request.annualCost() != null)      technology.setAnnualCost(request.annualCost());
                if (request.licenseCost() != null)     technology.setLicenseCost(request.licenseCost());
                if (request.maintenanceCost() != null) technology.setMaintenanceCost(request.maintenanceCost());
                if (request.vendorName() != null)      technology.setVendorName(request.vendorName());
                if (request.vendorContact() != null)   technology.setVendorContact(request.vendorContact());
                if (request.supportContractExpiry() != null) {
                    technology.setSupportContractExpiry(request.supportContractExpiry());
                }
                technology.setUpdatedAt(LocalDateTime.now());
                return readRepository.saveTechnology(technology);
            })
            .flatMap(saved -> announce(EntityType.TECHNOLOGY, ChangeKind.UPDATED, saved.getId(),
                                       saved.getPortfolioId(), saved)
                .thenReturn(saved));
    }

    /**
     * Logically deletes a technology of the given portfolio.
     *
     * @return the deactivated technology, or empty when it does not exist or belongs
     *         to another portfolio
     */
    public Mono<Technology> removeTechnology(Long portfolioId, Long technologyId) {
        return readRepository.getTechnologyById(technologyId)
            .filter(technology -> portfolioId.equals(technology.getPortfolioId()))
            .flatMap(technology -> {
                technology.setIsActive(false);
                technology.setUpdatedAt(LocalDateTime.now());
                return readRepository.saveTechnology(technology);
            })
            .flatMap(saved -> announce(EntityType.TECHNOLOGY, ChangeKind.DELETED, saved.getId(), portfolioId, saved)
                .thenReturn(saved))
            .doOnNext(saved -> log.info("Technology removed. portfolioId={} technologyId={}",
                                        portfolioId, technologyId));
    }

    // ── internals ───────────────────────────────────────────────────────────

    private Mono<Void> requireUniqueName(String name) {
        return readRepository.existsActiveByName(name)
            .flatMap(exists -> exists
                ? Mono.<Void>error(new DuplicatePortfolioNameException(name))
                : Mono.empty());
    }

    private Mono<Void> announce(EntityType entityType, ChangeKind changeKind,
                                Long entityId, Long portfolioId, Object snapshot) {
        return Mono.deferContextual(ctx -> {
            changeNotifier.portfolioChanged(portfolioId);
            publisher.dispatch(ChangeEvent.of(entityType, changeKind, entityId, portfolioId, snapshot,
                                              TraceContextUtil.getTraceId(ctx)));
            return Mono.empty();
        });
    }
}

package com.techportfolio.portfolio.controller;

import com.techportfolio.common.exception.OverflowException;
import com.techportfolio.common.exception.PortfolioException;
import com.techportfolio.common.model.PortfolioStatus;
import com.techportfolio.common.model.PortfolioType;
import com.techportfolio.common.trace.TraceContextUtil;
import com.techportfolio.portfolio.dto.AddTechnologyRequest;
import com.techportfolio.portfolio.dto.CreatePortfolioRequest;
import com.techportfolio.portfolio.dto.PortfolioFilter;
import com.techportfolio.portfolio.dto.StreamErrorFrame;
import com.techportfolio.portfolio.dto.UpdatePortfolioRequest;
import com.techportfolio.portfolio.dto.UpdateTechnologyRequest;
import com.techportfolio.portfolio.model.Portfolio;
import com.techportfolio.portfolio.model.PortfolioSummary;
import com.techportfolio.portfolio.model.Technology;
import com.techportfolio.portfolio.service.PortfolioService;
import com.techportfolio.portfolio.stream.ChangeStream;
import com.techportfolio.portfolio.stream.SummarySubscription;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * REST and SSE surface of the portfolio service.
 *
 * <p>The caller is resolved upstream; {@code X-User-Id} and {@code X-User-Roles} are
 * trusted as sent.
 */
@RestController
@RequestMapping("/api/v1/portfolios")
public class PortfolioController {

    private static final Logger log = LoggerFactory.getLogger(PortfolioController.class);

    static final String USER_ID_HEADER    = "X-User-Id";
    static final String USER_ROLES_HEADER = "X-User-Roles";

    private final PortfolioService portfolioService;
    private final ChangeStream changeStream;

    public PortfolioController(PortfolioService portfolioService, ChangeStream changeStream) {
        this.portfolioService = portfolioService;
        this.changeStream     = changeStream;
    }

    @GetMapping("/health")
    public Mono<String> health() {
        return Mono.just("OK");
    }

    // ── portfolios ──────────────────────────────────────────────────────────

    @PostMapping
    public Mono<ResponseEntity<Portfolio>> create(
            @Valid @RequestBody CreatePortfolioRequest request,
            @RequestHeader(USER_ID_HEADER) Long userId,
            @RequestHeader(value = USER_ROLES_HEADER, required = false) String roles,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Create portfolio requested. name={} type={} userId={} roles={} traceId={}",
                 request.name(), request.type(), userId, roles, traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.createPortfolio(request, userId)
                .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved)),
            traceId);
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<Portfolio>> get(@PathVariable Long id) {
        return portfolioService.getPortfolio(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<Portfolio>> update(
            @PathVariable Long id,
            @Valid @RequestBody UpdatePortfolioRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Update portfolio requested. portfolioId={} traceId={}", id, traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.updatePortfolio(id, request)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build()),
            traceId);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(
            @PathVariable Long id,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Delete portfolio requested. portfolioId={} traceId={}", id, traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.deletePortfolio(id)
                .map(deleted -> ResponseEntity.noContent().<Void>build())
                .defaultIfEmpty(ResponseEntity.notFound().build()),
            traceId);
    }

    @GetMapping
    public Flux<PortfolioSummary> list(
            @RequestParam(required = false) PortfolioType type,
            @RequestParam(required = false) PortfolioStatus status,
            @RequestParam(required = false) Long organizationId) {
        return portfolioService.listSummaries(new PortfolioFilter(type, status, organizationId, null, null));
    }

    @GetMapping("/my")
    public Flux<PortfolioSummary> mine(@RequestHeader(USER_ID_HEADER) Long userId) {
        return portfolioService.listSummaries(PortfolioFilter.byOwner(userId));
    }

    @GetMapping("/search")
    public Flux<PortfolioSummary> search(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) PortfolioType type,
            @RequestParam(required = false) PortfolioStatus status,
            @RequestParam(required = false) Long organizationId) {
        log.info("Portfolio search requested. name={} type={} status={} organizationId={}",
                 name, type, status, organizationId);
        return portfolioService.listSummaries(new PortfolioFilter(type, status, organizationId, null, name));
    }

    @GetMapping("/{id}/summary")
    public Mono<ResponseEntity<PortfolioSummary>> summary(@PathVariable Long id) {
        return portfolioService.getSummary(id)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Live summary frames ({@code event: summary}). A subscriber that overflows its
     * buffer receives one {@code event: error} frame with status {@code OVERFLOW} and
     * the stream ends; other subscribers are unaffected.
     */
    @GetMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<ResponseEntity<Flux<ServerSentEvent<Object>>>> stream(
            @PathVariable Long id,
            @RequestParam(required = false) String policy) {
        return Mono.fromCallable(() -> changeStream.parsePolicy(policy))
            .flatMap(parsed -> portfolioService.getPortfolio(id)
                .map(portfolio -> {
                    log.info("SSE summary stream client connected. portfolioId={} policy={}", id, parsed);
                    SummarySubscription subscription = changeStream.subscribe(id, parsed);
                    Flux<ServerSentEvent<Object>> events = subscription.summaries()
                        .map(summary -> ServerSentEvent.<Object>builder()
                            .event("summary")
                            .data(summary)
                            .build())
                        .onErrorResume(err -> Flux.just(errorEvent(id, err)))
                        .doFinally(signal -> subscription.cancel());
                    return ResponseEntity.ok().contentType(MediaType.TEXT_EVENT_STREAM).body(events);
                }))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    // ── technologies ────────────────────────────────────────────────────────

    @PostMapping("/{id}/technologies")
    public Mono<ResponseEntity<Technology>> addTechnology(
            @PathVariable Long id,
            @Valid @RequestBody AddTechnologyRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Add technology requested. portfolioId={} name={} traceId={}", id, request.name(), traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.addTechnology(id, request)
                .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved))
                .defaultIfEmpty(ResponseEntity.notFound().build()),
            traceId);
    }

    @GetMapping("/{id}/technologies")
    public Flux<Technology> technologies(@PathVariable Long id) {
        return portfolioService.getTechnologies(id);
    }

    @DeleteMapping("/{id}/technologies/{techId}")
    public Mono<ResponseEntity<Void>> removeTechnology(
            @PathVariable Long id,
            @PathVariable Long techId,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Remove technology requested. portfolioId={} technologyId={} traceId={}", id, techId, traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.removeTechnology(id, techId)
                .map(removed -> ResponseEntity.noContent().<Void>build())
                .defaultIfEmpty(ResponseEntity.notFound().build()),
            traceId);
    }

    @GetMapping("/technologies/{techId}")
    public Mono<ResponseEntity<Technology>> technology(@PathVariable Long techId) {
        return portfolioService.getTechnology(techId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @PutMapping("/technologies/{techId}")
    public Mono<ResponseEntity<Technology>> updateTechnology(
            @PathVariable Long techId,
            @Valid @RequestBody UpdateTechnologyRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceHeader) {
        String traceId = TraceContextUtil.resolve(traceHeader);
        log.info("Update technology requested. technologyId={} traceId={}", techId, traceId);
        return TraceContextUtil.withTraceId(
            portfolioService.updateTechnology(techId, request)
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build()),
            traceId);
    }

    private static ServerSentEvent<Object> errorEvent(Long portfolioId, Throwable err) {
        StreamErrorFrame frame;
        if (err instanceof OverflowException overflow) {
            log.warn("SSE summary stream overflowed. portfolioId={} {}", portfolioId, overflow.getMessage());
            frame = new StreamErrorFrame(portfolioId, overflow.getKind().name(), overflow.getMessage());
        } else if (err instanceof PortfolioException failure) {
            log.error("SSE summary stream failed. portfolioId={}", portfolioId, failure);
            frame = new StreamErrorFrame(portfolioId, failure.getKind().name(), "Summary evaluation failed");
        } else {
            log.error("SSE summary stream failed. portfolioId={}", portfolioId, err);
            frame = new StreamErrorFrame(portfolioId, "INTERNAL", "Summary evaluation failed");
        }
        return ServerSentEvent.<Object>builder()
            .event("error")
            .data(frame)
            .build();
    }
}

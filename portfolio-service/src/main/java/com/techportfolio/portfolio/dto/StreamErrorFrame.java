package com.techportfolio.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal frame of a live summary stream that ended because of a failure.
 * {@code status} is {@code OVERFLOW} when the subscriber fell behind its buffer.
 */
public record StreamErrorFrame(
    @JsonProperty("portfolioId") Long portfolioId,
    @JsonProperty("status")      String status,
    @JsonProperty("message")     String message
) {}

package com.techportfolio.portfolio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record ErrorResponse(
    @JsonProperty("status")    int status,
    @JsonProperty("error")     String error,
    @JsonProperty("message")   String message,
    @JsonProperty("path")      String path,
    @JsonProperty("timestamp") LocalDateTime timestamp
) {}

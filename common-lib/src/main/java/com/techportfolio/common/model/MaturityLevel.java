package com.techportfolio.common.model;

public enum MaturityLevel {
    EMERGING,
    GROWING,
    MATURE,
    DECLINING,
    LEGACY
}

package com.techportfolio.common.event;

public enum EntityType {
    PORTFOLIO,
    TECHNOLOGY
}

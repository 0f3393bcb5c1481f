package com.techportfolio.common.model;

public enum TechnologyType {
    SOFTWARE,
    HARDWARE,
    INFRASTRUCTURE,
    SERVICE,
    PLATFORM,
    TOOL,
    FRAMEWORK,
    LIBRARY
}

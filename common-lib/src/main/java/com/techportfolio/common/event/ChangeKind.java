package com.techportfolio.common.event;

public enum ChangeKind {
    CREATED,
    UPDATED,
    DELETED
}

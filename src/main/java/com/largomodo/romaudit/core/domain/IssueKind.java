package com.largomodo.romaudit.core.domain;

public enum IssueKind {
    CATALOG_INTEGRITY,
    UNRESOLVED_ANCESTOR,
    UNREADABLE
}

package com.quakesentinel.core.model;

public enum EewIssueKind {
    FORECAST,
    WARNING
}

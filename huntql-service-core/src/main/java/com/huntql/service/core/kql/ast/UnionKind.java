package com.huntql.service.core.kql.ast;

public enum UnionKind {
    ALL,
    DISTINCT
}

package com.llestrade.core.model;

public enum JobKind {
    CONVERT,
    MAP,
    REDUCE
}

package com.tenacy.rootpulse.collector;

public enum CollectorKind {
    ERROR,
    LATENCY
}

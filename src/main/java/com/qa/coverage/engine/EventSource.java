package com.qa.coverage.engine;

public enum EventSource {
    MANUAL,
    AUTOMATED,
    NONE
}

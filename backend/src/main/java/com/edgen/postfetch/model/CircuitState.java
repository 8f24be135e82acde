package com.edgen.postfetch.model;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}

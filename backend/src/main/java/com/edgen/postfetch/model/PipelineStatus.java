package com.edgen.postfetch.model;

public enum PipelineStatus {
    OPERATIONAL,
    DEGRADED,
    UNAVAILABLE
}

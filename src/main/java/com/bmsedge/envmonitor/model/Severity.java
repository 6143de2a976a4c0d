package com.bmsedge.envmonitor.model;

public enum Severity {
    INFO,
    WARNING,
    CRITICAL
}

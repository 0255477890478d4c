package com.myorg.scf.sidecar.config;

public enum LogLevel {
    TRACE, DEBUG, INFO, WARNING, ERROR, CRITICAL
}

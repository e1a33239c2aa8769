package com.orgchart.resolution.diagnostics;

public enum Severity {
    INFO,
    WARN,
    ERROR
}

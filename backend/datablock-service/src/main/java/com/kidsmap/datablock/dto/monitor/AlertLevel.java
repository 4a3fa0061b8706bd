package com.kidsmap.datablock.dto.monitor;

public enum AlertLevel {
    WARNING,
    CRITICAL
}

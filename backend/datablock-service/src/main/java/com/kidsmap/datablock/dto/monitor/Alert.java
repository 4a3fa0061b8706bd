package com.kidsmap.datablock.dto.monitor;

public record Alert(AlertLevel level, String code, String message) {
}

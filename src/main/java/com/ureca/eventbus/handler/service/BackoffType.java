package com.ureca.eventbus.handler.service;

public enum BackoffType {
    FIXED,       // 매번 retry_delay
    EXPONENTIAL  // retry_delay * multiplier^(retry_count - 1), max-delay 상한
}

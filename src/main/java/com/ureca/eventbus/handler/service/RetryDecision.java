package com.ureca.eventbus.handler.service;

import com.ureca.eventbus.handler.entity.HandlerStatus;

import java.time.LocalDateTime;

/**
 * 실패 후 핸들러 기록 처리 결정
 *
 * @param status         PENDING (재시도 예약) 또는 FAILED
 * @param nextAttemptAt  재시도 가능 시각 (FAILED 면 null)
 * @param retryIncrement retry_count 증가분
 */
public record RetryDecision(
        HandlerStatus status,
        LocalDateTime nextAttemptAt,
        int retryIncrement
) {
    public static RetryDecision retryAt(LocalDateTime nextAttemptAt) {
        return new RetryDecision(HandlerStatus.PENDING, nextAttemptAt, 1);
    }

    public static RetryDecision exhausted() {
        return new RetryDecision(HandlerStatus.FAILED, null, 1);
    }

    // 재시도 불가 실패는 재시도 예산을 쓰지 않음
    public static RetryDecision permanent() {
        return new RetryDecision(HandlerStatus.FAILED, null, 0);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

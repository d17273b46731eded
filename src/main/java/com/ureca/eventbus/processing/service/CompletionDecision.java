package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.event.entity.EventStatus;

/**
 * 이벤트 완료 판정 결과
 *
 * @param status       PROCESSING 이면 아직 진행 중
 * @param errorMessage FAILED 일 때 대표 에러
 */
public record CompletionDecision(
        EventStatus status,
        String errorMessage
) {
    public static CompletionDecision inProgress() {
        return new CompletionDecision(EventStatus.PROCESSING, null);
    }

    public static CompletionDecision completed() {
        return new CompletionDecision(EventStatus.COMPLETED, null);
    }

    public static CompletionDecision failed(String errorMessage) {
        return new CompletionDecision(EventStatus.FAILED, errorMessage);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

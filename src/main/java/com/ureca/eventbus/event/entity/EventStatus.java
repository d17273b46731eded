package com.ureca.eventbus.event.entity;

public enum EventStatus {
    PENDING,     // 저장됨 (전달 대기)
    PROCESSING,  // 워커가 claim 함 (일부 구독 처리 중)
    COMPLETED,   // 모든 구독 처리 성공
    FAILED;      // 모든 구독이 종료됐고 하나 이상 실패

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    // 상태는 앞으로만 진행 (PENDING -> PROCESSING -> COMPLETED | FAILED)
    public boolean canTransitionTo(EventStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case PROCESSING -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }
}

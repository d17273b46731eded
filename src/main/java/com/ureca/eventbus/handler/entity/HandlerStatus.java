package com.ureca.eventbus.handler.entity;

public enum HandlerStatus {
    PENDING,    // 시도 전, 시도 중, 재시도 대기
    COMPLETED,  // 성공 (종료)
    FAILED;     // 재시도 소진 또는 재시도 불가 실패 (종료)

    public boolean isTerminal() {
        return this != PENDING;
    }
}

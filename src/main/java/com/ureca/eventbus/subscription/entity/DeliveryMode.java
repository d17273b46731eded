package com.ureca.eventbus.subscription.entity;

public enum DeliveryMode {
    SYNC,  // 처리 워커가 결과를 기다림
    ASYNC  // 전달 Executor 에 넘기고 진행, 완료는 결과 기록 시점에 판정
}

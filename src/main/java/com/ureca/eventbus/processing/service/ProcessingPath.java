package com.ureca.eventbus.processing.service;

/**
 * 이벤트 처리 경로
 * LIVE: NOTIFY 신호로 즉시 처리, 첫 시도만 수행
 * RECONCILE: 주기적 재조정, 첫 시도와 재시도 모두 수행
 */
public enum ProcessingPath {
    LIVE,
    RECONCILE
}

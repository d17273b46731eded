package com.ureca.eventbus.dispatch;

import com.ureca.eventbus.event.dto.EventMessage;

/**
 * 모듈이 등록하는 로컬 핸들러
 * <p>
 * 정상 반환은 성공, PermanentHandlerException 은 재시도 없는 실패,
 * 그 외 예외와 타임아웃은 재시도 대상 실패로 기록된다
 */
@FunctionalInterface
public interface EventHandler {

    void handle(EventMessage message) throws Exception;
}

package com.ureca.eventbus.event.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import static com.ureca.eventbus.common.BaseCode.INVALID_EVENT_TYPE;

public class InvalidEventTypeException extends BusinessException {

    public InvalidEventTypeException(String eventType) {
        super(INVALID_EVENT_TYPE, "이벤트 타입 형식 오류 (점으로 구분된 비어있지 않은 세그먼트 필요): " + eventType);
    }
}

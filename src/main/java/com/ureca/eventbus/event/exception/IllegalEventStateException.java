package com.ureca.eventbus.event.exception;

import com.ureca.eventbus.common.exception.BusinessException;
import com.ureca.eventbus.event.entity.EventStatus;

import java.util.UUID;

import static com.ureca.eventbus.common.BaseCode.ILLEGAL_EVENT_STATE;

public class IllegalEventStateException extends BusinessException {

    public IllegalEventStateException(UUID eventId, EventStatus current, EventStatus next) {
        super(ILLEGAL_EVENT_STATE,
                String.format("이벤트 상태 역행 불가. eventId: %s, %s -> %s", eventId, current, next));
    }
}

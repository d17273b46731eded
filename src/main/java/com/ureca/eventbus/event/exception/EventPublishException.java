package com.ureca.eventbus.event.exception;

import com.ureca.eventbus.common.exception.InternalServerException;

import static com.ureca.eventbus.common.BaseCode.EVENT_PUBLISH_FAILED;

/**
 * 이벤트 저장(커밋) 실패
 * 이벤트는 존재하지 않으므로 호출자가 publish 를 다시 호출해야 한다
 */
public class EventPublishException extends InternalServerException {

    public EventPublishException(String eventType, Throwable cause) {
        super(EVENT_PUBLISH_FAILED, "이벤트 저장 실패. eventType: " + eventType, cause);
    }
}

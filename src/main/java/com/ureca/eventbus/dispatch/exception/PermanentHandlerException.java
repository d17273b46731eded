package com.ureca.eventbus.dispatch.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import static com.ureca.eventbus.common.BaseCode.HANDLER_PERMANENT_FAILURE;

/**
 * 핸들러가 재시도해도 소용없는 실패를 알릴 때 던진다 (예: payload 검증 실패)
 * 해당 구독의 핸들러 기록만 즉시 FAILED 가 된다
 */
public class PermanentHandlerException extends BusinessException {

    public PermanentHandlerException(String message) {
        super(HANDLER_PERMANENT_FAILURE, message);
    }
}

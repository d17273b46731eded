package com.ureca.eventbus.subscription.exception;

import com.ureca.eventbus.common.exception.BusinessException;

import static com.ureca.eventbus.common.BaseCode.DUPLICATE_HANDLER;

/**
 * 같은 프로세스에 같은 handler_name 으로 다른 핸들러를 등록하려 할 때
 */
public class DuplicateHandlerException extends BusinessException {

    public DuplicateHandlerException(String handlerName) {
        super(DUPLICATE_HANDLER, "이미 등록된 핸들러. handlerName: " + handlerName);
    }
}

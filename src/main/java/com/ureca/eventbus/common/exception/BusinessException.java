package com.ureca.eventbus.common.exception;

import com.ureca.eventbus.common.BaseCode;

/**
 * 호출자의 입력이나 상태로 인해 발생하는 복구 가능한 예외
 * 상태 코드는 BaseCode 를 따른다
 */
public class BusinessException extends BaseCustomException {

    public BusinessException(BaseCode baseCode) {
        super(baseCode);
    }

    public BusinessException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }
}

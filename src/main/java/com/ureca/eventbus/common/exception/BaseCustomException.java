package com.ureca.eventbus.common.exception;

import com.ureca.eventbus.common.BaseCode;
import lombok.Getter;

/**
 * 이벤트 버스 예외 최상위 타입
 * BaseCode 로 응답 코드와 HTTP 상태를 함께 전달
 */
@Getter
public abstract class BaseCustomException extends RuntimeException {
    private final BaseCode baseCode;

    protected BaseCustomException(BaseCode baseCode) {
        super(baseCode.getMessage());
        this.baseCode = baseCode;
    }

    protected BaseCustomException(BaseCode baseCode, String customMessage) {
        super(customMessage);
        this.baseCode = baseCode;
    }

    // 원인 같이 받음
    protected BaseCustomException(BaseCode baseCode, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.baseCode = baseCode;
    }
}

package com.ureca.eventbus.common.exception;

import com.ureca.eventbus.common.BaseCode;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 저장소 장애 등 호출자가 해결할 수 없는 예외
 * 500 상태코드 반환
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class InternalServerException extends BaseCustomException {

    public InternalServerException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public InternalServerException(BaseCode baseCode, String message, Throwable cause) {
        super(baseCode, message, cause);
    }
}

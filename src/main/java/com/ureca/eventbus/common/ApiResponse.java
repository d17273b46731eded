package com.ureca.eventbus.common;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 공통 API 응답 본문
 *
 * @param code    BaseCode 의 코드 문자열
 * @param status  HTTP 상태 코드
 * @param message 응답 메시지
 * @param data    응답 데이터 (없으면 생략)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String code,
        int status,
        String message,
        T data
) {
    public static <T> ApiResponse<T> of(BaseCode baseCode, T data) {
        return new ApiResponse<>(
                baseCode.getCode(),
                baseCode.getStatus().value(),
                baseCode.getMessage(),
                data
        );
    }

    public static ApiResponse<?> error(BaseCode baseCode, String message) {
        return new ApiResponse<>(
                baseCode.getCode(),
                baseCode.getStatus().value(),
                message,
                null
        );
    }
}

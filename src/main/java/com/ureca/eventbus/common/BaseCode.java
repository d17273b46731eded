package com.ureca.eventbus.common;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum BaseCode {

    // common
    STATUS_OK("STATUS_OK_200", HttpStatus.OK, "서버가 정상적으로 동작 중입니다."),
    INVALID_INPUT("INVALID_INPUT_400", HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR_500", HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다."),

    // 이벤트 발행
    EVENT_PUBLISH_SUCCESS("EVENT_PUBLISH_SUCCESS_201", HttpStatus.CREATED, "이벤트가 발행되었습니다."),
    EVENT_PUBLISH_FAILED("EVENT_PUBLISH_FAILED_500", HttpStatus.INTERNAL_SERVER_ERROR, "이벤트 저장에 실패했습니다."),
    INVALID_EVENT_TYPE("INVALID_EVENT_TYPE_400", HttpStatus.BAD_REQUEST, "이벤트 타입 형식이 올바르지 않습니다."),
    INVALID_EVENT_REQUEST("INVALID_EVENT_REQUEST_400", HttpStatus.BAD_REQUEST, "이벤트 발행 요청이 올바르지 않습니다."),
    ILLEGAL_EVENT_STATE("ILLEGAL_EVENT_STATE_409", HttpStatus.CONFLICT, "허용되지 않는 이벤트 상태 전이입니다."),

    // 이벤트 조회
    EVENT_FOUND("EVENT_FOUND_200", HttpStatus.OK, "이벤트 조회에 성공했습니다."),
    EVENT_NOT_FOUND("EVENT_NOT_FOUND_404", HttpStatus.NOT_FOUND, "이벤트를 찾을 수 없습니다."),

    // 구독
    SUBSCRIPTION_LIST_SUCCESS("SUBSCRIPTION_LIST_SUCCESS_200", HttpStatus.OK, "구독 목록 조회에 성공했습니다."),
    SUBSCRIPTION_ACTIVATED("SUBSCRIPTION_ACTIVATED_200", HttpStatus.OK, "구독이 활성화되었습니다."),
    SUBSCRIPTION_DEACTIVATED("SUBSCRIPTION_DEACTIVATED_200", HttpStatus.OK, "구독이 비활성화되었습니다."),
    SUBSCRIPTION_NOT_FOUND("SUBSCRIPTION_NOT_FOUND_404", HttpStatus.NOT_FOUND, "구독을 찾을 수 없습니다."),
    INVALID_SUBSCRIPTION_PATTERN("INVALID_SUBSCRIPTION_PATTERN_400", HttpStatus.BAD_REQUEST, "구독 패턴 형식이 올바르지 않습니다."),
    DUPLICATE_HANDLER("DUPLICATE_HANDLER_409", HttpStatus.CONFLICT, "이미 등록된 핸들러 이름입니다."),

    // 핸들러 처리
    HANDLER_PERMANENT_FAILURE("HANDLER_PERMANENT_FAILURE_422", HttpStatus.UNPROCESSABLE_ENTITY, "재시도할 수 없는 핸들러 오류입니다.");

    private final String code;
    private final HttpStatus status;
    private final String message;
}

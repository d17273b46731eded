package com.ureca.eventbus.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

// 원격 구독 콜백 응답 (success 와 선택적 error 만 해석)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteDispatchResponse(
        boolean success,
        String error
) {
}

package com.ureca.eventbus.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ureca.eventbus.event.entity.Event;

import java.util.Map;
import java.util.UUID;

// 원격 구독 콜백 요청 본문
public record RemoteDispatchRequest(
        @JsonProperty("event_id") UUID eventId,
        @JsonProperty("event_type") String eventType,
        Map<String, Object> payload,
        @JsonProperty("tenant_id") String tenantId
) {
    public static RemoteDispatchRequest from(Event event) {
        return new RemoteDispatchRequest(
                event.getId(),
                event.getEventType(),
                event.getPayload(),
                event.getTenantId()
        );
    }
}

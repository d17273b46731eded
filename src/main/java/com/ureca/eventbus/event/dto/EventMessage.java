package com.ureca.eventbus.event.dto;

import com.ureca.eventbus.event.entity.Event;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * 핸들러에 전달되는 이벤트 뷰 (엔티티 대신 불변 레코드)
 */
public record EventMessage(
        UUID eventId,
        String eventType,
        String eventSource,
        Map<String, Object> payload,
        String tenantId,
        String companyId,
        String userId,
        LocalDateTime createdAt
) {
    public static EventMessage from(Event event) {
        return new EventMessage(
                event.getId(),
                event.getEventType(),
                event.getEventSource(),
                event.getPayload() == null ? Map.of() : Map.copyOf(event.getPayload()),
                event.getTenantId(),
                event.getCompanyId(),
                event.getUserId(),
                event.getCreatedAt()
        );
    }
}

package com.ureca.eventbus.event.dto;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.entity.EventStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 이벤트 상세 조회 응답 (핸들러 기록 포함)
 */
public record EventDetailResponse(
        UUID id,
        String eventType,
        String eventSource,
        Map<String, Object> payload,
        String tenantId,
        String companyId,
        String userId,
        EventStatus status,
        int retryCount,
        int maxRetries,
        LocalDateTime createdAt,
        LocalDateTime processedAt,
        LocalDateTime expiresAt,
        String errorMessage,
        List<HandlerRecordResponse> handlers
) {
    public static EventDetailResponse of(Event event, List<HandlerRecordResponse> handlers) {
        return new EventDetailResponse(
                event.getId(),
                event.getEventType(),
                event.getEventSource(),
                event.getPayload(),
                event.getTenantId(),
                event.getCompanyId(),
                event.getUserId(),
                event.getStatus(),
                event.getRetryCount(),
                event.getMaxRetries(),
                event.getCreatedAt(),
                event.getProcessedAt(),
                event.getExpiresAt(),
                event.getErrorMessage(),
                handlers
        );
    }
}

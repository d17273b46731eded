package com.ureca.eventbus.event.dto;

import lombok.Builder;

import java.time.Duration;
import java.util.Map;

/**
 * 발행할 이벤트 한 건
 * source, ttl, maxRetries 가 null 이면 설정 기본값 사용
 */
@Builder
public record EventDraft(
        String eventType,
        Map<String, Object> payload,
        String tenantId,
        String companyId,
        String userId,
        String source,
        Duration ttl,
        Integer maxRetries
) {
    public EventDraft withRouting(String tenantId, String source) {
        return new EventDraft(eventType, payload,
                this.tenantId != null ? this.tenantId : tenantId,
                companyId, userId,
                this.source != null ? this.source : source,
                ttl, maxRetries);
    }
}

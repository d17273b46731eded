package com.ureca.eventbus.event.signal;

import java.util.UUID;

/**
 * 이벤트 저장 후 커밋되면 NOTIFY 를 보내기 위한 스프링 이벤트
 */
public record EventPublishedSignal(
        UUID eventId,
        String eventType,
        String category
) {
}

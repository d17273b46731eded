package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.event.entity.Event;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * NOTIFY 신호 처리 (실시간 경로)
 * <p>
 * 신호 payload 는 이벤트 ID
 * claim 에 실패하면 다른 워커나 재조정 경로가 처리 중이므로 건너뛴다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiveEventProcessor {

    private final EventClaimService claimService;
    private final EventDispatchProcessor dispatchProcessor;
    private final MeterRegistry meterRegistry;

    public void onSignal(String payload) {
        UUID eventId;
        try {
            eventId = UUID.fromString(payload);
        } catch (IllegalArgumentException e) {
            log.warn("[Live] 잘못된 신호 payload 무시. payload: {}", payload);
            return;
        }

        Optional<Event> claimed = claimService.claim(eventId);
        if (claimed.isEmpty()) {
            Counter.builder("event_bus_claim_conflict_total")
                    .tag("path", "live")
                    .register(meterRegistry).increment();
            log.debug("[Live] claim 실패, 건너뜀. eventId: {}", eventId);
            return;
        }

        CompletionDecision decision = dispatchProcessor.process(claimed.get(), ProcessingPath.LIVE);

        Counter.builder("event_bus_events_processed_total")
                .tag("path", "live")
                .tag("status", decision.status().name())
                .register(meterRegistry).increment();
    }
}

package com.ureca.eventbus.processing.scheduler;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.processing.service.CompletionDecision;
import com.ureca.eventbus.processing.service.EventClaimService;
import com.ureca.eventbus.processing.service.EventDispatchProcessor;
import com.ureca.eventbus.processing.service.ProcessingPath;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 재조정 스케줄러 (실시간 경로 백업)
 * 1. 신호 유실, 리스너 중단으로 처리되지 않은 PENDING 이벤트
 * 2. 재시도 시각이 지난 핸들러 기록이 있는 PROCESSING 이벤트
 * 3. 워커 장애로 임대가 만료된 이벤트
 * <p>
 * 인스턴스마다 실행되며 SKIP LOCKED claim 으로 서로 다른 이벤트를 가져간다
 * 저장소 장애가 이어지면 실행 간격을 지수적으로 늘린다
 */
@Slf4j
@Component
public class EventReconciliationScheduler {

    private final EventClaimService claimService;
    private final EventDispatchProcessor dispatchProcessor;
    private final MeterRegistry meterRegistry;

    private final int batchSize;
    private final long fixedDelayMs;
    private final long maxBackoffMs;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);

    private int consecutiveFailures;
    private long backoffUntilMs;

    public EventReconciliationScheduler(
            EventClaimService claimService,
            EventDispatchProcessor dispatchProcessor,
            MeterRegistry meterRegistry,
            EventBusProperties properties,
            @Value("${eventbus.reconciliation.fixed-delay-ms}") long fixedDelayMs
    ) {
        this.claimService = claimService;
        this.dispatchProcessor = dispatchProcessor;
        this.meterRegistry = meterRegistry;
        this.batchSize = properties.reconciliation().batchSize();
        this.fixedDelayMs = fixedDelayMs;
        this.maxBackoffMs = properties.reconciliation().failureMaxBackoffMs();
    }

    @PreDestroy
    public void shutdown() {
        if (shutdownRequested.compareAndSet(false, true)) {
            log.info("[Reconciliation] 종료 요청. 진행 중인 이벤트 완료 후 중단됩니다.");
        }
    }

    @Scheduled(fixedDelayString = "${eventbus.reconciliation.fixed-delay-ms}",
            initialDelayString = "${eventbus.reconciliation.initial-delay-ms}")
    public void reconcile() {
        if (shutdownRequested.get()) {
            log.debug("[Reconciliation] 종료 요청됨. 새 배치 건너뜀.");
            return;
        }
        if (System.currentTimeMillis() < backoffUntilMs) {
            return;
        }

        try {
            int processed = reconcileBatch();
            consecutiveFailures = 0;
            backoffUntilMs = 0;

            if (processed > 0) {
                log.info("[Reconciliation] 배치 완료. 처리 이벤트 수: {}", processed);
            }
        } catch (DataAccessException e) {
            consecutiveFailures++;
            long backoffMs = backoffFor(consecutiveFailures);
            backoffUntilMs = System.currentTimeMillis() + backoffMs;

            Counter.builder("event_bus_reconciliation_failure_total")
                    .register(meterRegistry).increment();
            log.error("[Reconciliation] 저장소 오류, {}ms 동안 중단. 연속 실패: {}, error: {}",
                    backoffMs, consecutiveFailures, e.getMessage());
        }
    }

    /**
     * 한 배치 claim 후 순서대로 처리
     *
     * @return 처리한 이벤트 수
     */
    int reconcileBatch() {
        List<Event> claimed = claimService.claimBatch(batchSize);
        if (claimed.isEmpty()) {
            return 0;
        }

        log.debug("[Reconciliation] claim 이벤트 수: {}", claimed.size());

        int processed = 0;
        for (Event event : claimed) {
            if (shutdownRequested.get()) {
                // 남은 이벤트는 임대 만료 후 다시 claim 된다
                log.info("[Reconciliation] 종료 요청으로 배치 중단. 처리: {}/{}", processed, claimed.size());
                break;
            }

            CompletionDecision decision = dispatchProcessor.process(event, ProcessingPath.RECONCILE);
            processed++;

            Counter.builder("event_bus_events_processed_total")
                    .tag("path", "reconcile")
                    .tag("status", decision.status().name())
                    .register(meterRegistry).increment();
        }
        return processed;
    }

    long backoffFor(int failures) {
        long backoff = fixedDelayMs;
        for (int i = 1; i < failures && backoff < maxBackoffMs; i++) {
            backoff *= 2;
        }
        return Math.min(backoff, maxBackoffMs);
    }
}

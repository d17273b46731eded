package com.ureca.eventbus.event.scheduler;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.repository.EventRepository;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.stereotype.Component;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.function.IntSupplier;

/**
 * 이벤트 테이블 정리 스케줄러
 * <p>
 * 1. 보관 기간이 지났거나 만료된 종료 이벤트를 아카이브 후 삭제 (아카이브 비활성화 시 바로 삭제)
 * 2. 남은 만료 이벤트를 상태와 무관하게 삭제
 * 배치 단위 반복, 각 Repository 호출이 독립 트랜잭션
 */
@Slf4j
@Component
public class EventCleanupScheduler {

    private final EventRepository eventRepository;
    private final Duration retention;
    private final int batchSize;
    private final boolean archiveEnabled;

    public EventCleanupScheduler(EventRepository eventRepository, EventBusProperties properties) {
        this.eventRepository = eventRepository;
        this.retention = properties.cleanup().retention();
        this.batchSize = properties.cleanup().batchSize();
        this.archiveEnabled = properties.cleanup().archiveEnabled();
    }

    @Scheduled(cron = "${eventbus.cleanup.cron}")
    @SchedulerLock(name = "eventCleanup", lockAtMostFor = "PT30M", lockAtLeastFor = "PT1M")
    public void cleanup() {
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime threshold = now.minus(retention);

        log.info("[Event Cleanup] 정리 시작. 보관 기준 시각: {}, 배치 크기: {}, 아카이브: {}",
                threshold, batchSize, archiveEnabled);

        int terminal = runInBatches("종료 이벤트", archiveEnabled
                ? () -> eventRepository.archiveTerminalEvents(threshold, now, batchSize)
                : () -> eventRepository.deleteTerminalEvents(threshold, now, batchSize));

        int expired = runInBatches("만료 이벤트",
                () -> eventRepository.deleteExpiredEvents(now, batchSize));

        log.info("[Event Cleanup] 정리 완료. 종료 이벤트: {}, 만료 이벤트: {}", terminal, expired);
    }

    int runInBatches(String target, IntSupplier batch) {
        int total = 0;
        int deletedInBatch;

        do {
            try {
                deletedInBatch = batch.getAsInt();
                total += deletedInBatch;

                if (deletedInBatch > 0) {
                    log.debug("[Event Cleanup] {} 배치 삭제. 삭제: {}, 누적: {}", target, deletedInBatch, total);
                }
            } catch (Exception e) {
                log.error("[Event Cleanup] {} 배치 삭제 실패. 누적 삭제: {}, 다음 스케줄에 재시도. error: {}",
                        target, total, e.getMessage());
                break;
            }
        } while (deletedInBatch == batchSize);

        return total;
    }
}

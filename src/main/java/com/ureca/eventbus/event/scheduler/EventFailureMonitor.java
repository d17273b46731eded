package com.ureca.eventbus.event.scheduler;

import com.ureca.eventbus.common.notification.SlackNotifier;
import com.ureca.eventbus.common.notification.dto.SlackAttachment;
import com.ureca.eventbus.common.notification.dto.SlackField;
import com.ureca.eventbus.common.notification.dto.SlackMessage;
import com.ureca.eventbus.event.entity.EventStatus;
import com.ureca.eventbus.event.repository.EventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FAILED 이벤트 모니터링
 * <p>
 * 주기적으로 FAILED 이벤트 수를 Gauge 로 노출
 * 개수가 바뀌었을 때만 Slack 알림 (중복 방지)
 */
@Slf4j
@Component
public class EventFailureMonitor {

    private final EventRepository eventRepository;
    private final SlackNotifier slackNotifier;

    private final AtomicLong failedCount = new AtomicLong();
    private Long lastAlertedCount;

    public EventFailureMonitor(
            EventRepository eventRepository,
            SlackNotifier slackNotifier,
            MeterRegistry meterRegistry
    ) {
        this.eventRepository = eventRepository;
        this.slackNotifier = slackNotifier;
        Gauge.builder("event_bus_failed_events", failedCount, AtomicLong::get)
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${eventbus.monitor.interval}")
    public void monitorFailedEvents() {
        try {
            checkAndAlert();
        } catch (Exception e) {
            log.error("[Failure Monitor] 실패", e);
        }
    }

    void checkAndAlert() {
        long current = eventRepository.countByStatus(EventStatus.FAILED);
        failedCount.set(current);

        if (current == 0) {
            lastAlertedCount = null;
            return;
        }

        if (lastAlertedCount != null && lastAlertedCount == current) {
            log.debug("[Failure Monitor] 알림 생략. count: {} (변화 없음)", current);
            return;
        }

        log.warn("[Failure Monitor] FAILED 이벤트 감지. count: {}", current);
        slackNotifier.sendAsync(buildSlackMessage(current));
        lastAlertedCount = current;
    }

    private SlackMessage buildSlackMessage(long count) {
        String timestamp = LocalDateTime.now()
                .format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"));

        List<SlackField> fields = List.of(
                SlackField.of("FAILED 이벤트", count + "건"),
                SlackField.of("발생 시각", timestamp),
                SlackField.longField("조치",
                        """
                                1. GET /api/event-bus/events/{id} 로 핸들러 기록 확인
                                2. 핸들러 에러 원인 확인
                                3. 필요 시 발행 모듈에서 재발행
                                """
                )
        );

        return SlackMessage.of("경고 이벤트 처리 실패 감지", SlackAttachment.danger(fields));
    }
}

package com.ureca.eventbus.event.listener;

import com.ureca.eventbus.config.AsyncConfig;
import com.ureca.eventbus.event.signal.EventPublishedSignal;
import com.ureca.eventbus.event.signal.NotificationChannels;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * 커밋 이후 NOTIFY 전송
 * <p>
 * 별도 스레드(@Async)에서 자동 커밋 커넥션으로 pg_notify 호출
 * 실패해도 이벤트는 이미 저장되어 있으므로 재조정 경로가 처리한다 (로그, 메트릭만 남김)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventSignalListener {

    private final JdbcTemplate jdbcTemplate;
    private final MeterRegistry meterRegistry;

    @Async(AsyncConfig.SIGNAL_EXECUTOR_NAME)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onEventPublished(EventPublishedSignal signal) {
        List<String> channels = NotificationChannels.of(signal);
        String payload = signal.eventId().toString();

        for (String channel : channels) {
            try {
                jdbcTemplate.queryForObject("SELECT pg_notify(?, ?)", Object.class, channel, payload);
                log.debug("[Signal] NOTIFY 전송. channel: {}, eventId: {}", channel, payload);
            } catch (DataAccessException e) {
                Counter.builder("event_bus_notify_failure_total")
                        .register(meterRegistry).increment();
                log.warn("[Signal] NOTIFY 실패, 재조정 경로에서 처리 예정. channel: {}, eventId: {}, error: {}",
                        channel, payload, e.getMessage());
            }
        }
    }
}

package com.ureca.eventbus.integration;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.event.entity.EventStatus;
import com.ureca.eventbus.event.service.EventPublisher;
import com.ureca.eventbus.processing.listener.EventNotificationListener;
import com.ureca.eventbus.processing.service.LiveEventProcessor;
import com.ureca.eventbus.support.IntegrationTestSupport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * 실시간 경로 통합 테스트
 * <p>
 * 테스트 프로파일은 리스너를 꺼두므로 직접 생성해서 시작/종료
 * 재조정 스케줄러는 호출하지 않는다 (NOTIFY 만으로 처리되는지 확인)
 */
@DisplayName("LISTEN/NOTIFY 실시간 경로 통합 테스트")
class EventNotificationListenerIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private DataSource dataSource;

    @Autowired
    private LiveEventProcessor liveEventProcessor;

    @Autowired
    private EventBusProperties properties;

    @Autowired
    private EventPublisher eventPublisher;

    private EventNotificationListener listener;

    @BeforeEach
    void startListener() {
        listener = new EventNotificationListener(dataSource, liveEventProcessor, properties);
        listener.start();
    }

    @AfterEach
    void stopListener() {
        listener.stop();
    }

    @Test
    @DisplayName("성공 : 커밋 후 NOTIFY -> 실시간 경로로 전달, COMPLETED")
    void notify_deliveredLive() {
        // given
        List<String> received = new CopyOnWriteArrayList<>();
        registerLocal("live-inventory", "order.*", 10, message -> received.add(message.eventType()));
        await().atMost(Duration.ofSeconds(5)).until(listener::isListening);

        // when
        UUID eventId = eventPublisher.publish("order.created", Map.of("orderId", 1), "tenant-1",
                null, null, "order-module", Duration.ofHours(1));

        // then
        await().atMost(Duration.ofSeconds(10))
                .untilAsserted(() -> assertThat(eventRepository.findById(eventId).orElseThrow().getStatus())
                        .isEqualTo(EventStatus.COMPLETED));
        assertThat(received).containsExactly("order.created");
        assertThat(handlerRecordRepository.findAllByEventId(eventId)).hasSize(1);
    }
}

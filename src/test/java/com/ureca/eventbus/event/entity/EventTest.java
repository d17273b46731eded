package com.ureca.eventbus.event.entity;

import com.ureca.eventbus.event.exception.IllegalEventStateException;
import com.ureca.eventbus.support.fixture.EventFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Event 엔티티 테스트")
class EventTest {

    @Nested
    @DisplayName("create")
    class CreateTest {

        @Test
        @DisplayName("성공 : PENDING, retry 0, expiresAt = createdAt + ttl")
        void create() {
            // given
            LocalDateTime now = LocalDateTime.of(2025, 1, 1, 0, 0);

            // when
            Event event = Event.create("order.created", "order-module", Map.of("orderId", 1),
                    "tenant-1", null, null, Duration.ofHours(2), 3, now);

            // then
            assertThat(event.getStatus()).isEqualTo(EventStatus.PENDING);
            assertThat(event.getRetryCount()).isZero();
            assertThat(event.getExpiresAt()).isEqualTo(now.plusHours(2));
            assertThat(event.getProcessedAt()).isNull();
            assertThat(event.getCategory()).isEqualTo("order");
        }

        @Test
        @DisplayName("성공 : payload null 이면 빈 맵")
        void nullPayload_emptyMap() {
            Event event = Event.create("order", "m", null, "t", null, null,
                    Duration.ofMinutes(1), 3, LocalDateTime.now());

            assertThat(event.getPayload()).isEmpty();
            assertThat(event.getCategory()).isEqualTo("order");
        }
    }

    @Nested
    @DisplayName("transitionTo")
    class TransitionTest {

        @Test
        @DisplayName("성공 : PENDING -> PROCESSING -> COMPLETED, processedAt 최초 1회 기록")
        void forwardTransition() {
            // given
            Event event = EventFixture.pending("order.created");
            LocalDateTime done = LocalDateTime.now();

            // when
            event.transitionTo(EventStatus.PROCESSING, done.minusSeconds(1));
            event.transitionTo(EventStatus.COMPLETED, done);

            // then
            assertThat(event.getStatus()).isEqualTo(EventStatus.COMPLETED);
            assertThat(event.getProcessedAt()).isEqualTo(done);
        }

        @Test
        @DisplayName("실패 : 종료 상태에서 역행 -> IllegalEventStateException")
        void backwardTransition_throws() {
            // given
            Event event = EventFixture.withStatus(EventFixture.pendingWithId("order.created"), EventStatus.FAILED);

            // when & then
            assertThatThrownBy(() -> event.transitionTo(EventStatus.PENDING, LocalDateTime.now()))
                    .isInstanceOf(IllegalEventStateException.class);
            assertThatThrownBy(() -> event.transitionTo(EventStatus.COMPLETED, LocalDateTime.now()))
                    .isInstanceOf(IllegalEventStateException.class);
        }
    }

    @Test
    @DisplayName("성공 : 만료 판정은 expiresAt 기준")
    void isExpired() {
        Event event = EventFixture.pending("order.created");

        assertThat(event.isExpired(event.getExpiresAt().minusSeconds(1))).isFalse();
        assertThat(event.isExpired(event.getExpiresAt())).isTrue();
    }
}

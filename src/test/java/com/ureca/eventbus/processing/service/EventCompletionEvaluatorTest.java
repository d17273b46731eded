package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.entity.EventStatus;
import com.ureca.eventbus.handler.entity.HandlerRecord;
import com.ureca.eventbus.handler.repository.HandlerRecordRepository;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.service.SubscriptionCache;
import com.ureca.eventbus.support.fixture.EventFixture;
import com.ureca.eventbus.support.fixture.HandlerRecordFixture;
import com.ureca.eventbus.support.fixture.SubscriptionFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventCompletionEvaluator 테스트")
class EventCompletionEvaluatorTest {

    @Mock
    private SubscriptionCache subscriptionCache;

    @Mock
    private HandlerRecordRepository handlerRecordRepository;

    @Mock
    private EventStatusUpdater statusUpdater;

    @InjectMocks
    private EventCompletionEvaluator evaluator;

    private final UUID eventId = UUID.randomUUID();
    private final EventSubscription a = SubscriptionFixture.local("a", "order.*", 10);
    private final EventSubscription b = SubscriptionFixture.local("b", "order.*", 5);

    @Nested
    @DisplayName("decide")
    class DecideTest {

        @Test
        @DisplayName("성공 : 대상 구독 없음 -> COMPLETED")
        void noSubscriptions_completed() {
            assertThat(EventCompletionEvaluator.decide(List.of(), Map.of()).status())
                    .isEqualTo(EventStatus.COMPLETED);
        }

        @Test
        @DisplayName("성공 : 기록 없는 대상이 있으면 진행 중")
        void missingRecord_inProgress() {
            Map<UUID, HandlerRecord> records = Map.of(a.getId(), HandlerRecordFixture.completed(eventId, a.getId()));

            CompletionDecision decision = EventCompletionEvaluator.decide(List.of(a, b), records);

            assertThat(decision.isTerminal()).isFalse();
        }

        @Test
        @DisplayName("성공 : 재시도 대기 중인 대상이 있으면 진행 중")
        void pendingRecord_inProgress() {
            Map<UUID, HandlerRecord> records = Map.of(
                    a.getId(), HandlerRecordFixture.failed(eventId, a.getId(), "boom"),
                    b.getId(), HandlerRecordFixture.pending(eventId, b.getId(), 1));

            assertThat(EventCompletionEvaluator.decide(List.of(a, b), records).isTerminal()).isFalse();
        }

        @Test
        @DisplayName("성공 : 모두 성공 -> COMPLETED")
        void allCompleted() {
            Map<UUID, HandlerRecord> records = Map.of(
                    a.getId(), HandlerRecordFixture.completed(eventId, a.getId()),
                    b.getId(), HandlerRecordFixture.completed(eventId, b.getId()));

            assertThat(EventCompletionEvaluator.decide(List.of(a, b), records))
                    .isEqualTo(CompletionDecision.completed());
        }

        @Test
        @DisplayName("성공 : 하나라도 FAILED -> FAILED, 첫 실패 사유")
        void anyFailed() {
            Map<UUID, HandlerRecord> records = Map.of(
                    a.getId(), HandlerRecordFixture.completed(eventId, a.getId()),
                    b.getId(), HandlerRecordFixture.failed(eventId, b.getId(), "stock service down"));

            CompletionDecision decision = EventCompletionEvaluator.decide(List.of(a, b), records);

            assertThat(decision.status()).isEqualTo(EventStatus.FAILED);
            assertThat(decision.errorMessage()).isEqualTo("stock service down");
        }
    }

    @Test
    @DisplayName("성공 : 종료 판정이면 상태 전이 요청")
    void evaluate_terminal_marks() {
        // given
        Event event = EventFixture.pendingWithId("order.created");
        given(subscriptionCache.findMatching(event)).willReturn(List.of(a));
        given(handlerRecordRepository.findAllByEventId(event.getId()))
                .willReturn(List.of(HandlerRecordFixture.completed(event.getId(), a.getId())));

        // when
        CompletionDecision decision = evaluator.evaluate(event);

        // then
        assertThat(decision.status()).isEqualTo(EventStatus.COMPLETED);
        verify(statusUpdater).markTerminal(event, decision);
    }

    @Test
    @DisplayName("성공 : 진행 중이면 상태 유지")
    void evaluate_inProgress_noop() {
        // given
        Event event = EventFixture.pendingWithId("order.created");
        given(subscriptionCache.findMatching(event)).willReturn(List.of(a));
        given(handlerRecordRepository.findAllByEventId(event.getId())).willReturn(List.of());

        // when
        evaluator.evaluate(event);

        // then
        verify(statusUpdater, never()).markTerminal(any(), any());
    }
}

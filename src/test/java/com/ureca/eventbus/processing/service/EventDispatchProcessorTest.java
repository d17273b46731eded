package com.ureca.eventbus.processing.service;

import com.ureca.eventbus.dispatch.DispatchOutcome;
import com.ureca.eventbus.dispatch.Dispatcher;
import com.ureca.eventbus.dispatch.DispatcherResolver;
import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.event.entity.EventStatus;
import com.ureca.eventbus.handler.service.HandlerRecordService;
import com.ureca.eventbus.subscription.dto.LocalRegistration;
import com.ureca.eventbus.subscription.entity.DeliveryMode;
import com.ureca.eventbus.subscription.entity.EventSubscription;
import com.ureca.eventbus.subscription.service.SubscriptionCache;
import com.ureca.eventbus.subscription.service.SubscriptionRegistry;
import com.ureca.eventbus.support.fixture.EventBusPropertiesFixture;
import com.ureca.eventbus.support.fixture.EventFixture;
import com.ureca.eventbus.support.fixture.SubscriptionFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * EventDispatchProcessor 단위 테스트
 * <p>
 * 경로별 대상 선정, 전달 순서, 시도 권한, 임대 반납
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EventDispatchProcessor 테스트")
class EventDispatchProcessorTest {

    @Mock
    private SubscriptionRegistry subscriptionRegistry;

    @Mock
    private SubscriptionCache subscriptionCache;

    @Mock
    private DispatcherResolver dispatcherResolver;

    @Mock
    private HandlerRecordService handlerRecordService;

    @Mock
    private EventCompletionEvaluator completionEvaluator;

    @Mock
    private EventStatusUpdater statusUpdater;

    @Mock
    private EventClaimService claimService;

    @Mock
    private Dispatcher dispatcher;

    private EventDispatchProcessor processor;
    private Event event;

    @BeforeEach
    void setUp() {
        processor = processorWith(new SyncTaskExecutor());
        event = EventFixture.pendingWithId("order.created");
        lenient().when(dispatcherResolver.resolve(any())).thenReturn(dispatcher);
        lenient().when(dispatcher.canDispatch(any())).thenReturn(true);
        lenient().when(dispatcher.dispatch(any(), any())).thenReturn(DispatchOutcome.succeeded());
        lenient().when(completionEvaluator.evaluate(any())).thenReturn(CompletionDecision.inProgress());
        lenient().when(subscriptionRegistry.sequenceOf(any())).thenReturn(OptionalLong.empty());
    }

    private EventDispatchProcessor processorWith(TaskExecutor deliveryExecutor) {
        return new EventDispatchProcessor(subscriptionRegistry, subscriptionCache, dispatcherResolver,
                handlerRecordService, completionEvaluator, statusUpdater, claimService, deliveryExecutor,
                EventBusPropertiesFixture.defaults());
    }

    private LocalRegistration registrationOf(EventSubscription subscription, long sequence) {
        return new LocalRegistration(subscription.getId(), subscription.getHandlerName(), subscription.getPattern(),
                null, subscription.getPriority(), sequence);
    }

    @Nested
    @DisplayName("실시간 경로")
    class LivePathTest {

        @Test
        @DisplayName("성공 : 등록 순서대로 첫 시도 획득 후 전달")
        void live_dispatchesInRegistryOrder() {
            // given
            EventSubscription a = SubscriptionFixture.local("a", "order.*", 10);
            EventSubscription c = SubscriptionFixture.local("c", "*.created", 10);
            EventSubscription b = SubscriptionFixture.local("b", "order.created", 5);
            given(subscriptionRegistry.findMatching("order.created", EventFixture.TENANT_ID)).willReturn(List.of(
                    registrationOf(a, 1), registrationOf(c, 3), registrationOf(b, 2)));
            given(subscriptionCache.find(a.getId())).willReturn(Optional.of(a));
            given(subscriptionCache.find(b.getId())).willReturn(Optional.of(b));
            given(subscriptionCache.find(c.getId())).willReturn(Optional.of(c));
            given(handlerRecordService.acquireFirstAttempt(any(), any())).willReturn(true);

            // when
            processor.process(event, ProcessingPath.LIVE);

            // then
            InOrder order = inOrder(dispatcher);
            order.verify(dispatcher).dispatch(a, event);
            order.verify(dispatcher).dispatch(c, event);
            order.verify(dispatcher).dispatch(b, event);
            verify(handlerRecordService, never()).acquireAttempt(any(), any());
            verify(handlerRecordService, times(3)).recordOutcome(any(), any(), any());
        }

        @Test
        @DisplayName("성공 : 비활성 구독은 캐시에 없으므로 건너뜀")
        void live_skipsInactive() {
            // given
            EventSubscription a = SubscriptionFixture.local("a", "order.*", 10);
            given(subscriptionRegistry.findMatching("order.created", EventFixture.TENANT_ID))
                    .willReturn(List.of(registrationOf(a, 1)));
            given(subscriptionCache.find(a.getId())).willReturn(Optional.empty());

            // when
            processor.process(event, ProcessingPath.LIVE);

            // then
            verify(dispatcher, never()).dispatch(any(), any());
            verify(completionEvaluator).evaluate(event);
        }

        @Test
        @DisplayName("성공 : 시도 획득 실패 -> 호출하지 않음")
        void live_notAcquired_skips() {
            // given
            EventSubscription a = SubscriptionFixture.local("a", "order.*", 10);
            given(subscriptionRegistry.findMatching("order.created", EventFixture.TENANT_ID))
                    .willReturn(List.of(registrationOf(a, 1)));
            given(subscriptionCache.find(a.getId())).willReturn(Optional.of(a));
            given(handlerRecordService.acquireFirstAttempt(event.getId(), a.getId())).willReturn(false);

            // when
            processor.process(event, ProcessingPath.LIVE);

            // then
            verify(dispatcher, never()).dispatch(any(), any());
            verify(handlerRecordService, never()).recordOutcome(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("재조정 경로")
    class ReconcilePathTest {

        @Test
        @DisplayName("성공 : 우선순위 내림차순, 같은 우선순위는 생성 시각 순")
        void reconcile_ordersByPriorityThenCreatedAt() {
            // given
            LocalDateTime base = LocalDateTime.now().minusMinutes(10);
            EventSubscription b = SubscriptionFixture.builder().handlerName("b").priority(5).createdAt(base).build();
            EventSubscription c = SubscriptionFixture.builder().handlerName("c").priority(10)
                    .createdAt(base.plusMinutes(2)).build();
            EventSubscription a = SubscriptionFixture.builder().handlerName("a").priority(10)
                    .createdAt(base.plusMinutes(1)).build();
            given(subscriptionCache.findMatching(event)).willReturn(List.of(b, c, a));
            given(handlerRecordService.acquireAttempt(any(), any())).willReturn(true);

            // when
            processor.process(event, ProcessingPath.RECONCILE);

            // then
            InOrder order = inOrder(dispatcher);
            order.verify(dispatcher).dispatch(a, event);
            order.verify(dispatcher).dispatch(c, event);
            order.verify(dispatcher).dispatch(b, event);
            verify(handlerRecordService, never()).acquireFirstAttempt(any(), any());
        }

        @Test
        @DisplayName("성공 : 이 프로세스에서 전달할 수 없는 구독은 시도 권한도 얻지 않음")
        void reconcile_cannotDispatch_skips() {
            // given
            EventSubscription a = SubscriptionFixture.local("elsewhere", "order.*", 10);
            given(subscriptionCache.findMatching(event)).willReturn(List.of(a));
            given(dispatcher.canDispatch(a)).willReturn(false);

            // when
            processor.process(event, ProcessingPath.RECONCILE);

            // then
            verify(handlerRecordService, never()).acquireAttempt(any(), any());
            verify(dispatcher, never()).dispatch(any(), any());
        }
    }

    @Nested
    @DisplayName("ASYNC 구독")
    class AsyncDeliveryTest {

        private List<Runnable> submitted;
        private EventSubscription async;

        @BeforeEach
        void setUp() {
            submitted = new ArrayList<>();
            processor = processorWith(submitted::add);
            async = SubscriptionFixture.builder().handlerName("async").deliveryMode(DeliveryMode.ASYNC).build();
            given(subscriptionCache.findMatching(event)).willReturn(List.of(async));
            given(handlerRecordService.acquireAttempt(any(), any())).willReturn(true);
        }

        @Test
        @DisplayName("성공 : 임대 반납 후 Delivery Executor 에 넘기고, 재claim 한 이벤트로 완료 판정")
        void async_submittedAfterRelease_evaluatedOnReclaimedEvent() {
            // given
            Event reclaimed = EventFixture.withStatus(EventFixture.pendingWithId("order.created"), EventStatus.PROCESSING);
            given(claimService.claimForCompletion(event.getId())).willReturn(Optional.of(reclaimed));

            // when
            processor.process(event, ProcessingPath.RECONCILE);

            // then : 처리 스레드에서는 전달하지 않고 임대부터 반납
            verify(dispatcher, never()).dispatch(any(), any());
            verify(statusUpdater).releaseLease(eq(event.getId()), any());
            assertThat(submitted).hasSize(1);

            submitted.get(0).run();
            verify(dispatcher).dispatch(async, event);
            verify(handlerRecordService).recordOutcome(eq(event), eq(async), any());
            verify(completionEvaluator).evaluate(event);
            verify(completionEvaluator).evaluate(reclaimed);
            verify(statusUpdater).releaseLease(eq(reclaimed.getId()), any());
        }

        @Test
        @DisplayName("성공 : 다른 워커가 임대 중이면 기록만 하고 완료 판정은 하지 않음")
        void async_reclaimFails_onlyRecords() {
            // given
            given(claimService.claimForCompletion(event.getId())).willReturn(Optional.empty());
            processor.process(event, ProcessingPath.RECONCILE);

            // when
            submitted.get(0).run();

            // then
            verify(handlerRecordService).recordOutcome(eq(event), eq(async), any());
            verify(completionEvaluator, times(1)).evaluate(any());
            verify(statusUpdater, times(1)).releaseLease(any(), any());
        }
    }

    @Nested
    @DisplayName("임대 반납")
    class ReleaseLeaseTest {

        @Test
        @DisplayName("성공 : 진행 중이면 처리 후 임대 반납")
        void inProgress_releases() {
            given(subscriptionCache.findMatching(event)).willReturn(List.of());

            processor.process(event, ProcessingPath.RECONCILE);

            verify(statusUpdater).releaseLease(eq(event.getId()), any());
        }

        @Test
        @DisplayName("성공 : 종료된 이벤트는 반납하지 않음")
        void terminal_noRelease() {
            // given
            Event completed = EventFixture.withStatus(EventFixture.pendingWithId("order.created"), EventStatus.COMPLETED);
            given(subscriptionCache.findMatching(completed)).willReturn(List.of());

            // when
            processor.process(completed, ProcessingPath.RECONCILE);

            // then
            verify(statusUpdater, never()).releaseLease(any(), any());
        }

        @Test
        @DisplayName("성공 : 전달 중 예외가 나도 임대 반납")
        void exception_stillReleases() {
            // given
            given(subscriptionCache.findMatching(event)).willThrow(new IllegalStateException("cache broken"));

            // when & then
            assertThatThrownBy(() -> processor.process(event, ProcessingPath.RECONCILE))
                    .isInstanceOf(IllegalStateException.class);
            verify(statusUpdater).releaseLease(eq(event.getId()), any());
        }

        @Test
        @DisplayName("성공 : 재시도 대기 중이면 매 주기 다시 claim 되지 않도록 다음 시도 시각까지 미룸")
        void retryBackoff_defersUntilNextAttempt() {
            // given
            LocalDateTime nextAttemptAt = LocalDateTime.now().plusMinutes(10);
            EventSubscription backingOff = SubscriptionFixture.builder().handlerName("backing-off").build();
            given(subscriptionCache.findMatching(event)).willReturn(List.of(backingOff));
            given(handlerRecordService.acquireAttempt(event.getId(), backingOff.getId())).willReturn(false);
            given(handlerRecordService.findEarliestPendingAttempt(event.getId())).willReturn(Optional.of(nextAttemptAt));

            // when : 여러 주기 반복
            for (int tick = 0; tick < 3; tick++) {
                processor.process(event, ProcessingPath.RECONCILE);
            }

            // then
            verify(dispatcher, never()).dispatch(any(), any());
            verify(statusUpdater, times(3)).releaseLease(event.getId(), nextAttemptAt);
            verify(statusUpdater, never()).releaseLease(event.getId(), null);
        }

        @Test
        @DisplayName("성공 : 다른 인스턴스 핸들러만 남았으면 idleRecheck 후로 미룸")
        void awaitingOtherInstance_defersByIdleRecheck() {
            // given
            EventSubscription elsewhere = SubscriptionFixture.local("elsewhere", "order.*", 10);
            given(subscriptionCache.findMatching(event)).willReturn(List.of(elsewhere));
            given(dispatcher.canDispatch(elsewhere)).willReturn(false);
            LocalDateTime before = LocalDateTime.now();

            // when
            processor.process(event, ProcessingPath.RECONCILE);

            // then
            ArgumentCaptor<LocalDateTime> notBefore = ArgumentCaptor.forClass(LocalDateTime.class);
            verify(statusUpdater).releaseLease(eq(event.getId()), notBefore.capture());
            assertThat(notBefore.getValue()).isAfterOrEqualTo(before.plusSeconds(30));
        }

        @Test
        @DisplayName("성공 : 실시간 경로는 바로 재조정 대상으로 반납 (원격 구독은 재조정 경로가 전달)")
        void live_releasesImmediately() {
            given(subscriptionRegistry.findMatching("order.created", EventFixture.TENANT_ID)).willReturn(List.of());

            processor.process(event, ProcessingPath.LIVE);

            verify(statusUpdater).releaseLease(event.getId(), null);
            verify(handlerRecordService, never()).findEarliestPendingAttempt(any());
        }
    }

    @Nested
    @DisplayName("다음 확인 시각")
    class NextCheckAtTest {

        private final LocalDateTime now = LocalDateTime.of(2026, 1, 1, 12, 0);

        @Test
        @DisplayName("성공 : 대기 중인 기록도, 다른 인스턴스 대기도 없으면 null")
        void nothingPending_null() {
            given(handlerRecordService.findEarliestPendingAttempt(event.getId())).willReturn(Optional.empty());

            assertThat(processor.nextCheckAt(event.getId(), false, now)).isNull();
        }

        @Test
        @DisplayName("성공 : 다른 인스턴스 대기 중이어도 더 이른 재시도 시각이 있으면 그 시각")
        void earlierAttemptWins() {
            given(handlerRecordService.findEarliestPendingAttempt(event.getId()))
                    .willReturn(Optional.of(now.plusSeconds(5)));

            assertThat(processor.nextCheckAt(event.getId(), true, now)).isEqualTo(now.plusSeconds(5));
        }

        @Test
        @DisplayName("성공 : 재시도 시각이 idleRecheck 보다 늦으면 idleRecheck")
        void idleRecheckCapsLateAttempt() {
            given(handlerRecordService.findEarliestPendingAttempt(event.getId()))
                    .willReturn(Optional.of(now.plusHours(1)));

            assertThat(processor.nextCheckAt(event.getId(), true, now)).isEqualTo(now.plusSeconds(30));
        }
    }
}

package com.ureca.eventbus.processing.scheduler;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.processing.service.CompletionDecision;
import com.ureca.eventbus.processing.service.EventClaimService;
import com.ureca.eventbus.processing.service.EventDispatchProcessor;
import com.ureca.eventbus.processing.service.ProcessingPath;
import com.ureca.eventbus.support.fixture.EventBusPropertiesFixture;
import com.ureca.eventbus.support.fixture.EventFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * EventReconciliationScheduler 단위 테스트
 * <p>
 * 배치 처리, 종료 요청, 저장소 장애 시 백오프
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EventReconciliationScheduler 테스트")
class EventReconciliationSchedulerTest {

    private static final long FIXED_DELAY_MS = 5000;

    @Mock
    private EventClaimService claimService;

    @Mock
    private EventDispatchProcessor dispatchProcessor;

    private SimpleMeterRegistry meterRegistry;
    private EventReconciliationScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new EventReconciliationScheduler(claimService, dispatchProcessor, meterRegistry,
                EventBusPropertiesFixture.defaults(), FIXED_DELAY_MS);
    }

    @Nested
    @DisplayName("reconcileBatch")
    class ReconcileBatchTest {

        @Test
        @DisplayName("성공 : claim 한 이벤트를 순서대로 재조정 경로로 처리")
        void processesClaimedEvents() {
            // given
            Event first = EventFixture.pendingWithId("order.created");
            Event second = EventFixture.pendingWithId("order.paid");
            given(claimService.claimBatch(100)).willReturn(List.of(first, second));
            given(dispatchProcessor.process(any(), any())).willReturn(CompletionDecision.completed());

            // when
            int processed = scheduler.reconcileBatch();

            // then
            assertThat(processed).isEqualTo(2);
            verify(dispatchProcessor).process(first, ProcessingPath.RECONCILE);
            verify(dispatchProcessor).process(second, ProcessingPath.RECONCILE);
            assertThat(meterRegistry.get("event_bus_events_processed_total")
                    .tag("path", "reconcile").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("성공 : 대상 없음 -> 0")
        void empty() {
            given(claimService.claimBatch(anyInt())).willReturn(List.of());

            assertThat(scheduler.reconcileBatch()).isZero();
            verify(dispatchProcessor, never()).process(any(), any());
        }

        @Test
        @DisplayName("성공 : 종료 요청 후에는 남은 이벤트 처리하지 않음")
        void shutdown_stopsBatch() {
            // given
            given(claimService.claimBatch(anyInt())).willReturn(List.of(
                    EventFixture.pendingWithId("order.created"), EventFixture.pendingWithId("order.paid")));
            scheduler.shutdown();

            // when
            int processed = scheduler.reconcileBatch();

            // then
            assertThat(processed).isZero();
            verify(dispatchProcessor, never()).process(any(), any());
        }
    }

    @Test
    @DisplayName("성공 : 종료 요청 후 reconcile 은 claim 하지 않음")
    void reconcile_afterShutdown_noop() {
        scheduler.shutdown();

        scheduler.reconcile();

        verify(claimService, never()).claimBatch(anyInt());
    }

    @Test
    @DisplayName("실패 : 저장소 오류 -> 실패 메트릭 증가, 백오프 동안 다음 실행 건너뜀")
    void storageFailure_backsOff() {
        // given
        given(claimService.claimBatch(anyInt())).willThrow(new DataAccessResourceFailureException("db down"));

        // when
        scheduler.reconcile();
        scheduler.reconcile();

        // then
        verify(claimService, times(1)).claimBatch(anyInt());
        assertThat(meterRegistry.get("event_bus_reconciliation_failure_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("성공 : 백오프는 실패마다 두 배, 최대값에서 멈춤")
    void backoffFor_doublesAndCaps() {
        assertThat(scheduler.backoffFor(1)).isEqualTo(5000);
        assertThat(scheduler.backoffFor(2)).isEqualTo(10000);
        assertThat(scheduler.backoffFor(4)).isEqualTo(40000);
        assertThat(scheduler.backoffFor(5)).isEqualTo(60000);
        assertThat(scheduler.backoffFor(30)).isEqualTo(60000);
    }
}

package com.ureca.eventbus.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 비동기 실행 Executor 설정
 * <p>
 * Signal: 커밋 이후 NOTIFY 전송
 * Dispatch: 로컬 핸들러 실행 (호출별 타임아웃 적용)
 * Delivery: ASYNC 구독 전달 (결과 기록과 완료 판정까지 담당)
 * Notification: Slack 알림
 */
@Slf4j
@Configuration
@EnableAsync
@EnableRetry
@EnableConfigurationProperties(EventBusProperties.class)
public class AsyncConfig {
    public static final String SIGNAL_EXECUTOR_NAME = "signalAsyncExecutor";
    public static final String DISPATCH_EXECUTOR_NAME = "dispatchExecutor";
    public static final String DELIVERY_EXECUTOR_NAME = "deliveryExecutor";
    public static final String NOTIFICATION_EXECUTOR_NAME = "notificationAsyncExecutor";

    /**
     * NOTIFY 전송 전용 Executor
     * <p>
     * 신호 유실은 재조정 스케줄러가 보완하므로 큐가 가득 차면 호출 스레드에서 실행
     */
    @Bean(name = SIGNAL_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor signalExecutor() {
        return buildExecutor("Signal-", 2, 4, 500, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * 핸들러 실행 전용 Executor
     * <p>
     * LocalDispatcher 가 Future.get(timeout) 으로 대기하고 타임아웃 난 작업은 cancel 로 인터럽트
     * 호출 스레드 실행은 타임아웃을 무력화하므로 포화 시 거절 (재시도 대상 실패로 기록)
     */
    @Bean(name = DISPATCH_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor dispatchExecutor() {
        return buildExecutor("Dispatch-", 8, 16, 200, new ThreadPoolExecutor.AbortPolicy());
    }

    // ASYNC 구독 전달, 내부에서 Dispatch Executor 를 다시 사용하므로 풀 분리
    @Bean(name = DELIVERY_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor deliveryExecutor() {
        return buildExecutor("Delivery-", 4, 8, 200, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Slack 알림 전용 Executor
     * <p>
     * 알림은 부가 기능이라 큐가 가득 차면 버린다
     */
    @Bean(name = NOTIFICATION_EXECUTOR_NAME)
    public ThreadPoolTaskExecutor notificationAsyncExecutor() {
        return buildExecutor("Notification-", 2, 5, 50, new ThreadPoolExecutor.DiscardPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queue,
                                                 RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);

        // Graceful Shutdown: 진행 중인 작업 최대 10초 대기
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);

        executor.initialize();

        log.info("[비동기] {} Executor 초기화 완료. core: {}, max: {}", prefix, core, max);
        return executor;
    }
}

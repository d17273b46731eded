package com.ureca.eventbus.processing.listener;

import com.ureca.eventbus.config.EventBusProperties;
import com.ureca.eventbus.processing.service.LiveEventProcessor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * PostgreSQL LISTEN 전용 스레드
 * <p>
 * 전용 커넥션으로 채널을 LISTEN 하고 알림을 받으면 LiveEventProcessor 에 넘긴다
 * 커넥션이 끊기면 지수 백오프로 재연결 (끊긴 동안의 신호는 재조정 경로가 처리)
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "eventbus.listener", name = "enabled", havingValue = "true")
public class EventNotificationListener implements SmartLifecycle {

    private final DataSource dataSource;
    private final LiveEventProcessor liveEventProcessor;
    private final List<String> channels;
    private final int pollTimeoutMs;
    private final long initialBackoffMs;
    private final long maxBackoffMs;

    private volatile boolean running;
    private volatile boolean listening;
    private Thread worker;

    public EventNotificationListener(
            DataSource dataSource,
            LiveEventProcessor liveEventProcessor,
            EventBusProperties properties
    ) {
        EventBusProperties.Listener listener = properties.listener();
        this.dataSource = dataSource;
        this.liveEventProcessor = liveEventProcessor;
        this.channels = List.copyOf(listener.channels());
        this.pollTimeoutMs = (int) listener.pollTimeoutMs();
        this.initialBackoffMs = listener.reconnectInitialBackoffMs();
        this.maxBackoffMs = listener.reconnectMaxBackoffMs();
    }

    @Override
    public void start() {
        running = true;
        worker = new Thread(this::runLoop, "EventListener");
        worker.setDaemon(true);
        worker.start();
        log.info("[Listener] LISTEN 시작. channels: {}", channels);
    }

    @Override
    public void stop() {
        running = false;
        listening = false;
        if (worker != null) {
            worker.interrupt();
            try {
                worker.join(pollTimeoutMs * 2L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Listener] LISTEN 종료");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // LISTEN 완료 후 연결 유지 중인지
    public boolean isListening() {
        return listening;
    }

    private void runLoop() {
        long backoffMs = initialBackoffMs;

        while (running) {
            try (Connection connection = dataSource.getConnection()) {
                PGConnection pgConnection = connection.unwrap(PGConnection.class);
                listen(connection);
                listening = true;
                backoffMs = initialBackoffMs;
                log.info("[Listener] 연결 완료. channels: {}", channels);

                while (running) {
                    PGNotification[] notifications = pgConnection.getNotifications(pollTimeoutMs);
                    if (notifications == null) {
                        continue;
                    }
                    for (PGNotification notification : notifications) {
                        handle(notification);
                    }
                }
            } catch (SQLException e) {
                listening = false;
                if (!running) {
                    break;
                }
                log.warn("[Listener] 연결 끊김, {}ms 후 재연결. error: {}", backoffMs, e.getMessage());
                if (!sleep(backoffMs)) {
                    break;
                }
                backoffMs = Math.min(backoffMs * 2, maxBackoffMs);
            }
        }
    }

    private void listen(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String channel : channels) {
                statement.execute("LISTEN \"" + channel.replace("\"", "\"\"") + "\"");
            }
        }
    }

    // 한 신호의 처리 실패가 LISTEN 루프를 끊지 않도록 여기서 기록
    private void handle(PGNotification notification) {
        try {
            liveEventProcessor.onSignal(notification.getParameter());
        } catch (RuntimeException e) {
            log.error("[Listener] 신호 처리 실패, 재조정 경로에서 처리 예정. channel: {}, payload: {}, error: {}",
                    notification.getName(), notification.getParameter(), e.getMessage());
        }
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

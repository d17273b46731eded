package com.ureca.eventbus.event.store;

import com.ureca.eventbus.config.EventBusProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 기동 시 이벤트 테이블의 내구성 모드를 설정값에 맞춘다
 * <p>
 * schema.sql 은 UNLOGGED 로 생성하고, DURABLE 설정이면 LOGGED 로 전환
 * 이미 일치하면 아무 것도 하지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventStoreInitializer implements ApplicationRunner {

    static final List<String> EVENT_TABLES = List.of("events", "event_handlers");

    private static final String PERSISTENCE_QUERY =
            "SELECT c.relpersistence::text FROM pg_class c WHERE c.oid = to_regclass(?)";

    private final JdbcTemplate jdbcTemplate;
    private final EventBusProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        DurabilityMode mode = properties.store().durability();

        for (String table : EVENT_TABLES) {
            List<String> result = jdbcTemplate.queryForList(PERSISTENCE_QUERY, String.class, table);

            if (result.isEmpty()) {
                log.warn("[EventStore] 테이블 없음. 내구성 모드 적용 건너뜀. table: {}", table);
                continue;
            }

            if (mode.matches(result.get(0))) {
                log.debug("[EventStore] 내구성 모드 일치. table: {}, mode: {}", table, mode);
                continue;
            }

            jdbcTemplate.execute(mode.alterStatement(table));
            log.info("[EventStore] 내구성 모드 전환 완료. table: {}, mode: {}", table, mode);
        }
    }
}

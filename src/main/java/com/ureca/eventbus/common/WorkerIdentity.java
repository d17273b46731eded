package com.ureca.eventbus.common;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

// claim 임대 소유자 식별자 (호스트명 + 프로세스별 랜덤값)
@Slf4j
@Getter
@Component
public class WorkerIdentity {

    private final String workerId;

    public WorkerIdentity() {
        this.workerId = resolveHostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("[Worker] 워커 식별자: {}", workerId);
    }

    private static String resolveHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("[Worker] 호스트명 조회 실패, 기본값 사용. error: {}", e.getMessage());
            return "unknown-host";
        }
    }
}

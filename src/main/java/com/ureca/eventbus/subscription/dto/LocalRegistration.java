package com.ureca.eventbus.subscription.dto;

import java.util.UUID;

/**
 * 프로세스 내 등록 정보
 *
 * @param subscriptionId 영속화된 구독 ID
 * @param handlerName    로컬 핸들러 이름
 * @param pattern        이벤트 타입 패턴
 * @param tenantId       테넌트 필터
 * @param priority       우선순위 (높을수록 먼저)
 * @param sequence       등록 순서 (동일 우선순위 정렬 기준)
 */
public record LocalRegistration(
        UUID subscriptionId,
        String handlerName,
        String pattern,
        String tenantId,
        int priority,
        long sequence
) {
}

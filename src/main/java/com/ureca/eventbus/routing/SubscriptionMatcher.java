package com.ureca.eventbus.routing;

import com.ureca.eventbus.event.entity.Event;
import com.ureca.eventbus.subscription.entity.EventSubscription;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * 구독이 이벤트를 받아야 하는지 판정
 * <p>
 * 활성 상태, 패턴 일치, 테넌트 필터, 필터 조건을 모두 만족해야 한다
 * 필터 조건 키 company_id, user_id 는 이벤트 라우팅 식별자와 비교하고
 * 나머지 키는 payload 최상위 필드와 비교
 */
public final class SubscriptionMatcher {

    static final String COMPANY_ID_KEY = "company_id";
    static final String USER_ID_KEY = "user_id";

    private SubscriptionMatcher() {
    }

    public static boolean matches(EventSubscription subscription, Event event) {
        return subscription.isActive()
                && PatternMatcher.matches(event.getEventType(), subscription.getPattern())
                && matchesTenant(subscription.getTenantId(), event.getTenantId())
                && matchesFilter(subscription.getFilterConditions(), event);
    }

    static boolean matchesTenant(String tenantFilter, String tenantId) {
        return tenantFilter == null || tenantFilter.equals(tenantId);
    }

    static boolean matchesFilter(Map<String, Object> conditions, Event event) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }

        for (Map.Entry<String, Object> condition : conditions.entrySet()) {
            Object actual = switch (condition.getKey()) {
                case COMPANY_ID_KEY -> event.getCompanyId();
                case USER_ID_KEY -> event.getUserId();
                default -> event.getPayload() == null ? null : event.getPayload().get(condition.getKey());
            };

            if (!valueEquals(condition.getValue(), actual)) {
                return false;
            }
        }
        return true;
    }

    // JSON 숫자는 Integer/Long/Double 로 섞여 들어오므로 값으로 비교
    private static boolean valueEquals(Object expected, Object actual) {
        if (expected instanceof Number expectedNumber && actual instanceof Number actualNumber) {
            return new BigDecimal(expectedNumber.toString())
                    .compareTo(new BigDecimal(actualNumber.toString())) == 0;
        }
        if (expected != null && actual instanceof String && !(expected instanceof String)) {
            return expected.toString().equals(actual);
        }
        return Objects.equals(expected, actual);
    }
}

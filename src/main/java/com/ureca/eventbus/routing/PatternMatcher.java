package com.ureca.eventbus.routing;

import java.util.regex.Pattern;

/**
 * 점(.) 구분 이벤트 타입과 구독 패턴 매칭
 * <p>
 * 세그먼트 수가 같아야 하고, 패턴의 * 는 세그먼트 하나와 매칭
 * 그 외 세그먼트는 대소문자 구분 일치
 * 다단계 와일드카드는 없다 (a.* 는 a.b.c 와 매칭되지 않음)
 */
public final class PatternMatcher {

    public static final String WILDCARD = "*";

    private static final Pattern DOT = Pattern.compile("\\.");

    private PatternMatcher() {
    }

    public static boolean matches(String eventType, String pattern) {
        if (eventType == null || pattern == null || eventType.isEmpty() || pattern.isEmpty()) {
            return false;
        }

        String[] typeSegments = DOT.split(eventType, -1);
        String[] patternSegments = DOT.split(pattern, -1);

        if (typeSegments.length != patternSegments.length) {
            return false;
        }

        for (int i = 0; i < patternSegments.length; i++) {
            String expected = patternSegments[i];
            if (WILDCARD.equals(expected)) {
                continue;
            }
            if (!expected.equals(typeSegments[i])) {
                return false;
            }
        }
        return true;
    }

    // 발행 가능한 이벤트 타입: 빈 세그먼트와 와일드카드 불가
    public static boolean isValidEventType(String eventType) {
        return isWellFormed(eventType, false);
    }

    // 구독 패턴: 세그먼트 단위 * 허용
    public static boolean isValidPattern(String pattern) {
        return isWellFormed(pattern, true);
    }

    private static boolean isWellFormed(String value, boolean allowWildcard) {
        if (value == null || value.isBlank()) {
            return false;
        }
        for (String segment : DOT.split(value, -1)) {
            if (segment.isEmpty() || !segment.strip().equals(segment)) {
                return false;
            }
            if (segment.contains(WILDCARD) && !(allowWildcard && WILDCARD.equals(segment))) {
                return false;
            }
        }
        return true;
    }
}

package com.ureca.eventbus.dispatch;

/**
 * 전달 결과 (로컬, 원격 공통)
 *
 * @param success   성공 여부
 * @param error     실패 사유 (성공이면 null)
 * @param retryable 실패 시 재시도 대상인지
 */
public record DispatchOutcome(
        boolean success,
        String error,
        boolean retryable
) {
    private static final int MAX_ERROR_LENGTH = 2000;

    public static DispatchOutcome succeeded() {
        return new DispatchOutcome(true, null, false);
    }

    public static DispatchOutcome transientFailure(String error) {
        return new DispatchOutcome(false, truncate(error), true);
    }

    public static DispatchOutcome permanentFailure(String error) {
        return new DispatchOutcome(false, truncate(error), false);
    }

    private static String truncate(String error) {
        if (error == null) {
            return "unknown error";
        }
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}

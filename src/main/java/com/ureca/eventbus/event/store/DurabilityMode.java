package com.ureca.eventbus.event.store;

/**
 * 이벤트 저장소 내구성 모드
 * <p>
 * FAST: UNLOGGED 테이블 (WAL 미기록, 처리량 우선, 저장소 장애 시 미반영 이벤트 유실 가능)
 * DURABLE: 일반 테이블 (WAL 기록, 장애 후에도 커밋된 이벤트 보존)
 */
public enum DurabilityMode {
    FAST('u', "UNLOGGED"),
    DURABLE('p', "LOGGED");

    private final char relPersistence;
    private final String alterKeyword;

    DurabilityMode(char relPersistence, String alterKeyword) {
        this.relPersistence = relPersistence;
        this.alterKeyword = alterKeyword;
    }

    // pg_class.relpersistence 값과 일치하는지
    public boolean matches(String relPersistence) {
        return relPersistence != null
                && relPersistence.length() == 1
                && relPersistence.charAt(0) == this.relPersistence;
    }

    public String alterStatement(String table) {
        return "ALTER TABLE " + table + " SET " + alterKeyword;
    }
}

package com.ureca.eventbus.subscription.service;

import com.ureca.eventbus.dispatch.EventHandler;
import com.ureca.eventbus.subscription.exception.DuplicateHandlerException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LocalHandlerTable 테스트")
class LocalHandlerTableTest {

    private final LocalHandlerTable handlerTable = new LocalHandlerTable();

    @Test
    @DisplayName("성공 : 같은 핸들러 인스턴스 재등록은 무시")
    void sameHandler_idempotent() {
        EventHandler handler = message -> {
        };
        handlerTable.register("h", handler);

        assertThatCode(() -> handlerTable.register("h", handler)).doesNotThrowAnyException();
        assertThat(handlerTable.find("h")).containsSame(handler);
    }

    @Test
    @DisplayName("실패 : 다른 핸들러로 같은 이름 등록 -> DuplicateHandlerException")
    void differentHandler_duplicate() {
        handlerTable.register("h", message -> {
        });

        assertThatThrownBy(() -> handlerTable.register("h", message -> {
        })).isInstanceOf(DuplicateHandlerException.class);
    }

    @Test
    @DisplayName("성공 : 등록한 인스턴스로만 해제")
    void unregister_onlyOwnHandler() {
        EventHandler handler = message -> {
        };
        handlerTable.register("h", handler);

        handlerTable.unregister("h", message -> {
        });
        assertThat(handlerTable.contains("h")).isTrue();

        handlerTable.unregister("h", handler);
        assertThat(handlerTable.contains("h")).isFalse();
    }
}

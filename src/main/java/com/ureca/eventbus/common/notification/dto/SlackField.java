package com.ureca.eventbus.common.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// 알림 본문 항목 (title: value)
public record SlackField(
        String title,
        String value,
        @JsonProperty("short") boolean shortField
) {

    public static SlackField of(String title, Object value) {
        return new SlackField(title, String.valueOf(value), true);
    }

    public static SlackField longField(String title, String value) {
        return new SlackField(title, value, false);
    }
}

package com.ureca.eventbus.common.notification.dto;

import java.util.List;

public record SlackAttachment(
        String color,
        List<SlackField> fields,
        String footer,
        Long ts
) {
    private static final String FOOTER = "event-bus monitoring";

    public static SlackAttachment danger(List<SlackField> fields) {
        return new SlackAttachment("danger", fields, FOOTER, nowEpochSeconds());
    }

    public static SlackAttachment warning(List<SlackField> fields) {
        return new SlackAttachment("warning", fields, FOOTER, nowEpochSeconds());
    }

    private static long nowEpochSeconds() {
        return System.currentTimeMillis() / 1000;
    }
}

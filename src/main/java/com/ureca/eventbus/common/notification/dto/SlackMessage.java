package com.ureca.eventbus.common.notification.dto;

import java.util.List;

/**
 * Slack Incoming Webhook 요청 본문
 */
public record SlackMessage(
        String text,
        List<SlackAttachment> attachments
) {
    public static SlackMessage of(String text, SlackAttachment attachment) {
        return new SlackMessage(text, List.of(attachment));
    }
}

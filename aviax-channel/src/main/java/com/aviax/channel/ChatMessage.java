package com.aviax.channel;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

/**
 * The parts of an incoming chat message that can carry a media reference.
 *
 * @param text            message text, may be {@code null}
 * @param caption         media caption, may be {@code null}
 * @param entities        spans over {@code text}, in declaration order
 * @param captionEntities spans over {@code caption}, in declaration order
 * @param replyTo         the message this one replies to, or {@code null}
 */
@Builder
public record ChatMessage(
        String text,
        String caption,
        @Singular List<MessageEntity> entities,
        @Singular List<MessageEntity> captionEntities,
        ChatMessage replyTo) {

    public ChatMessage {
        entities = entities == null ? List.of() : List.copyOf(entities);
        captionEntities = captionEntities == null ? List.of() : List.copyOf(captionEntities);
    }

    /** Text if present, else the caption. */
    public String body() {
        return text != null ? text : caption;
    }
}

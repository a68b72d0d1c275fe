package com.aviax.channel.telegram;

import com.aviax.channel.ChatMessage;
import com.aviax.channel.MessageEntity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ChatMessage}s from Telegram Bot API message objects, as
 * decoded into maps by the update poller or webhook.
 */
@Slf4j
public final class TelegramMessages {

    private TelegramMessages() {
    }

    /**
     * Convert a raw Bot API message. The replied-to message is carried one
     * level deep.
     *
     * @return the message, or {@code null} for a {@code null} input
     */
    public static ChatMessage fromBotApi(Map<String, Object> message) {
        return fromBotApi(message, true);
    }

    @SuppressWarnings("unchecked")
    private static ChatMessage fromBotApi(Map<String, Object> message, boolean withReply) {
        if (message == null)
            return null;

        ChatMessage replyTo = null;
        if (withReply && message.get("reply_to_message") instanceof Map<?, ?> reply) {
            replyTo = fromBotApi((Map<String, Object>) reply, false);
        }

        return new ChatMessage(
                stringOrNull(message.get("text")),
                stringOrNull(message.get("caption")),
                parseEntities(message.get("entities")),
                parseEntities(message.get("caption_entities")),
                replyTo);
    }

    static List<MessageEntity> parseEntities(Object raw) {
        List<MessageEntity> entities = new ArrayList<>();
        if (!(raw instanceof List<?> list))
            return entities;

        for (Object item : list) {
            if (!(item instanceof Map<?, ?> e))
                continue;
            Object offset = e.get("offset");
            Object length = e.get("length");
            if (!(offset instanceof Number o) || !(length instanceof Number l)) {
                log.debug("Skipping entity without offset/length: {}", e);
                continue;
            }
            entities.add(new MessageEntity(
                    MessageEntity.Type.fromBotApi(stringOrNull(e.get("type"))),
                    o.intValue(),
                    l.intValue(),
                    stringOrNull(e.get("url"))));
        }
        return entities;
    }

    private static String stringOrNull(Object value) {
        return value instanceof String s ? s : null;
    }
}

package com.aviax.channel;

import com.aviax.media.Reference;
import com.aviax.media.References;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Finds the media reference a user meant in a chat message: a platform link
 * in the message itself, else one in the message it replies to. Links to other
 * hosts are skipped. Replies of replies are not followed.
 */
@Slf4j
public class ReferenceResolver {

    /**
     * Reference for a message, or empty if neither it nor its replied-to
     * message carries a link.
     */
    public Optional<Reference> fromMessage(ChatMessage message) {
        return findLink(message).map(References::link);
    }

    /**
     * Classify a bare string: platform links become URL references, anything
     * else is search text.
     */
    public Reference resolve(String raw) {
        return References.classify(raw);
    }

    /**
     * The first platform link in declaration order, looking one reply deep.
     */
    public Optional<String> findLink(ChatMessage message) {
        if (message == null) {
            return Optional.empty();
        }
        Optional<String> own = linkIn(message);
        if (own.isPresent() || message.replyTo() == null) {
            return own;
        }
        return linkIn(message.replyTo());
    }

    private static Optional<String> linkIn(ChatMessage message) {
        Optional<String> fromText = scan(message.entities(), message.body());
        if (fromText.isPresent()) {
            return fromText;
        }
        String captionSource = message.caption() != null ? message.caption() : message.text();
        return scan(message.captionEntities(), captionSource);
    }

    private static Optional<String> scan(List<MessageEntity> entities, String source) {
        for (MessageEntity entity : entities) {
            Optional<String> candidate = Optional.empty();
            if (entity.type() == MessageEntity.Type.URL) {
                candidate = span(source, entity);
            } else if (entity.type() == MessageEntity.Type.TEXT_LINK && entity.url() != null) {
                candidate = Optional.of(entity.url().trim()).filter(url -> !url.isEmpty());
            }
            if (candidate.isPresent() && References.isPlatformLink(candidate.get())) {
                return candidate;
            }
            candidate.ifPresent(url -> log.debug("Skipping non-platform link {}", url));
        }
        return Optional.empty();
    }

    private static Optional<String> span(String source, MessageEntity entity) {
        if (source == null) {
            return Optional.empty();
        }
        int start = entity.offset();
        int end = start + entity.length();
        if (start < 0 || entity.length() <= 0 || end > source.length()) {
            log.debug("Ignoring URL entity [{}, {}) outside text of length {}", start, end, source.length());
            return Optional.empty();
        }
        String url = source.substring(start, end).trim();
        return url.isEmpty() ? Optional.empty() : Optional.of(url);
    }
}

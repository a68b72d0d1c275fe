package com.aviax.channel;

/**
 * A formatted span inside a chat message's text or caption.
 * Offsets and lengths count UTF-16 code units, as Telegram does.
 *
 * @param type   what the span is
 * @param offset start of the span
 * @param length length of the span
 * @param url    embedded target of a {@link Type#TEXT_LINK}; {@code null} otherwise
 */
public record MessageEntity(Type type, int offset, int length, String url) {

    public enum Type {
        /** A URL written out in the text. */
        URL,
        /** Text whose link target is carried in {@link MessageEntity#url()}. */
        TEXT_LINK,
        OTHER;

        public static Type fromBotApi(String type) {
            if ("url".equals(type)) {
                return URL;
            }
            if ("text_link".equals(type)) {
                return TEXT_LINK;
            }
            return OTHER;
        }
    }

    public static MessageEntity url(int offset, int length) {
        return new MessageEntity(Type.URL, offset, length, null);
    }

    public static MessageEntity textLink(int offset, int length, String url) {
        return new MessageEntity(Type.TEXT_LINK, offset, length, url);
    }
}

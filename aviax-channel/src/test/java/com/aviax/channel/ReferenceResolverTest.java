package com.aviax.channel;

import com.aviax.media.Reference;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    private final ReferenceResolver resolver = new ReferenceResolver();

    @Test
    void urlEntity_returnsExactSpan() {
        // 10 + 20 + 20 characters
        String text = "play this " + "https://youtu.be/abc" + " please, it's great!";
        assertEquals(50, text.length());
        ChatMessage message = ChatMessage.builder()
                .text(text)
                .entity(MessageEntity.url(10, 20))
                .build();

        Optional<String> link = resolver.findLink(message);

        assertEquals("https://youtu.be/abc", link.orElseThrow());
        assertEquals(20, link.get().length());
        assertEquals(Reference.directUrl("https://youtu.be/abc"), resolver.fromMessage(message).orElseThrow());
    }

    @Test
    void entities_areInspectedInDeclarationOrder() {
        ChatMessage message = ChatMessage.builder()
                .text("see https://youtu.be/one and https://youtu.be/two")
                .entity(new MessageEntity(MessageEntity.Type.OTHER, 0, 3, null))
                .entity(MessageEntity.textLink(0, 3, "https://youtu.be/embedded"))
                .entity(MessageEntity.url(4, 20))
                .build();

        assertEquals("https://youtu.be/embedded", resolver.findLink(message).orElseThrow());
    }

    @Test
    void captionEntities_readFromCaption() {
        ChatMessage message = ChatMessage.builder()
                .caption("https://youtube.com/playlist?list=PL1")
                .captionEntity(MessageEntity.url(0, 37))
                .build();

        Reference ref = resolver.fromMessage(message).orElseThrow();

        assertEquals(Reference.Kind.PLAYLIST_URL, ref.kind());
    }

    @Test
    void otherHostLinks_areSkipped() {
        String text = "see https://example.com/x then https://youtu.be/abc";
        ChatMessage message = ChatMessage.builder()
                .text(text)
                .entity(MessageEntity.url(4, 21))
                .entity(MessageEntity.url(31, 20))
                .build();

        assertEquals("https://youtu.be/abc", resolver.findLink(message).orElseThrow());
    }

    @Test
    void otherHostRichLink_fallsThroughToReply() {
        ChatMessage quoted = ChatMessage.builder()
                .entity(MessageEntity.textLink(0, 1, "https://youtu.be/quoted"))
                .build();
        ChatMessage message = ChatMessage.builder()
                .text("docs")
                .entity(MessageEntity.textLink(0, 4, "https://example.com/docs"))
                .replyTo(quoted)
                .build();

        assertEquals("https://youtu.be/quoted", resolver.findLink(message).orElseThrow());
    }

    @Test
    void outOfRangeSpan_isIgnored() {
        ChatMessage message = ChatMessage.builder()
                .text("short")
                .entity(MessageEntity.url(2, 40))
                .build();

        assertTrue(resolver.findLink(message).isEmpty());
    }

    @Test
    void reply_withRichLink_isUsed() {
        ChatMessage quoted = ChatMessage.builder()
                .text("this one")
                .entity(MessageEntity.textLink(0, 8, "https://www.youtube.com/watch?v=xyz"))
                .build();
        ChatMessage message = ChatMessage.builder()
                .text("/play")
                .replyTo(quoted)
                .build();

        assertEquals("https://www.youtube.com/watch?v=xyz", resolver.findLink(message).orElseThrow());
    }

    @Test
    void ownLink_winsOverReply() {
        ChatMessage quoted = ChatMessage.builder()
                .entity(MessageEntity.textLink(0, 1, "https://youtu.be/quoted"))
                .build();
        ChatMessage message = ChatMessage.builder()
                .entity(MessageEntity.textLink(0, 1, "https://youtu.be/own"))
                .replyTo(quoted)
                .build();

        assertEquals("https://youtu.be/own", resolver.findLink(message).orElseThrow());
    }

    @Test
    void replyOfReply_isNotFollowed() {
        ChatMessage deepest = ChatMessage.builder()
                .text("https://youtu.be/deep")
                .entity(MessageEntity.url(0, 21))
                .build();
        ChatMessage middle = ChatMessage.builder()
                .text("no link here")
                .replyTo(deepest)
                .build();
        ChatMessage message = ChatMessage.builder()
                .text("/play")
                .replyTo(middle)
                .build();

        assertTrue(resolver.findLink(message).isEmpty());
        assertTrue(resolver.fromMessage(message).isEmpty());
    }

    @Test
    void noEntities_isNotFound() {
        assertTrue(resolver.fromMessage(ChatMessage.builder().text("https://youtu.be/abc").build()).isEmpty());
        assertTrue(resolver.fromMessage(null).isEmpty());
    }

    @Test
    void bareString_isClassified() {
        assertEquals(Reference.Kind.DIRECT_URL, resolver.resolve("https://youtu.be/abc").kind());
        assertEquals(Reference.Kind.SEARCH_QUERY, resolver.resolve("never gonna give you up").kind());
    }
}

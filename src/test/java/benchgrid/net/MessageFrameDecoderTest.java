package benchgrid.net;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.TooLongFrameException;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MessageFrameDecoderTest {

    @Test
    void splitsOnNewlineAndStripsIt() {
        EmbeddedChannel ch = new EmbeddedChannel(new MessageFrameDecoder(1024));

        ch.writeInbound(bytes("TASK|REQUEST|w1\r\nREGISTER|REQUEST|w2\n"));

        assertEquals("TASK|REQUEST|w1", readFrame(ch));
        assertEquals("REGISTER|REQUEST|w2", readFrame(ch));
        assertNull(ch.readInbound());
        ch.finishAndReleaseAll();
    }

    @Test
    void unterminatedMessageIsFramedAtEndOfRead() {
        EmbeddedChannel ch = new EmbeddedChannel(new MessageFrameDecoder(1024));

        // channel stays open: the sender is waiting for a reply
        ch.writeInbound(bytes("TASK|REQUEST"));

        assertEquals("TASK|REQUEST", readFrame(ch));
        assertNull(ch.readInbound());
        assertTrue(ch.isOpen());
        ch.finishAndReleaseAll();
    }

    @Test
    void trailingBytesAfterNewlineFormTheirOwnFrame() {
        EmbeddedChannel ch = new EmbeddedChannel(new MessageFrameDecoder(1024));

        ch.writeInbound(bytes("NODE w1 EVENT TASK_REQUESTED\nNODE w2"));

        assertEquals("NODE w1 EVENT TASK_REQUESTED", readFrame(ch));
        assertEquals("NODE w2", readFrame(ch));
        ch.finishAndReleaseAll();
    }

    @Test
    void oversizedMessageIsRejected() {
        EmbeddedChannel ch = new EmbeddedChannel(new MessageFrameDecoder(8));

        assertThrows(TooLongFrameException.class, () -> ch.writeInbound(bytes("TASK|REQUEST|far-too-long\n")));
        ch.finishAndReleaseAll();
    }

    private static ByteBuf bytes(String s) {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    private static String readFrame(EmbeddedChannel ch) {
        ByteBuf frame = ch.readInbound();
        assertNotNull(frame);
        try {
            return frame.toString(StandardCharsets.UTF_8);
        } finally {
            frame.release();
        }
    }
}

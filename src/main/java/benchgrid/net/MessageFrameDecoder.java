package benchgrid.net;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.util.ByteProcessor;

import java.util.List;

/**
 * Frames one text message. A message ends at {@code \n} (an optional
 * preceding {@code \r} is stripped), or, when no newline arrives, at the end
 * of the read burst it came in or at the peer's half-close.
 *
 * Senders that write a bare {@code TASK|REQUEST} and then wait for the reply
 * without closing are therefore served like newline-terminated ones.
 */
public class MessageFrameDecoder extends ByteToMessageDecoder {

    private final int maxLength;

    public MessageFrameDecoder(int maxLength) {
        this.maxLength = maxLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        int eol = in.forEachByte(ByteProcessor.FIND_LF);
        if (eol < 0) {
            if (in.readableBytes() > maxLength) {
                int length = in.readableBytes();
                in.skipBytes(length);
                throw new TooLongFrameException("message of " + length + " bytes exceeds " + maxLength);
            }
            return;
        }

        int length = eol - in.readerIndex();
        if (length > maxLength) {
            in.readerIndex(eol + 1);
            throw new TooLongFrameException("message of " + length + " bytes exceeds " + maxLength);
        }
        int frameLength = length > 0 && in.getByte(eol - 1) == '\r' ? length - 1 : length;
        out.add(in.readRetainedSlice(frameLength));
        in.readerIndex(eol + 1);
    }

    @Override
    protected void decodeLast(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable()) {
            out.add(in.readRetainedSlice(in.readableBytes()));
        }
    }

    /**
     * Whatever is still buffered once the socket has nothing more to read is
     * a complete unterminated message.
     */
    @Override
    public void channelReadComplete(ChannelHandlerContext ctx) throws Exception {
        ByteBuf pending = internalBuffer();
        if (pending.isReadable()) {
            ctx.fireChannelRead(pending.readRetainedSlice(pending.readableBytes()));
        }
        super.channelReadComplete(ctx);
    }
}

package benchgrid.logger.server;

import benchgrid.events.EventLine;
import benchgrid.logger.model.LifecycleEvent;
import benchgrid.logger.service.EventParser;
import benchgrid.logger.service.QueryService;
import benchgrid.logger.service.TimelineStore;
import benchgrid.protocol.ProtocolException;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownReadComplete;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingests one event (or answers one query) per connection, then closes it.
 * Malformed events are logged and discarded.
 */
@Sharable
public class LoggerHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(LoggerHandler.class);
    private static final AttributeKey<Boolean> HANDLED = AttributeKey.valueOf("benchgrid.logger.handled");

    private final TimelineStore store;
    private final QueryService queries;

    public LoggerHandler(TimelineStore store, QueryService queries) {
        this.store = store;
        this.queries = queries;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String message) {
        if (ctx.channel().attr(HANDLED).setIfAbsent(Boolean.TRUE) != null) {
            log.debug("Ignoring extra message from {}", ctx.channel().remoteAddress());
            return;
        }
        if (message.isBlank()) {
            ctx.close();
            return;
        }
        try {
            if (QueryService.isQuery(message)) {
                String answer = queries.answer(message);
                ctx.writeAndFlush(answer + "\n").addListener(ChannelFutureListener.CLOSE);
                return;
            }
            LifecycleEvent event = store.record(EventParser.parse(message, EventLine.now()));
            log.info("Logged: {}", event);
            ctx.close();
        } catch (ProtocolException e) {
            log.warn("Discarded message from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            ctx.close();
        } catch (Exception e) {
            log.error("Error handling client {}", ctx.channel().remoteAddress(), e);
            ctx.close();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownReadComplete && !ctx.channel().hasAttr(HANDLED)) {
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof ReadTimeoutException) {
            log.warn("Read timeout from {}", ctx.channel().remoteAddress());
        } else {
            log.warn("Connection error from {}: {}", ctx.channel().remoteAddress(), cause.toString());
        }
        ctx.close();
    }
}

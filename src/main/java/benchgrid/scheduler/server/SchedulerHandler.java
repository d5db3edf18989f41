package benchgrid.scheduler.server;

import benchgrid.catalog.TaskSpec;
import benchgrid.events.EventEmitter;
import benchgrid.events.EventKind;
import benchgrid.protocol.ProtocolException;
import benchgrid.protocol.SchedulerReply;
import benchgrid.protocol.SchedulerRequest;
import benchgrid.scheduler.service.SchedulerState;
import benchgrid.util.Jsons;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownReadComplete;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * Serves one scheduler request per connection, then closes it.
 *
 * A protocol error is logged and the connection dropped; no per-connection
 * failure reaches the accept loop or leaves the shared state half-updated.
 *
 * This handler is @Sharable because all state lives in {@link SchedulerState}.
 */
@Sharable
public class SchedulerHandler extends SimpleChannelInboundHandler<String> {

    private static final Logger log = LoggerFactory.getLogger(SchedulerHandler.class);
    private static final AttributeKey<Boolean> HANDLED = AttributeKey.valueOf("benchgrid.scheduler.handled");

    private final SchedulerState state;
    private final EventEmitter events;

    public SchedulerHandler(SchedulerState state, EventEmitter events) {
        this.state = state;
        this.events = events;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String message) {
        if (ctx.channel().attr(HANDLED).setIfAbsent(Boolean.TRUE) != null) {
            log.debug("Ignoring extra message from {}", ctx.channel().remoteAddress());
            return;
        }
        try {
            SchedulerRequest request = SchedulerRequest.parse(message);
            switch (request.kind()) {
                case REGISTER -> handleRegister(ctx, request);
                case TASK_REQUEST -> handleTaskRequest(ctx, request);
                case TASK_FINISH -> handleFinish(ctx, request);
                case STATUS -> reply(ctx, SchedulerReply.status(Jsons.toJson(state.status())));
            }
        } catch (ProtocolException e) {
            log.warn("Protocol error from {}: {}", ctx.channel().remoteAddress(), e.getMessage());
            ctx.close();
        } catch (Exception e) {
            log.error("Error handling node {}", ctx.channel().remoteAddress(), e);
            ctx.close();
        }
    }

    private void handleRegister(ChannelHandlerContext ctx, SchedulerRequest request) {
        state.register(request.nodeId());
        reply(ctx, SchedulerReply.confirm(state.schedulerName()));
    }

    private void handleTaskRequest(ChannelHandlerContext ctx, SchedulerRequest request) {
        String node = requester(ctx, request);
        Optional<TaskSpec> task = state.requestTask(node);
        if (task.isEmpty()) {
            reply(ctx, SchedulerReply.rest());
            return;
        }
        // queue the event first so it usually reaches the logger ahead of the node's TASK_FINISHED
        events.emit(node, EventKind.TASK_ASSIGNED, task.get().type().wireName());
        reply(ctx, SchedulerReply.assign(task.get()));
    }

    private void handleFinish(ChannelHandlerContext ctx, SchedulerRequest request) {
        state.finish(requester(ctx, request), request.durationSeconds());
        ctx.close();
    }

    /**
     * Node id from the message when present, else the peer's address.
     */
    static String requester(ChannelHandlerContext ctx, SchedulerRequest request) {
        return request.node().orElseGet(() -> addressOf(ctx.channel().remoteAddress()));
    }

    static String addressOf(SocketAddress address) {
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return String.valueOf(address);
    }

    private static void reply(ChannelHandlerContext ctx, String line) {
        ctx.writeAndFlush(line + "\n").addListener(ChannelFutureListener.CLOSE);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof ChannelInputShutdownReadComplete && !ctx.channel().hasAttr(HANDLED)) {
            log.debug("Connection from {} closed without a message", ctx.channel().remoteAddress());
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

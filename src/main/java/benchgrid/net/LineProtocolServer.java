package benchgrid.net;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Netty server for the one-message-per-connection text protocols.
 *
 * Pipeline: read timeout, frame decoder (newline or half-close), UTF-8
 * string codec, then the service handler running on a dedicated executor
 * group so that a slow handler never stalls the I/O threads.
 */
public abstract class LineProtocolServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LineProtocolServer.class);

    /** Largest accepted message, in bytes */
    public static final int MAX_MESSAGE_BYTES = 64 * 1024;

    private final String name;
    private final String host;
    private final int port;
    private final Duration readTimeout;
    private final int handlerThreads;
    private final ChannelGroup clients = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);

    private volatile boolean running = false;
    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;

    protected LineProtocolServer(String name, String host, int port, Duration readTimeout, int handlerThreads) {
        this.name = name;
        this.host = host;
        this.port = port;
        this.readTimeout = readTimeout;
        this.handlerThreads = handlerThreads;
    }

    /**
     * The service handler. Must be {@code @Sharable}.
     */
    protected abstract ChannelHandler serviceHandler();

    /** Hook run after the socket is bound. */
    protected void onStarted() {
    }

    /** Hook run after the last handler has finished. */
    protected void onStopped() {
    }

    public synchronized void start() throws InterruptedException {
        if (running) {
            log.warn("{} already running", name);
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(handlerThreads);

        ChannelHandler handler = serviceHandler();
        long timeoutMs = readTimeout.toMillis();

        try {
            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .option(ChannelOption.SO_REUSEADDR, true)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.ALLOW_HALF_CLOSURE, true)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            clients.add(ch);
                            ChannelPipeline p = ch.pipeline();
                            p.addLast(new ReadTimeoutHandler(timeoutMs, TimeUnit.MILLISECONDS));
                            p.addLast(new MessageFrameDecoder(MAX_MESSAGE_BYTES));
                            p.addLast(new StringDecoder(StandardCharsets.UTF_8));
                            p.addLast(new StringEncoder(StandardCharsets.UTF_8));
                            p.addLast(handlerGroup, handler);
                        }
                    });

            serverChannel = b.bind(host, port).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        running = true;
        log.info("{} listening on {}:{}", name, host, boundPort());
        onStarted();
    }

    /**
     * Stop accepting, close open connections, let in-flight handlers finish,
     * then run {@link #onStopped()}.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            clients.close().awaitUninterruptibly();
        } finally {
            shutdownGroups();
            log.info("{} stopped", name);
        }
        onStopped();
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Port actually bound; differs from the configured one when that was 0.
     */
    public int boundPort() {
        Channel ch = serverChannel;
        if (ch != null && ch.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return port;
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }
        // last: the I/O threads hand events to it until they are gone
        if (handlerGroup != null) {
            handlerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
            handlerGroup = null;
        }
    }
}

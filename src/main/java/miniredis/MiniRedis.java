package miniredis;

import miniredis.command.CommandInterpreter;
import miniredis.config.RedisConfig;
import miniredis.exception.RedisException;
import miniredis.resp.RespDecoder;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static miniredis.util.Logger.debug;
import static miniredis.util.Logger.info;

public class MiniRedis implements AutoCloseable {
    private final RedisConfig config;
    private final ExecutorService clientListeners;
    private final RespDecoder decoder;
    private final CommandInterpreter interpreter;
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile ServerSocketChannel serverChannel;

    public MiniRedis(RedisConfig config) {
        this.config = config;
        this.clientListeners = Executors.newCachedThreadPool();
        this.decoder = new RespDecoder(config.getDecoderLimits());
        this.interpreter = new CommandInterpreter();
    }

    public void serve() throws IOException {
        try (ServerSocketChannel channel = ServerSocketChannel.open()) {
            channel.socket().setReuseAddress(true);
            channel.bind(new InetSocketAddress(config.getBindAddress(), config.getPort()));
            serverChannel = channel;
            started.countDown();
            info("Ready to accept connections on %s (%s)", channel.getLocalAddress(), config);
            while (!Thread.currentThread().isInterrupted()) {
                SocketChannel accepted;
                try {
                    accepted = channel.accept();
                } catch (ClosedChannelException e) {
                    debug("Listening socket closed, no longer accepting connections");
                    break;
                }
                ClientConnection client = new ClientConnection(accepted);
                info("Accepted new connection: %s", client);
                clientListeners.submit(new ConnectionHandler(client, decoder, interpreter,
                        config.getErrorReplyPolicy()));
            }
        } finally {
            started.countDown();
            debug("Server on port %d has been closed.", config.getPort());
        }
    }

    /**
     * Blocks until the server is listening and returns the bound port, which differs from the
     * configured one when port 0 was requested.
     */
    public int awaitStarted(long timeout, TimeUnit unit) throws InterruptedException {
        if (!started.await(timeout, unit) || serverChannel == null) {
            throw new RedisException("Server did not start listening within " + timeout + " " + unit);
        }
        return serverChannel.socket().getLocalPort();
    }

    @Override
    public void close() {
        ServerSocketChannel channel = serverChannel;
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                throw new RedisException("Failed to close listening socket", e);
            }
        }
        clientListeners.shutdownNow();
        debug("Server has been closed.");
    }
}

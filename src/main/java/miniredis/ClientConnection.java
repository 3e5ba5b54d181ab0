package miniredis;

import miniredis.resp.RespInput;
import miniredis.resp.StreamRespInput;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;

import static miniredis.util.Logger.error;

/**
 * One accepted client. Reads go through a buffered stream so a frame may arrive over
 * several socket reads and one read may carry several frames.
 */
public class ClientConnection implements AutoCloseable {
    private final SocketChannel socketChannel;
    private final RespInput input;
    private final String description;

    public ClientConnection(SocketChannel socketChannel) {
        this.socketChannel = socketChannel;
        this.input = new StreamRespInput(Channels.newInputStream(socketChannel));
        SocketAddress remote = socketChannel.socket().getRemoteSocketAddress();
        this.description = remote == null ? "unconnected" : remote.toString();
    }

    public boolean isConnected() {
        return socketChannel.isOpen() && socketChannel.isConnected();
    }

    public RespInput input() {
        return input;
    }

    public void write(byte[] message) throws IOException {
        ByteBuffer buffer = ByteBuffer.wrap(message);
        while (buffer.hasRemaining()) {
            socketChannel.write(buffer);
        }
    }

    @Override
    public void close() {
        try {
            socketChannel.close();
        } catch (IOException e) {
            error("Got exception while closing %s: %s", this, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Client[" + description + ']';
    }
}

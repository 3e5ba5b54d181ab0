package miniredis;

import miniredis.command.CommandInterpreter;
import miniredis.config.ErrorReplyPolicy;
import miniredis.resp.RespDecoder;
import miniredis.resp.RespInput;
import miniredis.resp.RespValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConnectionHandlerTest {

    private final ByteArrayOutputStream log = new ByteArrayOutputStream();
    private PrintStream originalErr;
    private ServerSocketChannel listener;
    private SocketChannel peer;
    private ClientConnection client;

    @BeforeEach
    void connect() throws Exception {
        originalErr = System.err;
        System.setErr(new PrintStream(log, true, StandardCharsets.UTF_8));
        listener = ServerSocketChannel.open();
        listener.bind(new InetSocketAddress("127.0.0.1", 0));
        peer = SocketChannel.open(listener.getLocalAddress());
        client = new ClientConnection(listener.accept());
    }

    @AfterEach
    void disconnect() throws Exception {
        System.setErr(originalErr);
        client.close();
        peer.close();
        listener.close();
    }

    @Test
    void testUnexpectedFailureIsLoggedAndClosesConnection() throws Exception {
        RespDecoder failingDecoder = new RespDecoder() {
            @Override
            public Optional<RespValue> next(RespInput input) {
                throw new IllegalStateException("decoder is broken");
            }
        };
        ConnectionHandler handler = new ConnectionHandler(client, failingDecoder, new CommandInterpreter(),
                ErrorReplyPolicy.DROP);

        assertThatCode(handler::run).doesNotThrowAnyException();

        assertThat(peer.read(ByteBuffer.allocate(1))).isEqualTo(-1);
        assertThat(log.toString(StandardCharsets.UTF_8))
                .contains("ERROR: Unexpected error serving")
                .contains("decoder is broken")
                .contains("INFO: Client disconnected");
    }

    @Test
    void testServesUntilPeerCloses() throws Exception {
        peer.write(ByteBuffer.wrap("*1\r\n$4\r\nPING\r\n".getBytes(StandardCharsets.US_ASCII)));
        peer.shutdownOutput();
        new ConnectionHandler(client, new RespDecoder(), new CommandInterpreter(), ErrorReplyPolicy.DROP).run();

        ByteBuffer reply = ByteBuffer.allocate(16);
        while (peer.read(reply) > 0) {
            // drain until the server closes its side
        }
        reply.flip();
        assertThat(StandardCharsets.US_ASCII.decode(reply).toString()).isEqualTo("+PONG\r\n");
    }
}

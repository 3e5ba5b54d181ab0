package miniredis;

import miniredis.command.CommandInterpreter;
import miniredis.command.InterpretException;
import miniredis.command.RedisCommand;
import miniredis.command.Unknown;
import miniredis.config.ErrorReplyPolicy;
import miniredis.resp.DecodeError;
import miniredis.resp.RespDecodeException;
import miniredis.resp.RespDecoder;
import miniredis.resp.RespInput;
import miniredis.resp.RespValue;

import java.io.EOFException;
import java.io.IOException;
import java.nio.channels.ClosedChannelException;
import java.util.Optional;

import static miniredis.util.Logger.debug;
import static miniredis.util.Logger.error;
import static miniredis.util.Logger.info;
import static miniredis.util.Logger.warn;

/**
 * Request/reply loop of a single connection. Each reply is written in full before the
 * next frame is read.
 */
public class ConnectionHandler implements Runnable {
    private static final byte[] UNKNOWN_COMMAND_REPLY = new Unknown().encode();

    private final ClientConnection client;
    private final RespDecoder decoder;
    private final CommandInterpreter interpreter;
    private final ErrorReplyPolicy errorReplyPolicy;

    public ConnectionHandler(ClientConnection client, RespDecoder decoder, CommandInterpreter interpreter,
                             ErrorReplyPolicy errorReplyPolicy) {
        this.client = client;
        this.decoder = decoder;
        this.interpreter = interpreter;
        this.errorReplyPolicy = errorReplyPolicy;
    }

    @Override
    public void run() {
        try (client) {
            serve();
        } catch (EOFException e) {
            debug("%s closed the connection mid-frame: %s", client, e.getMessage());
        } catch (ClosedChannelException e) {
            debug("%s was closed by the server", client);
        } catch (IOException e) {
            warn("Error serving %s: %s", client, e.getMessage());
        } catch (RuntimeException e) {
            error("Unexpected error serving %s: %s", client, e);
        }
        info("Client disconnected: %s", client);
    }

    void serve() throws IOException {
        RespInput input = client.input();
        while (client.isConnected()) {
            Optional<RespValue> value;
            try {
                value = decoder.next(input);
            } catch (RespDecodeException e) {
                warn("Dropping frame from %s, %s: %s", client, e.getError(), e.getMessage());
                rejectRequest();
                if (e.getError() == DecodeError.LIMIT_EXCEEDED) {
                    info("Closing %s after oversized frame", client);
                    return;
                }
                continue;
            }
            if (value.isEmpty()) {
                return;
            }

            RedisCommand command;
            try {
                command = interpreter.interpret(value.get());
            } catch (InterpretException e) {
                warn("Rejected request from %s, %s: %s", client, e.getError(), e.getMessage());
                rejectRequest();
                continue;
            }
            debug("%s, Received command %s", client, command);
            command.handle(client);
        }
    }

    private void rejectRequest() throws IOException {
        if (errorReplyPolicy == ErrorReplyPolicy.REPLY) {
            client.write(UNKNOWN_COMMAND_REPLY);
        }
    }
}

package miniredis.command;

import miniredis.ClientConnection;

import java.io.IOException;

import static miniredis.util.Logger.debug;

public abstract sealed class AbstractRedisCommand implements RedisCommand permits Echo, Ping, Unknown {

    @Override
    public final byte[] encode() {
        return response().serialize();
    }

    @Override
    public final void handle(ClientConnection client) throws IOException {
        byte[] reply = encode();
        debug("%s, Sending response to %s: %d bytes", this, client, reply.length);
        client.write(reply);
    }
}

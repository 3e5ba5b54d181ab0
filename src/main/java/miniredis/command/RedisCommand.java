package miniredis.command;

import miniredis.ClientConnection;
import miniredis.resp.RespValue;

import java.io.IOException;

public sealed interface RedisCommand permits AbstractRedisCommand {

    /**
     * The frame a client sends to invoke this command; interpreting it yields an equal command.
     */
    RespValue request();

    RespValue response();

    byte[] encode();

    void handle(ClientConnection client) throws IOException;
}

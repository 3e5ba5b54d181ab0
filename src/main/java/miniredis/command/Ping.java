package miniredis.command;

import miniredis.resp.RespArray;
import miniredis.resp.RespBulkString;
import miniredis.resp.RespSimpleString;
import miniredis.resp.RespValue;

import java.util.List;

import static miniredis.config.Constants.PONG;

public final class Ping extends AbstractRedisCommand {
    private static final RespSimpleString PONG_RESPONSE = new RespSimpleString(PONG);

    @Override
    public RespValue request() {
        return new RespArray(List.of(new RespBulkString(CommandType.PING.name())));
    }

    @Override
    public RespValue response() {
        return PONG_RESPONSE;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || obj != null && obj.getClass() == this.getClass();
    }

    @Override
    public int hashCode() {
        return 1;
    }

    @Override
    public String toString() {
        return "Ping[]";
    }
}

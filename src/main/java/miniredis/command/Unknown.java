package miniredis.command;

import miniredis.resp.RespError;
import miniredis.resp.RespValue;

import static miniredis.config.Constants.UNKNOWN_COMMAND_ERROR;

/**
 * Reply-only command for input that is understood as a frame but not as a command,
 * such as an error frame sent by the client.
 */
public final class Unknown extends AbstractRedisCommand {
    private static final RespError UNKNOWN_RESPONSE = new RespError(UNKNOWN_COMMAND_ERROR);

    @Override
    public RespValue request() {
        return UNKNOWN_RESPONSE;
    }

    @Override
    public RespValue response() {
        return UNKNOWN_RESPONSE;
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this || obj != null && obj.getClass() == this.getClass();
    }

    @Override
    public int hashCode() {
        return 2;
    }

    @Override
    public String toString() {
        return "Unknown[]";
    }
}

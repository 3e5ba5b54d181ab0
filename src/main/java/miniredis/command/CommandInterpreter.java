package miniredis.command;

import miniredis.resp.RespArray;
import miniredis.resp.RespBulkString;
import miniredis.resp.RespError;
import miniredis.resp.RespValue;

import static miniredis.util.Logger.warn;

/**
 * Maps a decoded frame onto a {@link RedisCommand}. Pure function of its input.
 */
public class CommandInterpreter {
    private static final Ping PING_COMMAND = new Ping();
    private static final Unknown UNKNOWN_COMMAND = new Unknown();

    public RedisCommand interpret(RespValue value) {
        if (value instanceof RespError error) {
            warn("Client sent an error frame: %s", error.value());
            return UNKNOWN_COMMAND;
        }
        if (!(value instanceof RespArray array)) {
            throw new InterpretException(InterpretError.NOT_A_COMMAND,
                    "Expected an array but got " + value.getClass().getSimpleName());
        }
        if (array.isEmpty()) {
            throw new InterpretException(InterpretError.NOT_A_COMMAND, "input array is empty");
        }
        if (!(array.get(0) instanceof RespBulkString name)) {
            throw new InterpretException(InterpretError.NOT_A_COMMAND,
                    "invalid command type: " + array.get(0).getClass().getSimpleName());
        }

        String commandName = name.asText();
        CommandType type = CommandType.fromName(commandName)
                .orElseThrow(() -> new InterpretException(InterpretError.UNKNOWN_COMMAND,
                        "unsupported command: " + commandName));
        return switch (type) {
            case PING -> PING_COMMAND;
            case ECHO -> echo(array);
        };
    }

    private Echo echo(RespArray array) {
        if (array.size() < 2) {
            throw new InterpretException(InterpretError.ARITY_ERROR, "ECHO requires a message argument");
        }
        if (array.size() > 2) {
            throw new InterpretException(InterpretError.ARITY_ERROR,
                    "ECHO accepts a single argument, got " + (array.size() - 1));
        }
        if (!(array.get(1) instanceof RespBulkString message)) {
            throw new InterpretException(InterpretError.TYPE_ERROR,
                    "ECHO argument must be a bulk string, got " + array.get(1).getClass().getSimpleName());
        }
        return new Echo(message.asText());
    }
}

package miniredis.command;

import miniredis.exception.RedisException;

public class InterpretException extends RedisException {
    private final InterpretError error;

    public InterpretException(InterpretError error, String message) {
        super(message);
        this.error = error;
    }

    public InterpretError getError() {
        return error;
    }
}

package miniredis.resp;

import miniredis.exception.RedisException;

/**
 * A frame that cannot be decoded. The partially read frame is discarded and the
 * decoder makes no attempt to find the start of the next one.
 */
public class RespDecodeException extends RedisException {
    private final DecodeError error;

    public RespDecodeException(DecodeError error, String message) {
        super(message);
        this.error = error;
    }

    public RespDecodeException(DecodeError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public DecodeError getError() {
        return error;
    }
}

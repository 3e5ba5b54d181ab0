package miniredis.resp;

public enum DecodeError {
    UNKNOWN_TYPE,
    BAD_INTEGER,
    BAD_LENGTH,
    BAD_TEXT,
    LIMIT_EXCEEDED
}

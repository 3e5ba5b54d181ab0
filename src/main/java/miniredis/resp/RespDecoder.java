package miniredis.resp;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes RESP2 frames from a {@link RespInput}. Instances hold no per-frame state and can
 * be shared between connections.
 */
public class RespDecoder {
    private final DecoderLimits limits;

    public RespDecoder() {
        this(DecoderLimits.DEFAULTS);
    }

    public RespDecoder(DecoderLimits limits) {
        this.limits = limits;
    }

    public List<RespValue> parse(byte[] input) throws IOException {
        if (input == null || input.length == 0) {
            throw new IllegalArgumentException("Input cannot be null or empty");
        }

        RespInput stream = new StreamRespInput(new ByteArrayInputStream(input));
        List<RespValue> values = new ArrayList<>();
        Optional<RespValue> value;
        while ((value = next(stream)).isPresent()) {
            values.add(value.get());
        }
        return values;
    }

    /**
     * Decodes the next frame, or returns empty if the stream ends cleanly before a type byte.
     */
    public Optional<RespValue> next(RespInput input) throws IOException {
        int type = input.read();
        if (type < 0) {
            return Optional.empty();
        }
        return Optional.of(decode((byte) type, input, 0));
    }

    public RespValue decode(RespInput input) throws IOException {
        return decode(input.readByte(), input, 0);
    }

    private RespValue decode(byte type, RespInput input, int depth) throws IOException {
        return switch (type) {
            case '+' -> new RespSimpleString(text(input));
            case '-' -> new RespError(text(input));
            case ':' -> integer(input);
            case '$' -> bulkString(input);
            case '*' -> array(input, depth + 1);
            default -> throw unknownType(type, input);
        };
    }

    private String text(RespInput input) throws IOException {
        String line = new String(input.readLine(limits.maxLineLength()), StandardCharsets.UTF_8).stripTrailing();
        if (line.indexOf('\r') >= 0) {
            throw new RespDecodeException(DecodeError.BAD_TEXT, "Status line contains a bare CR");
        }
        return line;
    }

    private RespInteger integer(RespInput input) throws IOException {
        String line = new String(input.readLine(limits.maxLineLength()), StandardCharsets.US_ASCII);
        try {
            return new RespInteger(Long.parseLong(line));
        } catch (NumberFormatException e) {
            throw new RespDecodeException(DecodeError.BAD_INTEGER, "Invalid integer: '" + line + "'", e);
        }
    }

    private RespBulkString bulkString(RespInput input) throws IOException {
        int length = length(input, "bulk string", limits.maxBulkLength());
        byte[] payload = input.readExactly(length);
        input.readExactly(2);
        return new RespBulkString(payload);
    }

    private RespArray array(RespInput input, int depth) throws IOException {
        if (depth > limits.maxDepth()) {
            throw new RespDecodeException(DecodeError.LIMIT_EXCEEDED,
                    "Array nesting exceeds " + limits.maxDepth() + " levels");
        }
        int count = length(input, "array", limits.maxArrayLength());
        List<RespValue> values = new ArrayList<>(Math.min(count, 1024));
        for (int i = 0; i < count; i++) {
            values.add(decode(input.readByte(), input, depth));
        }
        return new RespArray(values);
    }

    // $-1 and *-1 (null bulk string / null array) are rejected along with any other negative length
    private int length(RespInput input, String kind, int max) throws IOException {
        String line = new String(input.readLine(limits.maxLineLength()), StandardCharsets.US_ASCII);
        long length;
        try {
            length = Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespDecodeException(DecodeError.BAD_LENGTH, "Invalid " + kind + " length: '" + line + "'", e);
        }
        if (length < 0) {
            throw new RespDecodeException(DecodeError.BAD_LENGTH, "Negative " + kind + " length: " + length);
        }
        if (length > max) {
            throw new RespDecodeException(DecodeError.LIMIT_EXCEEDED,
                    "The " + kind + " length " + length + " exceeds " + max);
        }
        return (int) length;
    }

    private RespDecodeException unknownType(byte type, RespInput input) {
        String shown = type >= 0x20 && type < 0x7f ? "'" + (char) type + "'" : String.format("0x%02x", type & 0xff);
        try {
            String rest = new String(input.readLine(limits.maxLineLength()), StandardCharsets.UTF_8);
            return new RespDecodeException(DecodeError.UNKNOWN_TYPE,
                    "Invalid RESP type byte " + shown + ", rest of line: '" + rest + "'");
        } catch (IOException | RespDecodeException e) {
            RespDecodeException error = new RespDecodeException(DecodeError.UNKNOWN_TYPE,
                    "Invalid RESP type byte " + shown);
            error.addSuppressed(e);
            return error;
        }
    }
}

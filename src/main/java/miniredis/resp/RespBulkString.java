package miniredis.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Length-prefixed binary string. The payload may hold any byte, CR and LF included.
 */
public final class RespBulkString implements RespValue {
    private final byte[] value;

    public RespBulkString(byte[] value) {
        this.value = value.clone();
    }

    public RespBulkString(String value) {
        this.value = value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length + 16);
        SerializerUtils.writeHeader(out, (byte) '$', value.length);
        out.writeBytes(value);
        out.write(SerializerUtils.CR);
        out.write(SerializerUtils.LF);
        return out.toByteArray();
    }

    public byte[] value() {
        return value.clone();
    }

    public int length() {
        return value.length;
    }

    /**
     * Decodes the payload as UTF-8, replacing malformed sequences with U+FFFD.
     */
    public String asText() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespBulkString) obj;
        return Arrays.equals(this.value, that.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "RespBulkString[" +
               "value=" + asText() + ", " +
               "length=" + value.length + ']';
    }
}

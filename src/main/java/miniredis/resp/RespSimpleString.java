package miniredis.resp;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public final class RespSimpleString implements RespValue {
    private final String value;

    public RespSimpleString(String value) {
        if (value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Simple string cannot contain CR or LF");
        }
        this.value = value;
    }

    @Override
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length() + 3);
        SerializerUtils.writeLine(out, (byte) '+', value.getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespSimpleString) obj;
        return Objects.equals(this.value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "RespSimpleString[" +
               "value=" + value + ']';
    }
}

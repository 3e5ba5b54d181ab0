package miniredis.resp;

import java.io.ByteArrayOutputStream;

public final class RespInteger implements RespValue {
    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    @Override
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(23);
        SerializerUtils.writeHeader(out, (byte) ':', value);
        return out.toByteArray();
    }

    public long value() {
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespInteger) obj;
        return this.value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "RespInteger[" +
               "value=" + value + ']';
    }
}

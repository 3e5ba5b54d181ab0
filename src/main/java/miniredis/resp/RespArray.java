package miniredis.resp;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class RespArray implements RespValue {
    private final List<RespValue> values;

    public RespArray(List<RespValue> values) {
        this.values = List.copyOf(values);
    }

    @Override
    public byte[] serialize() {
        ByteArrayOutputStream header = new ByteArrayOutputStream(16);
        SerializerUtils.writeHeader(header, (byte) '*', values.size());
        List<byte[]> parts = new ArrayList<>(values.size() + 1);
        parts.add(header.toByteArray());
        values.forEach(value -> parts.add(value.serialize()));
        return SerializerUtils.mergeByteArrays(parts);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public RespValue get(int index) {
        return values.get(index);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (RespArray) obj;
        return Objects.equals(this.values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "RespArray[" +
               "values=" + values + ']';
    }
}

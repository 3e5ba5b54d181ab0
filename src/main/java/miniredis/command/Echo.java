package miniredis.command;

import miniredis.resp.RespArray;
import miniredis.resp.RespBulkString;
import miniredis.resp.RespValue;

import java.util.List;
import java.util.Objects;

public final class Echo extends AbstractRedisCommand {
    private final String text;

    public Echo(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    public RespValue request() {
        return new RespArray(List.of(new RespBulkString(CommandType.ECHO.name()), new RespBulkString(text)));
    }

    // length is taken from the UTF-8 bytes, not from text.length()
    @Override
    public RespValue response() {
        return new RespBulkString(text);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (Echo) obj;
        return Objects.equals(this.text, that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return "Echo[" +
               "text=" + text + ']';
    }
}

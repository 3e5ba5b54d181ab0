package miniredis.resp;

import java.io.ByteArrayOutputStream;
import java.util.List;

final class SerializerUtils {
    static final byte CR = '\r';
    static final byte LF = '\n';

    private SerializerUtils() {

    }

    /**
     * Writes {@code tag}, the ASCII decimal form of {@code value} and CRLF. Used for
     * integer frames as well as bulk string and array headers.
     */
    static void writeHeader(ByteArrayOutputStream out, byte tag, long value) {
        out.write(tag);
        writeDecimal(out, value);
        out.write(CR);
        out.write(LF);
    }

    static void writeLine(ByteArrayOutputStream out, byte tag, byte[] text) {
        out.write(tag);
        out.writeBytes(text);
        out.write(CR);
        out.write(LF);
    }

    private static void writeDecimal(ByteArrayOutputStream out, long value) {
        if (value == 0) {
            out.write('0');
            return;
        }
        if (value < 0) {
            out.write('-');
        }
        byte[] digits = new byte[19];
        int index = digits.length;
        long remaining = value;
        while (remaining != 0) {
            // remainder carries the sign of value
            int digit = (int) (remaining % 10);
            digits[--index] = (byte) ('0' + Math.abs(digit));
            remaining /= 10;
        }
        out.write(digits, index, digits.length - index);
    }

    static byte[] mergeByteArrays(List<byte[]> arrays) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        arrays.forEach(out::writeBytes);
        return out.toByteArray();
    }
}

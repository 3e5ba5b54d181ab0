package miniredis.resp;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import static miniredis.resp.SerializerUtils.CR;
import static miniredis.resp.SerializerUtils.LF;

public class StreamRespInput implements RespInput {
    private static final int BUFFER_SIZE = 8192;

    private final InputStream in;

    public StreamRespInput(InputStream in) {
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in, BUFFER_SIZE);
    }

    @Override
    public int read() throws IOException {
        return in.read();
    }

    @Override
    public byte readByte() throws IOException {
        int b = in.read();
        if (b < 0) {
            throw new EOFException("Unexpected end of stream");
        }
        return (byte) b;
    }

    @Override
    public byte[] readLine(int maxLength) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream(64);
        while (true) {
            int b = in.read();
            if (b < 0) {
                throw new EOFException("Unexpected end of stream while reading line");
            }
            if (b == LF) {
                break;
            }
            // room for the CR of the terminator, checked again once it is stripped
            if (line.size() > maxLength) {
                throw new RespDecodeException(DecodeError.LIMIT_EXCEEDED,
                        "Line exceeds " + maxLength + " bytes");
            }
            line.write(b);
        }
        byte[] bytes = line.toByteArray();
        if (bytes.length > 0 && bytes[bytes.length - 1] == CR) {
            bytes = Arrays.copyOf(bytes, bytes.length - 1);
        }
        if (bytes.length > maxLength) {
            throw new RespDecodeException(DecodeError.LIMIT_EXCEEDED,
                    "Line exceeds " + maxLength + " bytes");
        }
        return bytes;
    }

    @Override
    public byte[] readExactly(int length) throws IOException {
        byte[] bytes = in.readNBytes(length);
        if (bytes.length < length) {
            throw new EOFException("Expected " + length + " bytes but stream ended after " + bytes.length);
        }
        return bytes;
    }
}

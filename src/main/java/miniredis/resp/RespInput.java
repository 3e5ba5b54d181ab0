package miniredis.resp;

import java.io.IOException;

/**
 * Byte source the decoder pulls frames from. Implementations block until the requested
 * bytes are available and throw {@link java.io.EOFException} if the stream ends first.
 */
public interface RespInput {

    /**
     * @return the next byte as 0..255, or -1 at a clean end of stream
     */
    int read() throws IOException;

    byte readByte() throws IOException;

    /**
     * Reads up to and including the next LF and returns the line without its terminator
     * (a CR right before the LF is dropped as well).
     */
    byte[] readLine(int maxLength) throws IOException;

    byte[] readExactly(int length) throws IOException;
}

package miniredis.resp;

/**
 * One decoded RESP2 frame. Values are immutable and built fresh for every decode call.
 */
public sealed interface RespValue permits RespSimpleString, RespError, RespInteger, RespBulkString, RespArray {

    /**
     * @return the exact wire form of this value, terminators included
     */
    byte[] serialize();
}

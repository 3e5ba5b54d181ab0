package miniredis.resp;

public record DecoderLimits(int maxDepth, int maxArrayLength, int maxBulkLength, int maxLineLength) {
    public static final DecoderLimits DEFAULTS = new DecoderLimits(32, 1024 * 1024, 512 * 1024 * 1024, 64 * 1024);

    public DecoderLimits {
        if (maxDepth < 1 || maxArrayLength < 0 || maxBulkLength < 0 || maxLineLength < 1) {
            throw new IllegalArgumentException("Invalid decoder limits: depth=" + maxDepth
                                               + ", array=" + maxArrayLength
                                               + ", bulk=" + maxBulkLength
                                               + ", line=" + maxLineLength);
        }
    }
}

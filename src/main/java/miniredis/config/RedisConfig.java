package miniredis.config;

import miniredis.exception.RedisException;
import miniredis.resp.DecoderLimits;
import miniredis.util.Logger;

import java.util.Locale;

public class RedisConfig {
    private String bindAddress = Constants.DEFAULT_BIND_ADDRESS;
    private int port = Constants.DEFAULT_PORT;
    private ErrorReplyPolicy errorReplyPolicy = ErrorReplyPolicy.DROP;
    private int maxDepth = DecoderLimits.DEFAULTS.maxDepth();
    private int maxArrayLength = DecoderLimits.DEFAULTS.maxArrayLength();
    private int maxBulkLength = DecoderLimits.DEFAULTS.maxBulkLength();
    private Logger.Level logLevel = Logger.Level.INFO;

    public RedisConfig(String[] args) {
        if (args == null) {
            return;
        }
        for (int i = 0; i < args.length; i += 2) {
            String name = args[i];
            if (!name.startsWith("--")) {
                throw new RedisException("Unexpected argument: " + name);
            }
            if (i + 1 >= args.length) {
                throw new RedisException("Missing value for '" + name.substring(2) + "' argument");
            }
            String value = args[i + 1];
            switch (name.substring(2).toLowerCase(Locale.ROOT)) {
                case "bind" -> bindAddress = value;
                case "port" -> port = parsePort(value);
                case "error-policy" -> errorReplyPolicy = parsePolicy(value);
                case "max-depth" -> maxDepth = parsePositive(name, value);
                case "max-array-length" -> maxArrayLength = parsePositive(name, value);
                case "max-bulk-length" -> maxBulkLength = parsePositive(name, value);
                case "log-level" -> logLevel = parseLogLevel(value);
                default -> throw new RedisException("Unknown argument: " + name);
            }
        }
    }

    private static int parsePort(String value) {
        try {
            int portValue = Integer.parseInt(value);
            if (portValue < 0 || portValue > 65535) {
                throw new RedisException("Port number must be between 0 and 65535");
            }
            return portValue;
        } catch (NumberFormatException e) {
            throw new RedisException("Invalid port number: " + value);
        }
    }

    private static int parsePositive(String name, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed < 1) {
                throw new RedisException("Value of '" + name.substring(2) + "' must be positive: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new RedisException("Invalid value for '" + name.substring(2) + "': " + value);
        }
    }

    private static ErrorReplyPolicy parsePolicy(String value) {
        try {
            return ErrorReplyPolicy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RedisException("Invalid error policy: " + value + " (expected drop or reply)");
        }
    }

    private static Logger.Level parseLogLevel(String value) {
        try {
            return Logger.parseLevel(value);
        } catch (IllegalArgumentException e) {
            throw new RedisException("Invalid log level: " + value);
        }
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public int getPort() {
        return port;
    }

    public ErrorReplyPolicy getErrorReplyPolicy() {
        return errorReplyPolicy;
    }

    public Logger.Level getLogLevel() {
        return logLevel;
    }

    public DecoderLimits getDecoderLimits() {
        return new DecoderLimits(maxDepth, maxArrayLength, maxBulkLength, DecoderLimits.DEFAULTS.maxLineLength());
    }

    @Override
    public String toString() {
        return "RedisConfig{" +
               "bind='" + bindAddress + '\'' +
               ", port=" + port +
               ", errorReplyPolicy=" + errorReplyPolicy +
               ", limits=" + getDecoderLimits() +
               '}';
    }
}

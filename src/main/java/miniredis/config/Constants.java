package miniredis.config;

public class Constants {

    private Constants() {

    }

    public static final String PONG = "PONG";
    public static final String UNKNOWN_COMMAND_ERROR = "ERROR_UNKNOWN_COMMAND";
    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
}

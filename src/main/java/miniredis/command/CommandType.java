package miniredis.command;

import java.util.Locale;
import java.util.Optional;

public enum CommandType {
    PING("ping"),
    ECHO("echo");

    private final String code;

    CommandType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<CommandType> fromName(String name) {
        String lowerCase = name.toLowerCase(Locale.ROOT);
        for (CommandType type : values()) {
            if (type.getCode().equals(lowerCase)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}

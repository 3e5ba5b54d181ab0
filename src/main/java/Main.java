import miniredis.MiniRedis;
import miniredis.config.RedisConfig;
import miniredis.util.Logger;

import static miniredis.util.Logger.error;

public class Main {
    public static void main(String[] args) {
        RedisConfig config;
        try {
            config = new RedisConfig(args);
        } catch (RuntimeException e) {
            error("Invalid arguments: %s", e.getMessage());
            System.exit(2);
            return;
        }
        Logger.setLevel(config.getLogLevel());
        try (MiniRedis server = new MiniRedis(config)) {
            server.serve();
        } catch (Exception e) {
            error("Failed to start server: %s", e.getMessage());
            System.exit(1);
        }
    }
}

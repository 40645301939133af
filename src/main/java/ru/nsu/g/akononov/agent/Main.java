package ru.nsu.g.akononov.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import ru.nsu.g.akononov.agent.api.ApiOptions;

import java.time.Duration;

@SpringBootApplication
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class.getSimpleName());

    private static final String USAGE = "Usage: agent [--listen host:port] [--shutdown-secs N]";

    public static void main(String[] args) {
        ApiOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Bad arguments: " + e.getMessage());
            System.err.println(USAGE);
            return;
        }

        SpringApplication application = new SpringApplication(Main.class);
        application.setDefaultProperties(options.toProperties());
        logger.info("Starting control API on {}:{}", options.getHost(), options.getPort());
        try {
            application.run();
        } catch (RuntimeException exception) {
            logger.error("Cannot start control API on {}:{}", options.getHost(), options.getPort(), exception);
        }
    }

    static ApiOptions parseArgs(String[] args) {
        ApiOptions.Builder builder = ApiOptions.builder();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("missing value for " + arg);
            }
            String value = args[++i];

            switch (arg) {
                case "--listen":
                    builder.address(value);
                    break;
                case "--shutdown-secs":
                    builder.shutdownTimeout(Duration.ofSeconds(parseSeconds(value)));
                    break;
                default:
                    throw new IllegalArgumentException("unknown option " + arg);
            }
        }
        return builder.build();
    }

    private static long parseSeconds(String value) {
        try {
            long seconds = Long.parseLong(value);
            if (seconds < 0) {
                throw new IllegalArgumentException("--shutdown-secs must not be negative");
            }
            return seconds;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--shutdown-secs expects a number, got " + value);
        }
    }
}

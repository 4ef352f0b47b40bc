package net.readtrack;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Reading activity service: timeline feed, timeline rebuilds and per-user statistics.
 */
@SpringBootApplication
@EnableAsync
public class ReadTrackApplication {

    private static final Logger log = LoggerFactory.getLogger(ReadTrackApplication.class);

    public static void main(String[] args) {
        loadDotEnvFile(Paths.get(".env"));
        SpringApplication.run(ReadTrackApplication.class, args);
    }

    /**
     * UTC clock shared by event timestamps and stats freshness checks.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Copies entries of a {@code .env} file into system properties unless the environment
     * already defines them.
     */
    static void loadDotEnvFile(Path envFile) {
        if (!Files.exists(envFile)) {
            return;
        }
        try {
            Properties props = new Properties();
            try (InputStream is = Files.newInputStream(envFile)) {
                props.load(is);
            }
            for (String key : props.stringPropertyNames()) {
                if (System.getenv(key) == null && System.getProperty(key) == null) {
                    System.setProperty(key, props.getProperty(key));
                }
            }
        } catch (IOException | SecurityException e) {
            log.warn("Failed to load .env file; aborting startup", e);
            throw new IllegalStateException("Failed to load .env file", e);
        }
    }
}

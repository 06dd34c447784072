package guraa.refcompare;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;

import java.time.Duration;
import java.time.Instant;

/**
 * Main application class for Reference Compare.
 */
@Slf4j
@SpringBootApplication
public class RefCompareApplication {

    public static void main(String[] args) {
        Instant startTime = Instant.now();

        SpringApplication.run(RefCompareApplication.class, args);

        Duration startupTime = Duration.between(startTime, Instant.now());
        logStartupInfo(startupTime);
    }

    /**
     * Log information about the application startup.
     *
     * @param startupTime The time taken to start up
     */
    private static void logStartupInfo(Duration startupTime) {
        log.info("==========================================================");
        log.info("Reference Compare application started in {}", formatDuration(startupTime));
        log.info("  Java: {}", System.getProperty("java.version"));
        log.info("  OS: {} {}", System.getProperty("os.name"), System.getProperty("os.version"));
        log.info("  JVM Max memory: {} MB", Runtime.getRuntime().maxMemory() / (1024 * 1024));
        log.info("==========================================================");
    }

    /**
     * Format a duration to a readable string.
     *
     * @param duration The duration
     * @return A formatted string (e.g., "2m 30.000s")
     */
    static String formatDuration(Duration duration) {
        long minutes = duration.toMinutes();
        long seconds = duration.toSecondsPart();
        long millis = duration.toMillisPart();

        if (minutes > 0) {
            return String.format("%dm %d.%03ds", minutes, seconds, millis);
        }
        return String.format("%d.%03ds", seconds, millis);
    }

    @EventListener
    public void onApplicationEvent(ContextClosedEvent event) {
        log.info("Application is shutting down");
    }
}

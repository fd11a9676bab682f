package io.github.yok.betterlogger;

import io.github.yok.betterlogger.instrument.CallSite;
import io.github.yok.betterlogger.instrument.CheckedBiFunction;
import io.github.yok.betterlogger.instrument.CheckedFunction;
import io.github.yok.betterlogger.instrument.CheckedSupplier;
import io.github.yok.betterlogger.instrument.Instrumentation;
import java.util.Arrays;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Demo application that instruments a few sample functions with the configured
 * {@link BetterLogger}.
 *
 * <p>
 * Runs {@code add_numbers(5, 3)}, {@code greet("Alice")}, {@code greet("Bob", greeting="Hi")} and
 * {@code slow_function()}; the records go to the log file configured under {@code betterlogger.*}
 * in {@code application.yml}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final BetterLogger logger;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Runs the sample calls.
     *
     * @param args command-line arguments (ignored)
     */
    @Override
    public void run(String... args) {
        log.info("Demo started. Args: {}", Arrays.toString(args));
        Instrumentation instrumentation = logger.log();

        CheckedBiFunction<Integer, Integer, Integer, RuntimeException> addNumbers =
                instrumentation.wrap("add_numbers", (Integer a, Integer b) -> addNumbers(a, b));
        CheckedFunction<String, String, RuntimeException> greet =
                instrumentation.wrap("greet", (String name) -> greet(name, "Hello"));
        CheckedSupplier<String, RuntimeException> slowFunction =
                instrumentation.wrap("slow_function", () -> slowFunction());

        addNumbers.apply(5, 3);
        greet.apply("Alice");
        instrumentation.invoke(
                CallSite.builder("greet").arg("Bob").namedArg("greeting", "Hi").build(),
                () -> greet("Bob", "Hi"));
        slowFunction.get();

        log.info("Demo completed. Log file: {}", logger.getConfig().getLogFilePath());
    }

    int addNumbers(int a, int b) {
        logger.logging("Adding " + a + " and " + b, LogLevel.DEBUG);
        return a + b;
    }

    String greet(String name, String greeting) {
        return greeting + ", " + name + "!";
    }

    String slowFunction() {
        log.debug("Starting slow function...");
        return "Done!";
    }
}

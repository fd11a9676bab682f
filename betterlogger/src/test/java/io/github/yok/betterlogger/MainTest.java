package io.github.yok.betterlogger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.betterlogger.config.LoggerConfig;
import io.github.yok.betterlogger.testutil.LogLines;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedConstruction;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);

                    Object arg0 = ctx.arguments().get(0);
                    assertTrue(arg0 instanceof Class<?>[]);
                    Class<?>[] sources = (Class<?>[]) arg0;
                    assertEquals(1, sources.length);
                    assertEquals(Main.class, sources[0]);
                })) {

            Main.main(new String[] {"demo"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("demo"));
        }
    }

    @Test
    void run_正常ケース_サンプル関数を実行する_呼び出し記録がログファイルに出力されること()
            throws Exception {
        BetterLogger logger =
                new BetterLogger(LoggerConfig.builder().logDir(tempDir.toString()).build());

        new Main(logger).run();

        List<String> records = LogLines.records(tempDir.resolve("System.log"));
        assertEquals(List.of(
                "INFO - Calling function: add_numbers",
                "INFO - Positional arguments: [5, 3]",
                "DEBUG - Adding 5 and 3",
                "INFO - Return value: 8"),
                records.subList(0, 5).stream().filter(r -> !r.contains("Execution time"))
                        .collect(Collectors.toList()));
        assertTrue(records.contains("INFO - Return value: Hello, Alice!"));
        assertTrue(records.contains("INFO - Keyword arguments: {greeting=Hi}"));
        assertTrue(records.contains("INFO - Return value: Hi, Bob!"));
        assertTrue(records.contains("INFO - Calling function: slow_function"));
        assertTrue(records.contains("INFO - Return value: Done!"));
        assertEquals(4, records.stream().filter(r -> r.startsWith("INFO - Execution time: "))
                .count());
    }

    @Test
    void greet_正常ケース_挨拶文が生成されること() {
        Main main = new Main(
                new BetterLogger(LoggerConfig.builder().logDir(tempDir.toString()).build()));

        assertEquals("Hi, Bob!", main.greet("Bob", "Hi"));
        assertEquals("Done!", main.slowFunction());
    }
}

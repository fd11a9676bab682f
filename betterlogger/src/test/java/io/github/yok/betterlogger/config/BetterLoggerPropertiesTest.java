package io.github.yok.betterlogger.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.betterlogger.BetterLogger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class BetterLoggerPropertiesTest {

    @TempDir
    Path tempDir;

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(BetterLoggerConfiguration.class);

    @Test
    void toLoggerConfig_正常ケース_既定値_既定の設定が生成されること() {
        LoggerConfig config = new BetterLoggerProperties().toLoggerConfig();

        assertEquals("System", config.getLogFileName());
        assertEquals(Paths.get("logs", "System.log"), config.getLogFilePath());
        assertEquals("mssql", config.getDatabaseType());
        assertTrue(config.isIncludeDuration());
        assertTrue(config.isIncludeTraceback());
        assertTrue(config.isIncludeFunctionArgs());
        assertFalse(config.isIncludeDatabase());
        assertFalse(config.isLogToConsole());
        assertEquals(30_000L, config.getConnectionTimeoutMillis());
        assertEquals(2, config.getMaximumPoolSize());
        assertEquals(4, config.getDatabase().missingFields().size());
    }

    @Test
    void betterLogger_正常ケース_プロパティを指定する_設定が反映されたロガーが登録されること() {
        runner.withPropertyValues(
                "betterlogger.log-file-name=App",
                "betterlogger.log-dir=" + tempDir,
                "betterlogger.include-duration=false",
                "betterlogger.include-database=true",
                "betterlogger.database.type=mysql",
                "betterlogger.database.server=localhost:3306",
                "betterlogger.database.name=appdb",
                "betterlogger.database.username=app",
                "betterlogger.database.password=secret",
                "betterlogger.database.properties.usessl=false",
                "betterlogger.database.maximum-pool-size=4",
                "betterlogger.table.table-name=AppLogs",
                "betterlogger.table.create-table-if-not-exists=true")
                .run(context -> {
                    assertThat(context).hasSingleBean(BetterLogger.class);
                    LoggerConfig config = context.getBean(BetterLogger.class).getConfig();
                    assertEquals(tempDir.resolve("App.log"), config.getLogFilePath());
                    assertFalse(config.isIncludeDuration());
                    assertTrue(config.isIncludeDatabase());
                    assertEquals("mysql", config.getDatabaseType());
                    assertTrue(config.getDatabase().missingFields().isEmpty());
                    assertEquals(Map.of("usessl", "false"), config.getConnectionProperties());
                    assertEquals(4, config.getMaximumPoolSize());
                    assertEquals(TableDescriptor.of("AppLogs", true), config.getTable());
                    assertTrue(Files.isDirectory(tempDir));
                });
    }

    @Test
    void toString_正常ケース_パスワードが出力されないこと() {
        BetterLoggerProperties properties = new BetterLoggerProperties();
        properties.getDatabase().setPassword("top-secret");

        assertFalse(properties.toString().contains("top-secret"));
        assertFalse(properties.toLoggerConfig().toString().contains("top-secret"));
    }
}

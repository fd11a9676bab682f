package io.github.yok.betterlogger.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.betterlogger.config.LoggerConfig;
import io.github.yok.betterlogger.config.TableDescriptor;
import io.github.yok.betterlogger.db.ConnectionManager;
import io.github.yok.betterlogger.db.DataSourceFactory;
import io.github.yok.betterlogger.db.SchemaManager;
import io.github.yok.betterlogger.exception.ConfigurationException;
import io.github.yok.betterlogger.exception.DatabaseUnavailableException;
import io.github.yok.betterlogger.exception.InsertException;
import io.github.yok.betterlogger.exception.SchemaException;
import io.github.yok.betterlogger.testutil.H2TestDatabase;
import io.github.yok.betterlogger.util.TimestampFormatter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.List;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatabaseSinkTest {

    private static final LocalDateTime TIME = LocalDateTime.of(2025, 3, 5, 14, 3, 22, 123_000_000);

    @TempDir
    Path tempDir;

    private Path logFile;

    @BeforeEach
    void setUp() {
        logFile = tempDir.resolve("System.log");
    }

    private DatabaseSink sink(TableDescriptor table, DataSourceFactory factory) {
        LoggerConfig config = H2TestDatabase.mysqlConfig(tempDir, table).build();
        ConnectionManager manager = new ConnectionManager(config, factory);
        return new DatabaseSink(manager, new SchemaManager(manager), table, new FileSink(false),
                new TimestampFormatter(), logFile);
    }

    private List<String> fileLines() throws Exception {
        return Files.exists(logFile) ? Files.readAllLines(logFile) : List.of();
    }

    @Test
    void record_正常ケース_テーブル自動作成あり_1行挿入されること() throws Exception {
        DataSource ds = H2TestDatabase.create();
        DatabaseSink sink = sink(TableDescriptor.of("AppLogs", true), (url, c) -> ds);

        sink.record("hello", "INFO", TIME);

        List<String[]> rows = H2TestDatabase.rows(ds, "AppLogs");
        assertEquals(1, rows.size());
        assertEquals("INFO", rows.get(0)[0]);
        assertEquals("hello", rows.get(0)[1]);
        assertTrue(fileLines().isEmpty());
    }

    @Test
    void record_正常ケース_SQLを含むメッセージ_文字列がそのまま保存されること() throws Exception {
        DataSource ds = H2TestDatabase.create();
        DatabaseSink sink = sink(TableDescriptor.of("AppLogs", true), (url, c) -> ds);
        String message = "O'Brien said \"hi\"; DROP TABLE AppLogs; --";

        sink.record(message, "WARNING", TIME);

        List<String[]> rows = H2TestDatabase.rows(ds, "AppLogs");
        assertEquals(1, rows.size());
        assertEquals(message, rows.get(0)[1]);
        assertEquals(1, H2TestDatabase.countTables(ds, "AppLogs"));
    }

    @Test
    void record_正常ケース_既存テーブルに挿入する_DDLが実行されないこと() throws Exception {
        DataSource ds = H2TestDatabase.create();
        try (Connection conn = ds.getConnection(); Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE `Existing` (LogID INT AUTO_INCREMENT PRIMARY KEY,"
                    + " LogTime TIMESTAMP DEFAULT CURRENT_TIMESTAMP, LogLevel VARCHAR(50),"
                    + " LogMessage LONGTEXT)");
        }
        DatabaseSink sink = sink(TableDescriptor.of("Existing", false), (url, c) -> ds);

        sink.record("first", "INFO", TIME);
        sink.record("second", "ERROR", TIME);

        List<String[]> rows = H2TestDatabase.rows(ds, "Existing");
        assertEquals(2, rows.size());
        assertEquals("second", rows.get(1)[1]);
    }

    @Test
    void record_異常ケース_データベースに接続できない_ERROR行が記録されDatabaseUnavailableExceptionが送出されること()
            throws Exception {
        DatabaseSink sink = sink(TableDescriptor.of("AppLogs", true), (url, c) -> {
            throw new IllegalStateException("Connection refused");
        });

        assertThrows(DatabaseUnavailableException.class,
                () -> sink.record("hello", "INFO", TIME));

        List<String> lines = fileLines();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains(" - ERROR - Database connection failed: "));
        assertTrue(lines.get(0).contains("Connection refused"));
    }

    @Test
    void record_異常ケース_疎通確認クエリが失敗する_挿入が行われないこと() throws Exception {
        DataSource ds = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        SQLException failure = new SQLException("socket closed");
        when(ds.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("SELECT 1")).thenThrow(failure);
        DatabaseSink sink = sink(TableDescriptor.of("AppLogs", true), (url, c) -> ds);

        DatabaseUnavailableException ex = assertThrows(DatabaseUnavailableException.class,
                () -> sink.record("hello", "INFO", TIME));

        assertSame(failure, ex.getCause());
        verify(connection, never()).prepareStatement(anyString());
        assertTrue(fileLines().get(0).contains("Database connection failed: socket closed"));
    }

    @Test
    void record_異常ケース_認証情報が不足している_ConfigurationExceptionがそのまま送出されること()
            throws Exception {
        LoggerConfig config = LoggerConfig.builder().logDir(tempDir.toString()).build();
        ConnectionManager manager = new ConnectionManager(config, (url, c) -> mock(DataSource.class));
        TableDescriptor table = TableDescriptor.of("AppLogs", true);
        DatabaseSink sink = new DatabaseSink(manager, new SchemaManager(manager), table,
                new FileSink(false), new TimestampFormatter(), logFile);

        assertThrows(ConfigurationException.class, () -> sink.record("hello", "INFO", TIME));
        assertTrue(fileLines().isEmpty());
    }

    @Test
    void record_異常ケース_テーブル名が未設定_期待する列を含むConfigurationExceptionが送出されること() {
        DataSource ds = H2TestDatabase.create();
        DatabaseSink sink = sink(TableDescriptor.none(), (url, c) -> ds);

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> sink.record("hello", "INFO", TIME));

        assertTrue(ex.getMessage().contains("LogID"));
        assertTrue(ex.getMessage().contains("LogMessage"));
    }

    @Test
    void record_異常ケース_テーブルが存在せず自動作成なし_ERROR行が記録されInsertExceptionが送出されること()
            throws Exception {
        DataSource ds = H2TestDatabase.create();
        DatabaseSink sink = sink(TableDescriptor.of("Missing", false), (url, c) -> ds);

        InsertException ex = assertThrows(InsertException.class,
                () -> sink.record("hello", "INFO", TIME));

        assertEquals("Missing", ex.getTableName());
        assertInstanceOf(SQLException.class, ex.getCause());
        List<String> lines = fileLines();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains(" - ERROR - Database logging failed for table Missing: "));
    }

    @Test
    void record_異常ケース_テーブル作成が失敗する_ERROR行が記録されSchemaExceptionが送出されること()
            throws Exception {
        DataSource ds = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        when(ds.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("SELECT 1")).thenReturn(true);
        when(statement.execute(org.mockito.ArgumentMatchers.startsWith("CREATE TABLE")))
                .thenThrow(new SQLException("permission denied"));
        DatabaseSink sink = sink(TableDescriptor.of("AppLogs", true), (url, c) -> ds);

        assertThrows(SchemaException.class, () -> sink.record("hello", "INFO", TIME));

        verify(connection, never()).prepareStatement(anyString());
        List<String> lines = fileLines();
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).endsWith("SQLException: permission denied"));
    }

    @Test
    void record_異常ケース_挿入が失敗する_ファイル書き込みも失敗した場合は抑制例外として付与されること()
            throws Exception {
        DataSource ds = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(ds.getConnection()).thenReturn(connection);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeUpdate()).thenThrow(new SQLException("disk full"));
        Path unwritable = tempDir.resolve("missing").resolve("System.log");
        TableDescriptor table = TableDescriptor.of("AppLogs", false);
        LoggerConfig config = H2TestDatabase.mysqlConfig(tempDir, table).build();
        ConnectionManager manager = new ConnectionManager(config, (url, c) -> ds);
        DatabaseSink sink = new DatabaseSink(manager, new SchemaManager(manager), table,
                new FileSink(false), new TimestampFormatter(), unwritable);

        InsertException ex = assertThrows(InsertException.class,
                () -> sink.record("hello", "INFO", TIME));

        assertEquals(1, ex.getSuppressed().length);
        assertInstanceOf(java.io.UncheckedIOException.class, ex.getSuppressed()[0]);
        verify(ps).setString(2, "INFO");
        verify(ps).setString(3, "hello");
    }
}

package io.github.yok.betterlogger.sink;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends timestamped, leveled lines to a log file.
 *
 * <p>
 * Each call writes exactly one line {@code <timestamp> - <level> - <message>} in UTF-8. The file is
 * created when absent and never truncated. With console echo enabled only the message text is
 * printed, without timestamp or level. I/O failures are not handled here; there is no fallback sink.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class FileSink {

    private final boolean echoToConsole;
    private final PrintStream console;

    /**
     * Creates a sink that echoes to {@code System.out} when requested.
     *
     * @param echoToConsole whether written messages are also printed
     */
    public FileSink(boolean echoToConsole) {
        this(echoToConsole, System.out);
    }

    /**
     * Creates a sink with an explicit console stream.
     *
     * @param echoToConsole whether written messages are also printed
     * @param console stream that receives echoed messages
     */
    public FileSink(boolean echoToConsole, PrintStream console) {
        this.echoToConsole = echoToConsole;
        this.console = Preconditions.checkNotNull(console, "console must not be null");
    }

    /**
     * Appends one line to {@code filePath}.
     *
     * @param message message text, written verbatim
     * @param level level label, written verbatim
     * @param timestamp formatted timestamp
     * @param filePath target file; its directory must exist
     * @throws UncheckedIOException if the file cannot be written
     */
    public synchronized void write(String message, String level, String timestamp, Path filePath) {
        Preconditions.checkNotNull(filePath, "filePath must not be null");
        String line = timestamp + " - " + level + " - " + message;
        try {
            Files.writeString(filePath, line + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log file: " + filePath, e);
        }
        if (echoToConsole) {
            console.println(message);
        }
    }
}

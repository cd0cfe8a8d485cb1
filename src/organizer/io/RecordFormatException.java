package organizer.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A client or instructor record that cannot be read.
 */
public class RecordFormatException extends IOException {
    private final Path path;
    private final int lineNumber;

    public RecordFormatException(Path path, int lineNumber, String message) {
        super(path + ":" + lineNumber + ": " + message);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public Path getPath() {
        return path;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}

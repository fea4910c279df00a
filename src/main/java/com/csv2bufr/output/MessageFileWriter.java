package com.csv2bufr.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes encoded messages as {@code <output-dir>/<hash>.bufr4}, creating the directory if needed.
 */
public class MessageFileWriter {
    private static final Logger log = LoggerFactory.getLogger(MessageFileWriter.class);

    public static final String EXTENSION = ".bufr4";

    private final Path outputDir;
    private final boolean overwrite;

    public MessageFileWriter(Path outputDir, boolean overwrite) {
        this.outputDir = outputDir;
        this.overwrite = overwrite;
    }

    /**
     * @return the files written, in message order
     * @throws IOException if a file cannot be written, or exists and overwriting is off
     */
    public List<Path> writeAll(Map<String, byte[]> messages) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>(messages.size());
        for (Map.Entry<String, byte[]> message : messages.entrySet()) {
            written.add(write(message.getKey(), message.getValue()));
        }
        return written;
    }

    public Path write(String hash, byte[] bytes) throws IOException {
        Path file = outputDir.resolve(hash + EXTENSION);
        if (overwrite) {
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
        } else {
            Files.write(file, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
        log.debug("Wrote {} ({} bytes)", file, bytes.length);
        return file;
    }
}

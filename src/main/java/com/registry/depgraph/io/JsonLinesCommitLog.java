package com.registry.depgraph.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * {@link CommitLog} stored as one JSON object per line.
 *
 * <pre>
 * {"epoch":1,"contractId":"token","versionLabel":"1.0.0","interfaceHash":"ab12..","edges":[]}
 * {"epoch":2,"contractId":"dex","versionLabel":"1.0.0","interfaceHash":"cd34..","edges":[{"to":"token","kind":"client"}]}
 * </pre>
 *
 * I/O failures surface as {@link UncheckedIOException}. A failed append
 * truncates the file back to its last complete line, so a torn record never
 * blocks replay.
 */
public final class JsonLinesCommitLog implements CommitLog {
    private static final Logger log = LogManager.getLogger(JsonLinesCommitLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;
    private final StreamOpener opener;
    private OutputStream out;

    /** Opens the append stream; replaceable in tests. */
    @FunctionalInterface
    interface StreamOpener {
        OutputStream open(Path path) throws IOException;
    }

    public JsonLinesCommitLog(Path path) {
        this(path, p -> Files.newOutputStream(p, StandardOpenOption.CREATE, StandardOpenOption.APPEND));
    }

    JsonLinesCommitLog(Path path, StreamOpener opener) {
        this.path = path;
        this.opener = opener;
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized void append(CommitRecord record) {
        long committedLength = -1;
        try {
            byte[] line = (MAPPER.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
            if (out == null) {
                Path parent = path.toAbsolutePath().getParent();
                if (parent != null)
                    Files.createDirectories(parent);
                out = opener.open(path);
            }
            committedLength = Files.size(path);
            out.write(line);
            out.flush();
        } catch (IOException e) {
            rollback(committedLength, e);
            throw new UncheckedIOException("Failed to append commit record for epoch " + record.epoch()
                    + " to " + path, e);
        }
    }

    // Drops the stream and any partial line; secondary failures are attached to the cause.
    private void rollback(long committedLength, IOException cause) {
        if (out != null) {
            try {
                out.close();
            } catch (IOException e) {
                cause.addSuppressed(e);
            } finally {
                out = null;
            }
        }
        if (committedLength < 0)
            return;
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.WRITE)) {
            if (channel.size() > committedLength) {
                channel.truncate(committedLength);
                log.warn("Truncated torn commit record in {} back to {} bytes", path, committedLength);
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public synchronized List<CommitRecord> readAll() {
        if (!Files.exists(path))
            return List.of();
        List<CommitRecord> records = new ArrayList<>();
        int lineNo = 0;
        try {
            for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank())
                    continue;
                records.add(MAPPER.readValue(line, CommitRecord.class));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read commit log " + path + " at line " + lineNo, e);
        }
        log.info("Read {} commit records from {}", records.size(), path);
        return records;
    }

    @Override
    public synchronized void close() {
        if (out == null)
            return;
        try {
            out.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close commit log " + path, e);
        } finally {
            out = null;
        }
    }
}

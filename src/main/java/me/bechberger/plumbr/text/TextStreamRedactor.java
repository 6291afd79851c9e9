package me.bechberger.plumbr.text;

import me.bechberger.plumbr.Plumbr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Redacts text files and streams of any size through a {@link Plumbr} instance.
 * <p>
 * Input is read in chunks that always end on a line boundary, each chunk goes through
 * {@link Plumbr#redactBulk(String)} and is therefore processed in parallel. Line
 * endings, including {@code \r} and a missing final newline, are reproduced exactly.
 */
public class TextStreamRedactor {

    private static final Logger logger = LoggerFactory.getLogger(TextStreamRedactor.class);

    /** Characters read before a chunk is handed to the redactor */
    public static final int DEFAULT_CHUNK_SIZE = 1 << 20;

    private final Plumbr plumbr;
    private final int chunkSize;

    public TextStreamRedactor(Plumbr plumbr) {
        this(plumbr, DEFAULT_CHUNK_SIZE);
    }

    public TextStreamRedactor(Plumbr plumbr, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.plumbr = plumbr;
        this.chunkSize = chunkSize;
    }

    /**
     * Redact a text file and write the result to an output file.
     *
     * @throws IOException If file operations fail
     */
    public void redactFile(Path inputPath, Path outputPath) throws IOException {
        logger.debug("Input:  {}", inputPath);
        logger.debug("Output: {}", outputPath);

        try (Reader reader = Files.newBufferedReader(inputPath, StandardCharsets.UTF_8);
             Writer writer = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            redactStream(reader, writer);
        }
    }

    /**
     * Redact UTF-8 text from an input stream to an output stream. Neither stream is closed,
     * so this works with {@code System.in} and {@code System.out}.
     */
    public void redactStream(InputStream input, OutputStream output) throws IOException {
        Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8);
        Writer writer = new OutputStreamWriter(output, StandardCharsets.UTF_8);
        redactStream(reader, writer);
    }

    /**
     * Redact text from a reader and write to a writer. The writer is flushed, not closed.
     *
     * @return number of chunks written
     */
    public long redactStream(Reader reader, Writer writer) throws IOException {
        char[] buffer = new char[Math.min(chunkSize, 64 * 1024)];
        StringBuilder pending = new StringBuilder();
        long chunks = 0;
        int read;
        while ((read = reader.read(buffer)) != -1) {
            pending.append(buffer, 0, read);
            if (pending.length() < chunkSize) {
                continue;
            }
            int lastNewline = pending.lastIndexOf("\n");
            if (lastNewline < 0) {
                // a single line longer than a chunk, keep reading until it ends
                continue;
            }
            writer.write(plumbr.redactBulk(pending.substring(0, lastNewline + 1)));
            pending.delete(0, lastNewline + 1);
            chunks++;
            logger.info("Processed {} lines ({} redacted)",
                plumbr.getStats().linesProcessed(), plumbr.getStats().linesModified());
        }
        if (pending.length() > 0) {
            writer.write(plumbr.redactBulk(pending.toString()));
            chunks++;
        }
        writer.flush();
        logger.info("Text redaction complete: {} lines processed, {} lines contained redactions",
            plumbr.getStats().linesProcessed(), plumbr.getStats().linesModified());
        return chunks;
    }
}

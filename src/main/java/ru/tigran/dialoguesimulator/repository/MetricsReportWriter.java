package ru.tigran.dialoguesimulator.repository;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import ru.tigran.dialoguesimulator.dto.ConversationMetrics;
import ru.tigran.dialoguesimulator.exception.PersistenceException;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one CSV row per analyzed conversation, with a header row.
 * The file starts with a UTF-8 byte order mark so spreadsheet tools render the Hebrew columns.
 */
@Slf4j
public class MetricsReportWriter {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public MetricsReportWriter() {
        this.csvMapper = new CsvMapper();
        this.schema = csvMapper.schemaFor(ConversationMetrics.class).withHeader();
    }

    public Path write(List<ConversationMetrics> rows, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(file);
                 Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
                writer.write(BYTE_ORDER_MARK);
                csvMapper.writer(schema).writeValues(writer).writeAll(rows).close();
            }
            log.info("Analysis saved to {} ({} rows)", file, rows.size());
            return file;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write metrics report " + file + ": " + e.getMessage(), e);
        }
    }
}

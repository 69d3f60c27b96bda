package com.dataschema.decoder.schema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dataschema.decoder.exception.SchemaException;

/**
 * Reads a delimited schema description with a header row into raw rows keyed
 * by column name.
 *
 * Format:
 * - first non-blank line is the header; header names are trimmed
 * - cells may be wrapped in double quotes, {@code ""} inside quotes is a quote
 * - blank lines are skipped
 * - a row shorter than the header simply lacks the trailing columns
 */
public class SchemaRowReader {
    private static final Logger log = LoggerFactory.getLogger(SchemaRowReader.class);

    public static final char DEFAULT_DELIMITER = ',';

    private static final char QUOTE = '"';
    private static final char BOM = '\uFEFF';

    private final char delimiter;

    public SchemaRowReader() {
        this(DEFAULT_DELIMITER);
    }

    public SchemaRowReader(char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Unsupported schema delimiter: '" + delimiter + "'");
        }
        this.delimiter = delimiter;
    }

    public List<Map<String, String>> read(Path schemaFile) throws IOException {
        List<String> lines = Files.readAllLines(schemaFile, StandardCharsets.UTF_8);
        log.debug("Read {} line(s) from schema file {}", lines.size(), schemaFile);
        return read(lines);
    }

    public List<Map<String, String>> read(List<String> lines) {
        List<String> header = null;
        List<Map<String, String>> rows = new ArrayList<>();

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            if (line.isBlank()) {
                continue;
            }

            List<String> cells = splitLine(header == null ? stripBom(line) : line, lineNum);
            if (header == null) {
                header = cells.stream().map(String::trim).toList();
                continue;
            }

            if (cells.size() > header.size()) {
                log.debug("Line {}: ignoring {} cell(s) beyond the header", lineNum, cells.size() - header.size());
            }

            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < Math.min(cells.size(), header.size()); i++) {
                row.put(header.get(i), cells.get(i));
            }
            rows.add(row);
        }

        if (header == null) {
            throw new SchemaException("Schema description has no header row");
        }
        return rows;
    }

    List<String> splitLine(String line, int lineNum) {
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        cell.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(c);
                }
            } else if (c == QUOTE && cell.length() == 0) {
                quoted = true;
            } else if (c == delimiter) {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }

        if (quoted) {
            throw new SchemaException("Line " + lineNum + ": unterminated quoted cell");
        }
        cells.add(cell.toString());
        return cells;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == BOM ? line.substring(1) : line;
    }
}

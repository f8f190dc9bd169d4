package com.entity.network.bulk;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * RFC-4180 record splitter: comma separated, double-quoted fields, doubled quotes as escapes,
 * quoted fields may span lines.
 */
final class CsvRecordParser {

    private final BufferedReader reader;
    private long lineNumber;
    private long recordStart;

    CsvRecordParser(BufferedReader reader) {
        this.reader = reader;
    }

    /**
     * Line on which the last returned record started.
     */
    long getLineNumber() {
        return recordStart;
    }

    /**
     * The next record, or {@code null} at end of input. A blank line yields an empty list.
     *
     * @throws MalformedCsvException if the input ends inside a quoted field
     */
    List<String> next() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        lineNumber++;
        long startLine = lineNumber;
        recordStart = startLine;
        if (line.isBlank()) {
            return List.of();
        }

        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (true) {
            if (i >= line.length()) {
                if (!quoted) {
                    break;
                }
                String more = reader.readLine();
                if (more == null) {
                    throw new MalformedCsvException(startLine, "unterminated quoted field");
                }
                lineNumber++;
                field.append('\n');
                line = more;
                i = 0;
                continue;
            }
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else if (c != '\r') {
                field.append(c);
            }
            i++;
        }
        fields.add(field.toString());
        return fields;
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    static final class MalformedCsvException extends IOException {
        MalformedCsvException(long line, String message) {
            super("line " + line + ": " + message);
        }
    }
}

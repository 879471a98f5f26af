package com.kiln.ui;

import java.util.ArrayList;
import java.util.List;

/**
 * Line encoding of {@link UiEvent}: {@code timestamp,target,type,data...}. In every field a
 * backslash becomes {@code \\}, a comma {@code \,}, a newline {@code \n} and a carriage return
 * {@code \r}, so one event is always exactly one line and decoding restores the original values.
 */
public final class MachineReadableCodec {

    private MachineReadableCodec() {
    }

    /** Encodes the event without the trailing newline. */
    public static String encode(UiEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append(event.timestamp()).append(',');
        escapeInto(sb, event.target());
        sb.append(',');
        escapeInto(sb, event.type());
        for (String d : event.data()) {
            sb.append(',');
            escapeInto(sb, d);
        }
        return sb.toString();
    }

    /**
     * Decodes one line (a trailing newline is ignored).
     *
     * @throws IllegalArgumentException if the line has fewer than three fields, a bad timestamp
     *                                  or an invalid escape sequence
     */
    public static UiEvent decode(String line) {
        String l = line;
        if (l.endsWith("\n")) {
            l = l.substring(0, l.length() - 1);
        }
        List<String> fields = split(l);
        if (fields.size() < 3) {
            throw new IllegalArgumentException("Machine-readable line needs at least 3 fields: " + line);
        }
        long ts;
        try {
            ts = Long.parseLong(fields.get(0));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + fields.get(0), e);
        }
        return new UiEvent(ts, fields.get(1), fields.get(2), fields.subList(3, fields.size()));
    }

    public static String escape(String value) {
        StringBuilder sb = new StringBuilder();
        escapeInto(sb, value);
        return sb.toString();
    }

    private static void escapeInto(StringBuilder sb, String value) {
        if (value == null) {
            return;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case ',' -> sb.append("\\,");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
    }

    private static List<String> split(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == ',') {
                out.add(field.toString());
                field.setLength(0);
            } else if (c == '\\') {
                if (i + 1 >= line.length()) {
                    throw new IllegalArgumentException("Dangling escape at end of line");
                }
                char next = line.charAt(++i);
                switch (next) {
                    case '\\' -> field.append('\\');
                    case ',' -> field.append(',');
                    case 'n' -> field.append('\n');
                    case 'r' -> field.append('\r');
                    default -> throw new IllegalArgumentException("Invalid escape sequence: \\" + next);
                }
            } else {
                field.append(c);
            }
        }
        out.add(field.toString());
        return out;
    }
}

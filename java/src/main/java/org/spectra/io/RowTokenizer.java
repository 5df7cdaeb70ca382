package org.spectra.io;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits one line of delimited text into cells. Double quotes group a cell
 * and {@code ""} inside a quoted cell is a literal quote. With a space
 * delimiter, runs of spaces count as one separator and leading or trailing
 * spaces are ignored.
 */
final class RowTokenizer {

    private RowTokenizer() {
    }

    static List<String> split(String line, char delimiter) {
        if (delimiter == ' ') {
            line = line.strip();
        }

        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char ch = line.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == delimiter) {
                cells.add(cell.toString());
                cell.setLength(0);
                if (delimiter == ' ') {
                    while (i + 1 < line.length() && line.charAt(i + 1) == ' ') i++;
                }
            } else {
                cell.append(ch);
            }
        }
        cells.add(cell.toString());
        return cells;
    }
}

package org.spectra.io;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.zip.GZIPOutputStream;

/**
 * Builds small FITS files byte by byte: an empty primary HDU followed by
 * binary tables of double, short, vector and character columns.
 */
final class FitsFixtures {
    private static final int BLOCK = 2880;
    private static final int CARD = 80;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();

    private FitsFixtures() {
        List<String> cards = new ArrayList<>();
        cards.add(logicalCard("SIMPLE", true));
        cards.add(intCard("BITPIX", 8));
        cards.add(intCard("NAXIS", 0));
        cards.add(logicalCard("EXTEND", true));
        writeHeader(cards);
    }

    static FitsFixtures create() {
        return new FitsFixtures();
    }

    /**
     * Append a BINTABLE HDU of scalar double columns. {@code units} may be
     * null or hold nulls.
     */
    FitsFixtures table(String extName, String[] names, String[] units, double[]... columns) {
        Column[] cols = new Column[names.length];
        for (int c = 0; c < names.length; c++) {
            cols[c] = Column.doubles(names[c], columns.length == 0 ? new double[0] : columns[c]);
            if (units != null && units[c] != null) {
                cols[c].card("TUNIT", "'" + units[c] + "'");
            }
        }
        return table(extName, cols);
    }

    /**
     * Append a BINTABLE HDU built from arbitrary columns; all columns must
     * have the same row count.
     */
    FitsFixtures table(String extName, Column... columns) {
        int rows = columns.length == 0 ? 0 : columns[0].rows;
        int rowWidth = 0;
        for (Column c : columns) rowWidth += c.width;

        List<String> cards = new ArrayList<>();
        cards.add(stringCard("XTENSION", "BINTABLE"));
        cards.add(intCard("BITPIX", 8));
        cards.add(intCard("NAXIS", 2));
        cards.add(intCard("NAXIS1", rowWidth));
        cards.add(intCard("NAXIS2", rows));
        cards.add(intCard("PCOUNT", 0));
        cards.add(intCard("GCOUNT", 1));
        cards.add(intCard("TFIELDS", columns.length));
        for (int c = 0; c < columns.length; c++) {
            String n = String.valueOf(c + 1);
            cards.add(stringCard("TTYPE" + n, columns[c].name));
            cards.add(stringCard("TFORM" + n, columns[c].form));
            for (Map.Entry<String, String> extra : columns[c].cards.entrySet()) {
                String key = extra.getKey() + n;
                String value = extra.getValue();
                cards.add(value.startsWith("'")
                    ? pad(String.format("%-8s= %s", key, value))
                    : pad(String.format("%-8s= %20s", key, value)));
            }
        }
        if (extName != null) {
            cards.add(stringCard("EXTNAME", extName));
        }
        writeHeader(cards);

        ByteBuffer data = ByteBuffer.allocate(rowWidth * rows);
        for (int r = 0; r < rows; r++) {
            for (Column column : columns) {
                column.writer.accept(data, r);
            }
        }
        writePadded(data.array(), (byte) 0);
        return this;
    }

    /** One BINTABLE column: its TFORM, byte width per row and row writer. */
    static final class Column {
        private final String name;
        private final String form;
        private final int width;
        private final int rows;
        private final BiConsumer<ByteBuffer, Integer> writer;
        private final Map<String, String> cards = new LinkedHashMap<>();

        private Column(String name, String form, int width, int rows, BiConsumer<ByteBuffer, Integer> writer) {
            this.name = name;
            this.form = form;
            this.width = width;
            this.rows = rows;
            this.writer = writer;
        }

        static Column doubles(String name, double[] values) {
            return new Column(name, "1D", 8, values.length, (buf, r) -> buf.putDouble(values[r]));
        }

        /** A vector column: each row holds {@code rowValues[r].length} doubles. */
        static Column vectors(String name, double[][] rowValues) {
            int n = rowValues.length == 0 ? 1 : rowValues[0].length;
            return new Column(name, n + "D", 8 * n, rowValues.length, (buf, r) -> {
                for (double v : rowValues[r]) buf.putDouble(v);
            });
        }

        /** A fixed-width character column, space padded. */
        static Column strings(String name, int chars, String[] values) {
            return new Column(name, chars + "A", chars, values.length, (buf, r) -> {
                byte[] text = values[r].getBytes(StandardCharsets.US_ASCII);
                for (int i = 0; i < chars; i++) buf.put(i < text.length ? text[i] : (byte) ' ');
            });
        }

        static Column shorts(String name, short[] values) {
            return new Column(name, "1I", 2, values.length, (buf, r) -> buf.putShort(values[r]));
        }

        /** Add a per-column keyword such as TUNIT or TZERO; the column number is appended. */
        Column card(String keyword, String value) {
            cards.put(keyword, value);
            return this;
        }
    }

    byte[] toBytes() {
        return out.toByteArray();
    }

    byte[] toGzipBytes() throws IOException {
        ByteArrayOutputStream gz = new ByteArrayOutputStream();
        try (GZIPOutputStream zip = new GZIPOutputStream(gz)) {
            zip.write(toBytes());
        }
        return gz.toByteArray();
    }

    private void writeHeader(List<String> cards) {
        StringBuilder sb = new StringBuilder();
        for (String card : cards) sb.append(card);
        sb.append(pad("END"));
        writePadded(sb.toString().getBytes(StandardCharsets.US_ASCII), (byte) ' ');
    }

    private void writePadded(byte[] bytes, byte fill) {
        out.write(bytes, 0, bytes.length);
        int remainder = bytes.length % BLOCK;
        if (remainder != 0) {
            for (int i = remainder; i < BLOCK; i++) out.write(fill);
        }
    }

    private static String intCard(String key, long value) {
        return pad(String.format("%-8s= %20d", key, value));
    }

    private static String logicalCard(String key, boolean value) {
        return pad(String.format("%-8s= %20s", key, value ? "T" : "F"));
    }

    private static String stringCard(String key, String value) {
        return pad(String.format("%-8s= '%-8s'", key, value));
    }

    private static String pad(String card) {
        StringBuilder sb = new StringBuilder(card);
        while (sb.length() < CARD) sb.append(' ');
        return sb.toString();
    }
}

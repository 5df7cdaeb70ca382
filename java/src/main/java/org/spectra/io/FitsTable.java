package org.spectra.io;

import nom.tam.util.ArrayFuncs;
import org.spectra.core.CellValue;
import org.spectra.core.ColumnInfo;
import org.spectra.core.FitsTableCandidate;

import java.util.*;

/**
 * One table HDU read from a FITS file: column names, units, scaling and the
 * raw column data as returned by the FITS library (primitive arrays, arrays
 * of vectors, or object arrays for string and variable-length columns).
 */
public class FitsTable {
    private final int hduIndex;
    private final String hduName;
    private final List<Column> columns;

    public FitsTable(int hduIndex, String hduName, List<Column> columns) {
        this.hduIndex = hduIndex;
        this.hduName = hduName;
        this.columns = List.copyOf(columns);
    }

    public int getHduIndex() { return hduIndex; }
    public String getHduName() { return hduName; }
    public int getColumnCount() { return columns.size(); }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column c : columns) names.add(c.name);
        return names;
    }

    /** TUNITn of a column, or null. */
    public String getUnit(int column) {
        String unit = columns.get(column).unit;
        return unit == null || unit.isBlank() ? null : unit.strip();
    }

    public FitsTableCandidate toCandidate() {
        return new FitsTableCandidate(hduIndex, hduName, getColumnNames());
    }

    public List<ColumnInfo> getColumns() {
        List<ColumnInfo> infos = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            infos.add(new ColumnInfo(i, columns.get(i).name, isNumericColumn(i), 0));
        }
        return infos;
    }

    /**
     * Numeric if the column's element type is a primitive number, either as
     * a scalar per row or as a vector per row.
     */
    public boolean isNumericColumn(int column) {
        return isNumericType(baseType(columns.get(column).data));
    }

    /**
     * The column as one flat array in physical units ({@code TSCAL}/{@code TZERO}
     * applied): scalar columns give one value per row, vector columns
     * concatenate their rows.
     */
    public FlatColumn flatten(int column) {
        Column c = columns.get(column);
        FlatColumn out = new FlatColumn(c.scale, c.zero);
        if (c.data != null) {
            collect(c.data, out);
        }
        return out;
    }

    /**
     * One column of a table HDU. {@code data} is null when the library could
     * not read it.
     */
    public static final class Column {
        private final String name;
        private final String unit;
        private final double scale;
        private final double zero;
        private final Object data;

        public Column(String name, String unit, double scale, double zero, Object data) {
            this.name = Objects.requireNonNull(name, "name");
            this.unit = unit;
            this.scale = scale;
            this.zero = zero;
            this.data = data;
        }
    }

    /**
     * Flattened doubles plus the number of cells that were not numbers and
     * became NaN.
     */
    public static final class FlatColumn {
        private final double scale;
        private final double zero;
        private double[] values = new double[16];
        private int size;
        private int coerced;

        FlatColumn(double scale, double zero) {
            this.scale = scale;
            this.zero = zero;
        }

        void add(double v) {
            if (size == values.length) {
                values = Arrays.copyOf(values, Math.max(16, size * 2));
            }
            values[size++] = v;
        }

        void addStored(double v) {
            add(v * scale + zero);
        }

        void addMissing() {
            add(Double.NaN);
            coerced++;
        }

        public double[] getValues() { return Arrays.copyOf(values, size); }
        public int size() { return size; }
        public int getCoerced() { return coerced; }
    }

    private static void collect(Object data, FlatColumn out) {
        if (data == null) {
            out.addMissing();
        } else if (data instanceof Object[]) {
            // rows of a vector or variable-length column; they may be ragged
            for (Object element : (Object[]) data) {
                collect(element, out);
            }
        } else if (data instanceof byte[]) {
            // FITS 'B' columns are unsigned
            for (byte b : (byte[]) data) out.addStored(b & 0xFF);
        } else if (data instanceof boolean[]) {
            for (int i = 0; i < ((boolean[]) data).length; i++) out.addMissing();
        } else if (data instanceof char[]) {
            for (int i = 0; i < ((char[]) data).length; i++) out.addMissing();
        } else if (data.getClass().isArray()) {
            for (double v : (double[]) ArrayFuncs.convertArray(data, double.class)) out.addStored(v);
        } else if (data instanceof Byte) {
            out.addStored(((Byte) data) & 0xFF);
        } else if (data instanceof Number) {
            out.addStored(((Number) data).doubleValue());
        } else if (data instanceof String) {
            Double v = CellValue.parseNumber((String) data);
            if (v == null) {
                out.addMissing();
            } else {
                out.add(v);
            }
        } else {
            out.addMissing();
        }
    }

    private static Class<?> baseType(Object data) {
        if (data == null) return null;
        Class<?> base = ArrayFuncs.getBaseClass(data);
        if (base == Object.class && data instanceof Object[]) {
            // variable-length or heterogeneous: look at the first element
            for (Object element : (Object[]) data) {
                if (element != null) return baseType(element);
            }
            return null;
        }
        return base;
    }

    private static boolean isNumericType(Class<?> type) {
        return type != null && type.isPrimitive() && type != boolean.class && type != char.class;
    }
}

package org.spectra.io;

import java.util.Objects;

/**
 * Input to one ingestion: the raw bytes, the declared file name, and
 * optional column/HDU selections and units confirmed by the caller.
 */
public class IngestRequest {
    public static final int DEFAULT_PREVIEW_ROWS = 50;

    private final String fileName;
    private final byte[] payload;
    private Integer xIndex;
    private Integer yIndex;
    private Integer hduIndex;
    private int maxRows;
    private String xUnit;
    private String yUnit;

    public IngestRequest(String fileName, byte[] payload) {
        this.fileName = Objects.requireNonNull(fileName, "fileName");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.maxRows = DEFAULT_PREVIEW_ROWS;
    }

    public String getFileName() { return fileName; }

    /** The caller's bytes; never modified. */
    public byte[] getPayload() { return payload; }

    public Integer getXIndex() { return xIndex; }
    public void setXIndex(Integer xIndex) { this.xIndex = checkIndex("xIndex", xIndex); }

    public Integer getYIndex() { return yIndex; }
    public void setYIndex(Integer yIndex) { this.yIndex = checkIndex("yIndex", yIndex); }

    public Integer getHduIndex() { return hduIndex; }
    public void setHduIndex(Integer hduIndex) { this.hduIndex = checkIndex("hduIndex", hduIndex); }

    public int getMaxRows() { return maxRows; }
    public void setMaxRows(int maxRows) {
        if (maxRows <= 0) {
            throw new IllegalArgumentException("maxRows must be positive: " + maxRows);
        }
        this.maxRows = maxRows;
    }

    public String getXUnit() { return xUnit; }
    public void setXUnit(String xUnit) { this.xUnit = xUnit; }

    public String getYUnit() { return yUnit; }
    public void setYUnit(String yUnit) { this.yUnit = yUnit; }

    private static Integer checkIndex(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }
}

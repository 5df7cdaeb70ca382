package org.spectra.io;

import org.spectra.core.ColumnInfo;
import org.spectra.core.FitsTableCandidate;
import org.spectra.core.ParserKind;

import java.util.*;

/**
 * What the engine makes of a file before the caller confirms a column
 * mapping: detected format and dialect, column inventory, suggested axes and
 * a bounded row preview.
 */
public class IngestPreview {
    private String fileName;
    private long fileSizeBytes;
    private String encoding;
    private ParserKind parser;
    private String delimiter = "";
    private boolean hasHeader;
    private Integer hduIndex;
    private List<FitsTableCandidate> fitsCandidates;
    private String xUnitHint;
    private String yUnitHint;
    private List<ColumnInfo> columns = new ArrayList<>();
    private List<List<String>> previewRows = new ArrayList<>();
    private Integer suggestedXIndex;
    private Integer suggestedYIndex;
    private List<String> warnings = new ArrayList<>();
    private List<String> sourcePreamble;
    private Map<String, String> sourceMetadata;
    private String structuralFailure;

    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }

    public long getFileSizeBytes() { return fileSizeBytes; }
    public void setFileSizeBytes(long fileSizeBytes) { this.fileSizeBytes = fileSizeBytes; }

    public String getEncoding() { return encoding; }
    public void setEncoding(String encoding) { this.encoding = encoding; }

    public ParserKind getParser() { return parser; }
    public void setParser(ParserKind parser) { this.parser = parser; }

    public String getDelimiter() { return delimiter; }
    public void setDelimiter(String delimiter) { this.delimiter = delimiter; }

    public boolean hasHeader() { return hasHeader; }
    public void setHasHeader(boolean hasHeader) { this.hasHeader = hasHeader; }

    public Integer getHduIndex() { return hduIndex; }
    public void setHduIndex(Integer hduIndex) { this.hduIndex = hduIndex; }

    /** Table HDUs of a FITS file; null for text formats. */
    public List<FitsTableCandidate> getFitsCandidates() { return fitsCandidates; }
    public void setFitsCandidates(List<FitsTableCandidate> fitsCandidates) { this.fitsCandidates = fitsCandidates; }

    public String getXUnitHint() { return xUnitHint; }
    public void setXUnitHint(String xUnitHint) { this.xUnitHint = xUnitHint; }

    public String getYUnitHint() { return yUnitHint; }
    public void setYUnitHint(String yUnitHint) { this.yUnitHint = yUnitHint; }

    public List<ColumnInfo> getColumns() { return columns; }
    public void setColumns(List<ColumnInfo> columns) { this.columns = columns; }

    public List<List<String>> getPreviewRows() { return previewRows; }
    public void setPreviewRows(List<List<String>> previewRows) { this.previewRows = previewRows; }

    public Integer getSuggestedXIndex() { return suggestedXIndex; }
    public void setSuggestedXIndex(Integer suggestedXIndex) { this.suggestedXIndex = suggestedXIndex; }

    public Integer getSuggestedYIndex() { return suggestedYIndex; }
    public void setSuggestedYIndex(Integer suggestedYIndex) { this.suggestedYIndex = suggestedYIndex; }

    public List<String> getWarnings() { return warnings; }
    public void addWarning(String warning) { warnings.add(warning); }

    /** Leading header/comment lines of a text file; null when there were none. */
    public List<String> getSourcePreamble() { return sourcePreamble; }
    public void setSourcePreamble(List<String> sourcePreamble) { this.sourcePreamble = sourcePreamble; }

    public Map<String, String> getSourceMetadata() { return sourceMetadata; }
    public void setSourceMetadata(Map<String, String> sourceMetadata) { this.sourceMetadata = sourceMetadata; }

    /**
     * Why the claimed container could not be opened, or null. Set only for
     * unreadable FITS or failed gzip inflation; kept apart from warnings.
     */
    public String getStructuralFailure() { return structuralFailure; }
    public void setStructuralFailure(String structuralFailure) { this.structuralFailure = structuralFailure; }

    public boolean isFailed() { return structuralFailure != null; }

    @Override
    public String toString() {
        return String.format("IngestPreview(file=%s, parser=%s, columns=%d, x=%s, y=%s, warnings=%d)",
            fileName, parser, columns.size(), suggestedXIndex, suggestedYIndex, warnings.size());
    }
}

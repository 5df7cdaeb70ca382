package org.spectra.io;

import org.junit.jupiter.api.Test;
import org.spectra.core.Parsed;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JcampDxReaderTest {

    private final JcampDxReader reader = new JcampDxReader();

    private static String jcamp(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void expands_x_plus_plus_grid() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##TITLE=test spectrum",
            "##JCAMP-DX=4.24",
            "##XUNITS=1/CM",
            "##YUNITS=ABSORBANCE",
            "##XFACTOR=1",
            "##YFACTOR=1",
            "##FIRSTX=1000",
            "##DELTAX=1",
            "##NPOINTS=3",
            "##XYDATA=(X++(Y..Y))",
            "1000 1 2 3",
            "##END="));

        assertArrayEquals(new double[]{1000, 1001, 1002}, spectrum.getX());
        assertArrayEquals(new double[]{1, 2, 3}, spectrum.getY());
        assertEquals(JcampDxReader.MODE_XPP, spectrum.getMode());
        assertEquals("test spectrum", spectrum.getTitle());
        assertEquals("1/CM", spectrum.getXUnit());
        assertEquals("ABSORBANCE", spectrum.getYUnit());
        assertTrue(spectrum.getWarnings().isEmpty(), spectrum.getWarnings().toString());
    }

    @Test
    void applies_factors_and_delta() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##DELTAX=5",
            "##YFACTOR=0.5",
            "##XYDATA=(X++(Y..Y))",
            "10 2 4",
            "20 6 $$ trailing comment"));

        assertArrayEquals(new double[]{10, 15, 20}, spectrum.getX());
        assertArrayEquals(new double[]{1, 2, 3}, spectrum.getY());
    }

    @Test
    void x_factor_scales_first_x_and_step() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##XFACTOR=2",
            "##DELTAX=1",
            "##XYDATA=(X++(Y..Y))",
            "500 1 2 3"));

        assertArrayEquals(new double[]{1000, 1002, 1004}, spectrum.getX());
        assertArrayEquals(new double[]{1, 2, 3}, spectrum.getY());
    }

    @Test
    void reads_xy_pairs() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=5.01",
            "##XYDATA=(XY..XY)",
            "1,10 2,20",
            "3,30",
            "##END="));

        assertEquals(JcampDxReader.MODE_XY_PAIRS, spectrum.getMode());
        assertArrayEquals(new double[]{1, 2, 3}, spectrum.getX());
        assertArrayEquals(new double[]{10, 20, 30}, spectrum.getY());
    }

    @Test
    void odd_token_lines_are_reported() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=5.01",
            "##XYDATA=(XY..XY)",
            "1 10 2"));

        assertArrayEquals(new double[]{1}, spectrum.getX());
        assertTrue(spectrum.getWarnings().contains(
            "Odd number of numeric tokens in 1 XYDATA line(s); trailing value ignored."));
    }

    @Test
    void missing_deltax_keeps_first_point_per_line() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##XYDATA=(X++(Y..Y))",
            "100 1 2 3",
            "101 4 5"));

        assertEquals(JcampDxReader.MODE_XPP_DEGRADED, spectrum.getMode());
        assertArrayEquals(new double[]{100, 101}, spectrum.getX());
        assertArrayEquals(new double[]{1, 4}, spectrum.getY());
        assertTrue(spectrum.getWarnings().get(0).contains("DELTAX is missing"));
    }

    @Test
    void missing_data_block_is_reported() {
        JcampSpectrum spectrum = reader.read(jcamp("##TITLE=empty", "##JCAMP-DX=4.24", "##END="));

        assertNull(spectrum.getMode());
        assertEquals(0, spectrum.size());
        assertEquals(List.of(
            "No ##XYDATA block found in JCAMP-DX.",
            "No plottable X/Y points were parsed from JCAMP-DX."), spectrum.getWarnings());
    }

    @Test
    void npoints_mismatch_is_reported() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##NPOINTS=5",
            "##DELTAX=1",
            "##XYDATA=(X++(Y..Y))",
            "1 7 8 9"));

        assertTrue(spectrum.getWarnings().contains("NPOINTS declares 5 points but 3 were parsed."));
    }

    @Test
    void peak_table_with_widths_keeps_x_and_y() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##PEAK TABLE=(XYW..XYW)",
            "1,5,0.1",
            "2,6,0.1"));

        assertEquals(JcampDxReader.MODE_PEAK_TABLE, spectrum.getMode());
        assertArrayEquals(new double[]{1, 2}, spectrum.getX());
        assertArrayEquals(new double[]{5, 6}, spectrum.getY());
    }

    @Test
    void compressed_tokens_are_counted_not_decoded() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##JCAMP-DX=4.24",
            "##DELTAX=1",
            "##XYDATA=(X++(Y..Y))",
            "100 1 2",
            "@A1B2"));

        assertArrayEquals(new double[]{100, 101}, spectrum.getX());
        assertTrue(spectrum.getWarnings().stream().anyMatch(w -> w.startsWith("Ignored 1 non-numeric token(s)")));
    }

    @Test
    void header_keys_are_upper_cased_and_last_value_wins() {
        JcampSpectrum spectrum = reader.read(jcamp(
            "##title=first",
            "##TITLE=second",
            "##xunits=NANOMETERS",
            "##XYDATA=(XY..XY)",
            "1 2"));

        assertEquals("second", spectrum.getTitle());
        assertEquals("NANOMETERS", spectrum.getXUnit());
    }

    @Test
    void tokenizer_flags_non_numbers() {
        List<Parsed<Double>> tokens = JcampDxReader.tokenize("1.5, -2e3 abc");
        assertEquals(3, tokens.size());
        assertEquals(-2000.0, tokens.get(1).getValue());
        assertFalse(tokens.get(2).isOk());
        assertEquals("Non-numeric token: abc", tokens.get(2).getIssue().getMessage());
        assertThrows(IllegalStateException.class, () -> tokens.get(2).getValue());
    }
}

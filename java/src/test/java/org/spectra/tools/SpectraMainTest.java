package org.spectra.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpectraMainTest {

    @TempDir
    Path tmp;

    private static int run(String... args) {
        return new CommandLine(new SpectraMain()).execute(args);
    }

    @Test
    void parse_writes_canonical_csv() throws Exception {
        Path input = tmp.resolve("spectrum.csv");
        Files.writeString(input, "wavelength (nm),flux\n3,30\n2,20\n1,10\n", StandardCharsets.UTF_8);
        Path output = tmp.resolve("out.csv");

        assertEquals(0, run("parse", input.toString(), output.toString(), "--y-unit", "counts"));

        List<String> lines = Files.readAllLines(output);
        assertTrue(lines.contains("# X unit: nm"));
        assertTrue(lines.contains("# Y unit: counts"));
        int header = lines.indexOf("x,y");
        assertTrue(header > 0);
        assertEquals(List.of("1.0,10.0", "2.0,20.0", "3.0,30.0"), lines.subList(header + 1, lines.size()));
    }

    @Test
    void parse_writes_tsv() throws Exception {
        Path input = tmp.resolve("spectrum.txt");
        Files.writeString(input, "1\t5\n2\t6\n3\t7\n", StandardCharsets.UTF_8);
        Path output = tmp.resolve("out.tsv");

        assertEquals(0, run("parse", input.toString(), output.toString()));
        assertTrue(Files.readAllLines(output).contains("1.0\t5.0"));
    }

    @Test
    void preview_succeeds_on_text() throws Exception {
        Path input = tmp.resolve("spectrum.csv");
        Files.writeString(input, "x,y\n1,2\n3,4\n5,6\n", StandardCharsets.UTF_8);

        assertEquals(0, run("preview", input.toString(), "--rows", "2"));
    }

    @Test
    void verbose_raises_engine_log_level() {
        SpectraMain main = new SpectraMain();
        try {
            new CommandLine(main).parseArgs("--verbose", "preview", "x.csv");
            assertTrue(main.isVerbose());
            assertEquals("debug", System.getProperty(SpectraMain.LOG_LEVEL_PROPERTY));
        } finally {
            System.clearProperty(SpectraMain.LOG_LEVEL_PROPERTY);
        }
    }

    @Test
    void missing_file_is_an_error() {
        assertEquals(1, run("preview", tmp.resolve("nope.csv").toString()));
        assertEquals(1, run("parse", tmp.resolve("nope.csv").toString()));
    }

    @Test
    void unreadable_fits_is_an_error() throws Exception {
        Path input = tmp.resolve("broken.fits");
        Files.writeString(input, "definitely not fits", StandardCharsets.US_ASCII);

        assertEquals(1, run("parse", input.toString()));
        assertEquals(1, run("preview", input.toString()));
    }

    @Test
    void oversized_input_is_refused() throws Exception {
        Path input = tmp.resolve("spectrum.csv");
        Files.writeString(input, "x,y\n1,2\n3,4\n5,6\n", StandardCharsets.UTF_8);
        System.setProperty("spectra.maxBytes", "4");
        try {
            assertEquals(1, run("parse", input.toString()));
        } finally {
            System.clearProperty("spectra.maxBytes");
        }
    }

    @Test
    void unsupported_output_extension_is_an_error() throws Exception {
        Path input = tmp.resolve("spectrum.csv");
        Files.writeString(input, "x,y\n1,2\n3,4\n5,6\n", StandardCharsets.UTF_8);

        assertEquals(1, run("parse", input.toString(), tmp.resolve("out.json").toString()));
    }
}

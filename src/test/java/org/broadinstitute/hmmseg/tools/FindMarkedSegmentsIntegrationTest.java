package org.broadinstitute.hmmseg.tools;

import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.hmmseg.CommandLineProgramTest;
import org.broadinstitute.hmmseg.exceptions.UserException;
import org.broadinstitute.hmmseg.testutils.ArgumentsBuilder;
import org.broadinstitute.hmmseg.utils.hmm.PathSegment;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class FindMarkedSegmentsIntegrationTest extends CommandLineProgramTest {

    private static final File TEST_DIR = new File(getTestDataDir(), "FindMarkedSegments");

    private static final File SYNTHETIC_MODEL = new File(TEST_DIR, "synthetic_island_model.tsv");

    private static final File ISLAND_SEQUENCE = new File(TEST_DIR, "island.fasta");

    private static final File NO_ISLAND_SEQUENCE = new File(TEST_DIR, "no_island.txt");

    private static final File CPG_ISLAND_SEQUENCE = new File(TEST_DIR, "cpg_island.fasta");

    private static final File LOWER_CASE_ISLAND_SEQUENCE = new File(TEST_DIR, "lower_case_island.fasta");

    private static final File MALFORMED_MODEL = new File(TEST_DIR, "malformed_model.tsv");

    @SuppressWarnings("unchecked")
    private List<PathSegment> run(final ArgumentsBuilder args) {
        return (List<PathSegment>) runCommandLine(args);
    }

    private static List<String> readLines(final File file) throws IOException {
        return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    }

    @DataProvider(name = "segmentationCases")
    public Object[][] segmentationCases() {
        return new Object[][] {
                {SYNTHETIC_MODEL, ISLAND_SEQUENCE, Collections.singletonList(new PathSegment(8, 15))},
                {SYNTHETIC_MODEL, NO_ISLAND_SEQUENCE, Collections.emptyList()},
                {SYNTHETIC_MODEL, LOWER_CASE_ISLAND_SEQUENCE, Collections.emptyList()},
                // the bundled model enters and leaves the island one position before the CG run.
                {null, CPG_ISLAND_SEQUENCE, Collections.singletonList(new PathSegment(19, 42))},
                {null, NO_ISLAND_SEQUENCE, Collections.emptyList()},
        };
    }

    @Test(dataProvider = "segmentationCases")
    public void testSegmentation(final File model, final File input, final List<PathSegment> expected) throws IOException {
        final File output = createTempFile("segments", ".txt");
        final ArgumentsBuilder args = new ArgumentsBuilder()
                .addInput(input)
                .addOutput(output);
        if (model != null) {
            args.addModel(model);
        }
        final List<PathSegment> segments = run(args);
        Assert.assertEquals(segments, expected);

        final List<String> lines = readLines(output);
        if (expected.isEmpty()) {
            Assert.assertEquals(lines, Collections.singletonList(FindMarkedSegments.NO_SEGMENTS_MESSAGE));
        } else {
            Assert.assertEquals(lines.size(), expected.size());
            for (int i = 0; i < expected.size(); i++) {
                Assert.assertEquals(lines.get(i), expected.get(i).toString());
            }
        }
    }

    @Test
    public void testUpperCasing() throws IOException {
        final File output = createTempFile("segments", ".txt");
        final List<PathSegment> segments = run(new ArgumentsBuilder()
                .addInput(LOWER_CASE_ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)
                .addOutput(output)
                .add(FindMarkedSegments.UPPER_CASE_LONG_NAME, true));
        Assert.assertEquals(segments, Collections.singletonList(new PathSegment(8, 15)));
        Assert.assertEquals(readLines(output), Collections.singletonList("[8, 15]"));
    }

    @Test
    public void testCustomMarkedStatePattern() throws IOException {
        final File output = createTempFile("segments", ".txt");
        final List<PathSegment> segments = run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)
                .addOutput(output)
                .add(FindMarkedSegments.MARKED_STATE_PATTERN_LONG_NAME, "[ACGT]-"));
        Assert.assertEquals(segments, Arrays.asList(new PathSegment(0, 7), new PathSegment(16, 23)));
        Assert.assertEquals(readLines(output), Arrays.asList("[0, 7]", "[16, 23]"));
    }

    @Test
    public void testPatternMatchingNoState() throws IOException {
        final File output = createTempFile("segments", ".txt");
        final List<PathSegment> segments = run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)
                .addOutput(output)
                .add(FindMarkedSegments.MARKED_STATE_PATTERN_LONG_NAME, "island"));
        Assert.assertTrue(segments.isEmpty());
        Assert.assertEquals(readLines(output), Collections.singletonList(FindMarkedSegments.NO_SEGMENTS_MESSAGE));
    }

    @Test
    public void testStandardOutput() {
        final String stdout = captureStdout(() -> run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)));
        Assert.assertEquals(stdout.trim(), "[8, 15]");
    }

    @Test
    public void testStandardOutputWithoutSegments() {
        final String stdout = captureStdout(() -> run(new ArgumentsBuilder()
                .addInput(NO_ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)));
        Assert.assertEquals(stdout.trim(), FindMarkedSegments.NO_SEGMENTS_MESSAGE);
    }

    @Test
    public void testEmptyInput() throws IOException {
        final File input = createTempFile("empty", ".fasta");
        Files.write(input.toPath(), Collections.singletonList(">nothing but a header"), StandardCharsets.UTF_8);
        final File output = createTempFile("segments", ".txt");
        final List<PathSegment> segments = run(new ArgumentsBuilder()
                .addInput(input)
                .addOutput(output));
        Assert.assertTrue(segments.isEmpty());
        Assert.assertEquals(readLines(output), Collections.singletonList(FindMarkedSegments.NO_SEGMENTS_MESSAGE));
    }

    @Test(expectedExceptions = UserException.MalformedFile.class)
    public void testMalformedModel() {
        run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(MALFORMED_MODEL)
                .addOutput(createTempFile("segments", ".txt")));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingModel() {
        run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(getSafeNonExistentFile("model.tsv"))
                .addOutput(createTempFile("segments", ".txt")));
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInput() {
        run(new ArgumentsBuilder()
                .addInput(getSafeNonExistentFile("sequence.fasta"))
                .addOutput(createTempFile("segments", ".txt")));
    }

    @Test(expectedExceptions = UserException.CouldNotCreateOutputFile.class)
    public void testUnwritableOutput() {
        run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .addModel(SYNTHETIC_MODEL)
                .addOutput(createTempDir("segments")));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testInvalidMarkedStatePattern() {
        run(new ArgumentsBuilder()
                .addInput(ISLAND_SEQUENCE)
                .add(FindMarkedSegments.MARKED_STATE_PATTERN_LONG_NAME, "[+"));
    }

    @Test(expectedExceptions = CommandLineException.class)
    public void testMissingRequiredInput() {
        run(new ArgumentsBuilder().addModel(SYNTHETIC_MODEL));
    }

    @Test
    public void testPrintSegments() {
        final StringWriter text = new StringWriter();
        try (final PrintWriter writer = new PrintWriter(text)) {
            FindMarkedSegments.printSegments(writer, Arrays.asList(new PathSegment(0, 3), new PathSegment(10, 10)));
        }
        Assert.assertEquals(text.toString().split("\\R"), new String[] {"[0, 3]", "[10, 10]"});
    }

    @Test
    public void testDefaultModelResourceExists() throws IOException {
        try (final InputStream stream = FindMarkedSegments.DEFAULT_MODEL_RESOURCE.getResourceContentsAsStream()) {
            Assert.assertTrue(stream.read() >= 0);
        }
    }
}

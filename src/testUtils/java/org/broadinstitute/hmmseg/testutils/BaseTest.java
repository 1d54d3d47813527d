package org.broadinstitute.hmmseg.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.hmmseg.exceptions.HmmSegException;
import org.broadinstitute.hmmseg.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Root of the hmmseg test classes: quiet logging, per-class test data directories, temporary files and
 * standard output capture.
 */
public abstract class BaseTest {

    @BeforeSuite
    public void setTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * @return {@code src/test/resources/<test package>/<tested class>/}
     */
    public String getToolTestDataDir() {
        return "src/test/resources/" + getClass().getPackage().getName().replace('.', '/') + "/" + getTestedClassName() + "/";
    }

    /**
     * @return the simple name of the test class without its {@code IntegrationTest}, {@code UnitTest} or {@code Test} suffix
     */
    public String getTestedClassName() {
        return getClass().getSimpleName().replaceAll("(Integration|Unit)?Test$", "");
    }

    public File getTestFile(final String fileName) {
        return new File(getToolTestDataDir(), fileName);
    }

    /**
     * @return a new empty file in the temporary directory, deleted when the JVM exits
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = Files.createTempFile(name, extension).toFile();
            file.deleteOnExit();
            return file;
        } catch (final IOException ex) {
            throw new HmmSegException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return a new empty directory in the temporary directory, deleted when the JVM exits if it is still empty
     */
    public static File createTempDir(final String prefix) {
        try {
            final File dir = Files.createTempDirectory(prefix).toFile();
            dir.deleteOnExit();
            return dir;
        } catch (final IOException ex) {
            throw new HmmSegException("Cannot create temp directory: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return a file named {@code fileName} in a new temporary directory, so that it does not exist
     */
    public static File getSafeNonExistentFile(final String fileName) {
        return new File(createTempDir("nonExistentFileHolder"), fileName);
    }

    /**
     * @return what {@code runnable} wrote to {@link System#out}
     */
    public static String captureStdout(final Runnable runnable) {
        final PrintStream original = System.out;
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            runnable.run();
        } finally {
            System.setOut(original);
        }
        return captured.toString(StandardCharsets.UTF_8);
    }

    public static void assertContains(final String actual, final String expectedSubstring) {
        Assert.assertTrue(actual.contains(expectedSubstring), expectedSubstring + " was not found in " + actual + ".");
    }
}

package org.broadinstitute.hmmseg.utils;

import org.broadinstitute.hmmseg.HmmSegBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.*;

/**
 * Testing framework for general purpose utilities class.
 */
public final class UtilsUnitTest extends HmmSegBaseTest {

    @Test
    public void testForceJVMLocaleToUSEnglish() {
        final Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.CANADA);
            Utils.forceJVMLocaleToUSEnglish();
            Assert.assertEquals(Locale.getDefault(), Locale.US);
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    public void testDupChar() {
        Assert.assertEquals(Utils.dupChar('a', 0), "");
        Assert.assertEquals(Utils.dupChar('a', 3), "aaa");
        Assert.assertEquals(Utils.dupChar('-', 1), "-");
    }

    @Test
    public void testWarnUserLines() {
        final List<String> lines = Utils.warnUserLines("something odd");
        Assert.assertEquals(lines.size(), 5);
        Assert.assertEquals(lines.get(0), Utils.dupChar('*', 80));
        Assert.assertEquals(lines.get(2), "Warning: something odd");
        Assert.assertEquals(lines.get(4), lines.get(0));
    }

    @Test
    public void testNonNullReturnsTheObject() {
        final Object o = new Object();
        Assert.assertSame(Utils.nonNull(o), o);
        Assert.assertSame(Utils.nonNull(o, "message"), o);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonNullWithMessage() {
        Utils.nonNull(null, "the object is null");
    }

    @Test
    public void testContainsNoNull() {
        Utils.containsNoNull(Arrays.asList("a", "b"), "no nulls");
        Utils.containsNoNull(new HashSet<>(), "no nulls");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testContainsNoNullFailure() {
        Utils.containsNoNull(Arrays.asList("a", null), "there is a null");
    }

    @Test
    public void testCheckForDuplicatesAndReturnSet() {
        final Set<String> set = Utils.checkForDuplicatesAndReturnSet(Arrays.asList("c", "a", "b"), "dups");
        Assert.assertEquals(new ArrayList<>(set), Arrays.asList("c", "a", "b"));
    }

    @Test
    public void testCheckForDuplicatesReportsTheValue() {
        try {
            Utils.checkForDuplicatesAndReturnSet(Arrays.asList("a", "b", "a"), "Repeated.");
            Assert.fail("a duplicate should have been detected");
        } catch (final IllegalArgumentException ex) {
            assertContains(ex.getMessage(), "Value a appears more than once");
        }
    }

    @DataProvider(name = "validIndexData")
    public Object[][] validIndexData() {
        return new Object[][] {
                {0, 1, true},
                {2, 3, true},
                {3, 3, false},
                {-1, 3, false},
                {0, 0, false},
        };
    }

    @Test(dataProvider = "validIndexData")
    public void testValidIndex(final int index, final int length, final boolean valid) {
        try {
            Assert.assertEquals(Utils.validIndex(index, length), index);
            Assert.assertTrue(valid);
        } catch (final IllegalArgumentException ex) {
            Assert.assertFalse(valid);
        }
    }

    @Test
    public void testValidateArg() {
        Utils.validateArg(true, "ok");
        Utils.validateArg(true, () -> "ok");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValidateArgFailure() {
        Utils.validateArg(false, () -> "not ok");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testWarnUserWithStrictWarnings() {
        final String previous = System.getProperty(Utils.STRICT_WARNINGS_PROPERTY);
        System.setProperty(Utils.STRICT_WARNINGS_PROPERTY, "true");
        try {
            Utils.warnUser("this should fail");
        } finally {
            if (previous == null) {
                System.clearProperty(Utils.STRICT_WARNINGS_PROPERTY);
            } else {
                System.setProperty(Utils.STRICT_WARNINGS_PROPERTY, previous);
            }
        }
    }
}

package org.polycore.utils.tsv;

import org.polycore.exceptions.PolyCoreException;
import org.polycore.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public class SimpleXSVWriterUnitTest extends BaseTest {

    @Test
    public void testWriteByHeadingAndIndex() throws IOException {
        final Path output = createTempPath("xsv", ".csv");
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(output, ',')) {
            writer.setHeaderLine(Arrays.asList("name", "count", "fraction"));
            writer.getNewLineBuilder().setColumn("name", "s1").setColumn("count", 3L).setColumn("fraction", 0.25);
            writer.getNewLineBuilder().setColumn(0, "s2").setColumn(1, "4").setColumn("fraction", Double.NaN);
        }
        final List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
        Assert.assertEquals(lines, Arrays.asList("name,count,fraction", "s1,3,0.25", "s2,4,"));
    }

    @Test
    public void testTabSeparatorAndFill() throws IOException {
        final StringWriter out = new StringWriter();
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(out, '\t')) {
            writer.setHeaderLine(Arrays.asList("a", "b", "c"));
            writer.getNewLineBuilder().setColumn("b", "x").fill("0");
        }
        Assert.assertEquals(out.toString(), "a\tb\tc\n0\tx\t0\n");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testIncompleteLine() throws IOException {
        try (final SimpleXSVWriter writer = new SimpleXSVWriter(new StringWriter(), ',')) {
            writer.setHeaderLine(Arrays.asList("a", "b"));
            writer.getNewLineBuilder().setColumn("a", "1").write();
        }
    }

    @Test(expectedExceptions = PolyCoreException.class)
    public void testDuplicateColumns() {
        new SimpleXSVWriter(new StringWriter(), ',').setHeaderLine(Arrays.asList("a", "a"));
    }

    @Test(expectedExceptions = PolyCoreException.class)
    public void testLineBeforeHeader() {
        new SimpleXSVWriter(new StringWriter(), ',').getNewLineBuilder();
    }

    @DataProvider(name = "doubles")
    public Object[][] doubles() {
        return new Object[][]{
                {0.0, "0"},
                {1.0, "1"},
                {0.1, "0.1"},
                {1.0 / 3.0, "0.333333"},
                {0.125, "0.125"},
                {Double.NaN, ""}
        };
    }

    @Test(dataProvider = "doubles")
    public void testFormatDouble(final double value, final String expected) {
        Assert.assertEquals(SimpleXSVWriter.formatDouble(value), expected);
    }
}

package pedsim.pedigree.def;

import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

public class DefLineTokenizerTest {

    @DataProvider
    public Object[][] lines() {
        return new Object[][]{
                {"def fam 5 3", new String[]{"def", "fam", "5", "3"}},
                {"  2\t0 2   1-2:1\t1sM  ", new String[]{"2", "0", "2", "1-2:1", "1sM"}},
                {"3 2\r", new String[]{"3", "2"}},
                {"", new String[0]},
                {"   \t ", new String[0]},
                {"# a comment", new String[0]},
                {"   #indented comment 1 2", new String[0]},
                {"#", new String[0]},
        };
    }

    @Test(dataProvider = "lines")
    public void testTokenize(final String line, final String[] expected) {
        Assert.assertEquals(DefLineTokenizer.tokenize(line), expected, Arrays.toString(DefLineTokenizer.tokenize(line)));
    }

    @Test
    public void testLineNumbersCountSkippedLines() {
        final String text = "# header comment\n\ndef fam 5 3\n\n1 1\n   \n# trailing\n2 0 2\n";
        try (final DefLineIterator lines = DefLineIterator.fromString(text, "test")) {
            Assert.assertTrue(lines.hasNext());
            final DefLine def = lines.next();
            Assert.assertEquals(def.getLineNumber(), 3);
            Assert.assertEquals(def.getToken(0), "def");
            Assert.assertEquals(def.size(), 4);

            Assert.assertEquals(lines.next().getLineNumber(), 5);

            final DefLine third = lines.next();
            Assert.assertEquals(third.getLineNumber(), 8);
            Assert.assertEquals(third.tokensFrom(1), new String[]{"0", "2"});
            Assert.assertEquals(third.tokensFrom(3), new String[0]);

            Assert.assertFalse(lines.hasNext());
        }
    }

    @Test
    public void testMissingFile() {
        try {
            DefLineIterator.fromFile(new File("testdata/pedsim/pedigree/def/does_not_exist.def"));
            Assert.fail("Expected an exception for a missing file");
        } catch (final DefFileException e) {
            Assert.assertEquals(e.getKind(), DefFileErrorKind.IO_ERROR);
            Assert.assertEquals(e.getKind().getCategory(), DefFileErrorKind.Category.RESOURCE);
        }
    }

    @Test
    public void testStreamIsClosedWhenFirstReadFails() {
        final FailingInputStream in = new FailingInputStream();
        try {
            new DefLineIterator(in, "failing");
            Assert.fail("Expected an exception for an unreadable stream");
        } catch (final DefFileException e) {
            Assert.assertEquals(e.getKind(), DefFileErrorKind.IO_ERROR);
        }
        Assert.assertTrue(in.closed);
    }

    private static class FailingInputStream extends InputStream {
        private boolean closed = false;

        @Override
        public int read() throws IOException {
            throw new IOException("disk went away");
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}

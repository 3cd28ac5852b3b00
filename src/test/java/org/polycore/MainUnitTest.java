package org.polycore;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.polycore.cmdline.CommandLineProgram;
import org.polycore.cmdline.programgroups.CoreGenomeProgramGroup;
import org.polycore.exceptions.UserException;
import org.polycore.tools.PolyCore;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class MainUnitTest extends PolyCoreBaseTest {

    @CommandLineProgramProperties(
            programGroup = CoreGenomeProgramGroup.class,
            summary = "OmitFromCommandLine test",
            oneLineSummary = "OmitFromCommandLine test",
            omitFromCommandLine = true)
    public static final class OmitFromCommandLineCLP extends CommandLineProgram {

        @Argument(fullName = "value", doc = "value to double", optional = true)
        public int value = 1;

        @Override
        protected Object doWork() {
            return 2 * value;
        }
    }

    private static final class OmitFromCommandLineMain extends Main {
        @Override
        protected List<Class<? extends CommandLineProgram>> getClassList() {
            return Collections.singletonList(OmitFromCommandLineCLP.class);
        }
    }

    @Test(expectedExceptions = UserException.class)
    public void testCommandNotFoundThrows() {
        new Main().instanceMain(new String[]{"Brain"});
    }

    @Test
    public void testClpOmitFromCommandLine() {
        final OmitFromCommandLineMain main = new OmitFromCommandLineMain();
        final String clpName = "OmitFromCommandLineCLP";
        Assert.assertEquals(main.instanceMain(new String[]{clpName, "--value", "21", "--QUIET"}), 42);
        final String usage = captureStdout(() -> main.instanceMain(new String[]{"-h"}));
        Assert.assertFalse(usage.contains(clpName));
        assertContains(usage, "PolyCore");
    }

    @Test
    public void testHelpReturnsNull() {
        Assert.assertNull(new Main().instanceMain(new String[]{"--help"}));
    }

    @Test
    public void testSuggestedAlternateCommand() {
        final Set<Class<?>> classes = new LinkedHashSet<>();
        classes.add(PolyCore.class);
        assertContains(new Main().getSuggestedAlternateCommand(classes, "PolyCor"), "PolyCore");
        Assert.assertFalse(new Main().getSuggestedAlternateCommand(classes, "Zzzzzzzzzzzzz").contains("Did you mean"));
    }

    @Test
    public void testNoSuggestionWhenEveryProgramMatches() {
        final Set<Class<?>> classes = new LinkedHashSet<>();
        classes.add(PolyCore.class);
        classes.add(OmitFromCommandLineCLP.class);
        Assert.assertFalse(new Main().getSuggestedAlternateCommand(classes, "").contains("Did you mean"));
        assertContains(new Main().getSuggestedAlternateCommand(classes, "PolyCor"), "PolyCore");
    }
}

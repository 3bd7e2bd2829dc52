package io.hyperfoil.tools.yamlint;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class LintSummaryTest {

    private static LintResult result(Issue... issues){
        return new LintResult("a.yaml", Arrays.asList(issues), FixResult.unchanged(""));
    }

    private static Issue issue(Severity severity){
        return new Issue(1, 1, "message", severity, "rule");
    }

    @Test
    public void clean(){
        LintSummary summary = new LintSummary(Arrays.asList(result(), result()), Collections.emptyList());
        assertEquals(0, summary.getExitCode(false));
        assertEquals(0, summary.getExitCode(true));
    }

    @Test
    public void errors_fail(){
        LintSummary summary = new LintSummary(Arrays.asList(result(issue(Severity.ERROR), issue(Severity.WARNING))), Collections.emptyList());
        assertEquals(1, summary.getErrorCount());
        assertEquals(1, summary.getWarningCount());
        assertEquals(1, summary.getExitCode(false));
        assertEquals(1, summary.getExitCode(true));
    }

    @Test
    public void warnings_fail_only_when_strict(){
        LintSummary summary = new LintSummary(Arrays.asList(result(issue(Severity.WARNING))), Collections.emptyList());
        assertEquals(0, summary.getExitCode(false));
        assertEquals(2, summary.getExitCode(true));
    }

    @Test
    public void info_never_fails(){
        LintSummary summary = new LintSummary(Arrays.asList(result(issue(Severity.INFO))), Collections.emptyList());
        assertEquals(0, summary.getExitCode(true));
    }

    @Test
    public void file_errors_fail(){
        LintSummary summary = new LintSummary(Collections.emptyList(), Arrays.asList(new FileError("missing.yaml", "no such file")));
        assertTrue(summary.hasFileErrors());
        assertEquals(1, summary.getExitCode(false));
        assertEquals("Error: no such file\n  file: missing.yaml", summary.getErrors().get(0).toString());
    }

    @Test
    public void fixes_are_summed(){
        LintSummary summary = new LintSummary(Arrays.asList(
                new LintResult("a.yaml", Collections.emptyList(), new FixResult("x", 2)),
                new LintResult("b.yaml", Collections.emptyList(), new FixResult("y", 3))
        ), Collections.emptyList());
        assertEquals(5, summary.getFixesApplied());
    }
}

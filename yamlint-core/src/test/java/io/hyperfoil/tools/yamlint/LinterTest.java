package io.hyperfoil.tools.yamlint;

import io.hyperfoil.tools.yamlint.config.LintConfig;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.*;

public class LinterTest {

    private Linter linter;

    @Before
    public void createLinter(){
        linter = new Linter(LintConfig.builtIn());
    }

    private static List<Issue> byRule(List<Issue> issues, RuleId id){
        return issues.stream().filter(issue -> id.getId().equals(issue.getRuleId())).collect(Collectors.toList());
    }

    @Test
    public void clean_document(){
        List<Issue> issues = linter.lint(String.join("\n", "---", "key: value", "list:", "  - a", "  - b", ""), "clean.yaml");
        assertTrue("issues " + issues, issues.isEmpty());
    }

    @Test
    public void disable_and_enable_directives(){
        String content = String.join("\n",
                "---",
                "key: 1",
                "# yamllint disable",
                "bad:  two",
                "# yamllint enable",
                "clean:  1",
                ""
        );
        List<Issue> colons = byRule(linter.lint(content, "test.yaml"), RuleId.COLONS);
        assertEquals("colons " + colons, 1, colons.size());
        assertEquals(6, colons.get(0).getLine());
        assertEquals(8, colons.get(0).getColumn());
    }

    @Test
    public void disable_line_only_covers_one_line(){
        String content = String.join("\n",
                "---",
                "a:  1  # yamllint disable-line rule:colons",
                "b:  2",
                ""
        );
        List<Issue> colons = byRule(linter.lint(content, "test.yaml"), RuleId.COLONS);
        assertEquals("colons " + colons, 1, colons.size());
        assertEquals(3, colons.get(0).getLine());
    }

    @Test
    public void issues_are_sorted(){
        String content = String.join("\n", "a:  yes ", "a: 1", "");
        List<Issue> issues = linter.lint(content, "test.yaml");
        assertTrue(issues.size() > 3);
        List<Issue> sorted = new ArrayList<>(issues);
        Collections.sort(sorted);
        assertEquals(sorted, issues);
        assertEquals(RuleId.DOCUMENT_START.getId(), issues.get(0).getRuleId());
    }

    @Test
    public void disabled_rule_does_not_run(){
        LintConfig config = LintConfig.builtIn().withRule(RuleSettings.defaults(RuleId.COLONS).withEnabled(false));
        List<Issue> issues = new Linter(config).lint(String.join("\n", "---", "a:  1", ""), "test.yaml");
        assertTrue("issues " + issues, issues.isEmpty());
    }

    @Test
    public void rule_ignore_paths(){
        LintConfig config = LintConfig.builtIn().withRule(
                RuleSettings.defaults(RuleId.TRAILING_SPACES).withIgnore(Collections.singletonList("generated/")));
        Linter linter = new Linter(config);
        String content = String.join("\n", "---", "a: 1 ", "");
        assertTrue(linter.lint(content, "generated/a.yaml").isEmpty());
        assertEquals(1, linter.lint(content, "src/a.yaml").size());
    }

    @Test
    public void configured_severity(){
        LintConfig config = LintConfig.builtIn().withRule(RuleSettings.defaults(RuleId.COLONS).withSeverity(Severity.WARNING));
        List<Issue> issues = new Linter(config).lint(String.join("\n", "---", "a:  1", ""), "test.yaml");
        assertEquals(1, issues.size());
        assertEquals(Severity.WARNING, issues.get(0).getSeverity());
    }

    @Test
    public void fix_pipeline(){
        LintResult result = linter.fix("a: yes  \nb: 1", "test.yaml");
        assertEquals("---\na: true\nb: 1\n", result.getFix().getContent());
        assertEquals(4, result.getFix().getFixesApplied());
        assertTrue("issues " + result.getIssues(), result.getIssues().isEmpty());

        LintResult again = linter.fix(result.getFix().getContent(), "test.yaml");
        assertFalse(again.getFix().isChanged());
        assertEquals(0, again.getFix().getFixesApplied());
    }

    @Test
    public void fix_reports_remaining_issues(){
        LintResult result = linter.fix("---\na:  1\n", "test.yaml");
        assertFalse(result.getFix().isChanged());
        assertEquals(1, result.getIssues().size());
        assertEquals(RuleId.COLONS.getId(), result.getIssues().get(0).getRuleId());
    }

    @Test
    public void fixes_ignore_directives(){
        LintResult result = linter.fix("---\n# yamllint disable\na: yes\n", "test.yaml");
        assertTrue(result.getFix().getContent().contains("a: true"));
    }

    @Test
    public void check_leaves_content_unchanged(){
        LintResult result = linter.check("a: 1", "test.yaml");
        assertEquals("a: 1", result.getFix().getContent());
        assertFalse(result.getFix().isChanged());
        assertEquals(1, result.getWarningCount());
        assertEquals(1, result.getErrorCount());
    }

    @Test
    public void malformed_yaml_is_linted(){
        List<Issue> issues = linter.lint("---\nkey: [1, 2\nother:  x\n", "broken.yaml");
        assertNotNull(issues);
    }
}

package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import org.junit.Test;

import java.util.List;

import static io.hyperfoil.tools.yamlint.rule.impl.RuleCheck.*;
import static org.junit.Assert.*;

public class LineRulesTest {

    @Test
    public void trailing_spaces(){
        List<Issue> issues = check(RuleId.TRAILING_SPACES, lines("a: 1  ", "b: 2", ""));
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.TRAILING_SPACES, 1, 5, "trailing spaces"), issues.get(0));
        assertTrue(check(RuleId.TRAILING_SPACES, lines("a: 1", "b: 2", "")).isEmpty());
    }

    @Test
    public void trailing_spaces_fix(){
        FixResult fixed = fix(RuleId.TRAILING_SPACES, lines("a: 1  ", "b: 2\t", "c: 3", ""));
        assertEquals(lines("a: 1", "b: 2", "c: 3", ""), fixed.getContent());
        assertEquals(2, fixed.getFixesApplied());
        FixResult again = fix(RuleId.TRAILING_SPACES, fixed.getContent());
        assertFalse(again.isChanged());
        assertEquals(fixed.getContent(), again.getContent());
    }

    @Test
    public void trailing_spaces_fix_keeps_crlf(){
        FixResult fixed = fix(RuleId.TRAILING_SPACES, "a: 1 \r\nb: 2\r\n");
        assertEquals("a: 1\r\nb: 2\r\n", fixed.getContent());
        assertEquals(1, fixed.getFixesApplied());
    }

    @Test
    public void line_length(){
        List<Issue> issues = check(RuleId.LINE_LENGTH, lines("key: value that is long", ""), "max", 20);
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.LINE_LENGTH, 1, 21, "line too long (23 > 20 characters)"), issues.get(0));
        assertTrue(check(RuleId.LINE_LENGTH, lines("key: short", "")).isEmpty());
    }

    @Test
    public void line_length_non_breakable_words(){
        String url = lines("- https://example.com/a/very/long/path", "");
        assertTrue(check(RuleId.LINE_LENGTH, url, "max", 20).isEmpty());
        List<Issue> issues = check(RuleId.LINE_LENGTH, url, "max", 20, "allow-non-breakable-words", false);
        assertEquals(1, issues.size());
        assertEquals("line too long (38 > 20 characters)", issues.get(0).getMessage());
    }

    @Test
    public void line_length_non_breakable_inline_mappings(){
        String mapping = lines("url: https://example.com/a/very/long/path", "");
        assertEquals(1, check(RuleId.LINE_LENGTH, mapping, "max", 20).size());
        assertTrue(check(RuleId.LINE_LENGTH, mapping, "max", 20, "allow-non-breakable-inline-mappings", true).isEmpty());
        assertTrue(LineLengthRule.isNonBreakableMapping("url: https://example.com/long"));
        assertFalse(LineLengthRule.isNonBreakableMapping("text: some words here"));
    }

    @Test
    public void empty_lines(){
        List<Issue> issues = check(RuleId.EMPTY_LINES, lines("a: 1", "", "", "", "b: 2", ""));
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.EMPTY_LINES, 4, 1, "too many blank lines (3 > 2)"), issues.get(0));
        assertTrue(check(RuleId.EMPTY_LINES, lines("a: 1", "", "", "b: 2", "")).isEmpty());
    }

    @Test
    public void empty_lines_at_start(){
        List<Issue> issues = check(RuleId.EMPTY_LINES, lines("", "a: 1", ""));
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.EMPTY_LINES, 1, 1, "too many blank lines (1 > 0)"), issues.get(0));
        assertTrue(check(RuleId.EMPTY_LINES, lines("", "a: 1", ""), "max-start", 1).isEmpty());
    }

    @Test
    public void single_line_break_file_is_fine(){
        assertTrue(check(RuleId.EMPTY_LINES, "\n").isEmpty());
    }

    @Test
    public void new_line_at_end_of_file(){
        List<Issue> issues = check(RuleId.NEW_LINE_AT_END_OF_FILE, "a: 1");
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.NEW_LINE_AT_END_OF_FILE, 1, 5, "no new line character at the end of file"), issues.get(0));
        assertTrue(check(RuleId.NEW_LINE_AT_END_OF_FILE, "a: 1\n").isEmpty());
        assertTrue(check(RuleId.NEW_LINE_AT_END_OF_FILE, "").isEmpty());
    }

    @Test
    public void new_line_at_end_of_file_fix(){
        FixResult fixed = fix(RuleId.NEW_LINE_AT_END_OF_FILE, "a: 1\r\nb: 2");
        assertEquals("a: 1\r\nb: 2\r\n", fixed.getContent());
        assertEquals(1, fixed.getFixesApplied());
        assertFalse(fix(RuleId.NEW_LINE_AT_END_OF_FILE, fixed.getContent()).isChanged());
    }

    @Test
    public void new_lines(){
        List<Issue> issues = check(RuleId.NEW_LINES, "a: 1\r\nb: 2\r\n");
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.NEW_LINES, 1, 5, "wrong new line character: expected \\n"), issues.get(0));
        assertTrue(check(RuleId.NEW_LINES, "a: 1\r\nb: 2\r\n", "type", "dos").isEmpty());
        assertEquals("wrong new line character: expected \\r\\n",
                check(RuleId.NEW_LINES, "a: 1\n", "type", "dos").get(0).getMessage());
        assertTrue(check(RuleId.NEW_LINES, "a: 1").isEmpty());
    }
}

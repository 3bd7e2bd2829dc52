package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static io.hyperfoil.tools.yamlint.rule.impl.RuleCheck.*;
import static org.junit.Assert.*;

public class ValueRulesTest {

    private static final String TRUTHY = "truthy value should be one of [false, true]";

    @Test
    public void truthy(){
        assertEquals(Arrays.asList(issue(RuleId.TRUTHY, 1, 10, TRUTHY)),
                check(RuleId.TRUTHY, lines("enabled: yes", "")));
        assertTrue(check(RuleId.TRUTHY, lines("enabled: true", "quoted: 'yes'", "tagged: !!str yes", "")).isEmpty());
    }

    @Test
    public void truthy_keys(){
        assertEquals(1, check(RuleId.TRUTHY, lines("on: push", "")).size());
        assertTrue(check(RuleId.TRUTHY, lines("on: push", ""), "check-keys", false).isEmpty());
    }

    @Test
    public void truthy_allowed_values(){
        List<Issue> issues = check(RuleId.TRUTHY, lines("a: yes", "b: true", ""), "allowed-values", Arrays.asList("yes", "no"));
        assertEquals(1, issues.size());
        assertEquals(2, issues.get(0).getLine());
        assertEquals("truthy value should be one of [no, yes]", issues.get(0).getMessage());
    }

    @Test(expected = IllegalArgumentException.class)
    public void truthy_rejects_non_truthy_allowed_values(){
        rule(RuleId.TRUTHY, "allowed-values", Arrays.asList("maybe"));
    }

    @Test
    public void truthy_yaml_1_2(){
        String content = lines("%YAML 1.2", "---", "a: on", "b: True", "");
        List<Issue> issues = check(RuleId.TRUTHY, content);
        assertEquals("issues " + issues, 1, issues.size());
        assertEquals(4, issues.get(0).getLine());
    }

    @Test
    public void truthy_fix(){
        FixResult fixed = fix(RuleId.TRUTHY, lines("a: yes", "b: Off", "c: 'no'", ""));
        assertEquals(lines("a: true", "b: false", "c: 'no'", ""), fixed.getContent());
        assertEquals(2, fixed.getFixesApplied());
        assertFalse(fix(RuleId.TRUTHY, fixed.getContent()).isChanged());
    }

    @Test
    public void octal_values(){
        assertEquals(Arrays.asList(issue(RuleId.OCTAL_VALUES, 1, 7, "forbidden implicit octal value \"010\"")),
                check(RuleId.OCTAL_VALUES, lines("a: 010", "")));
        assertEquals(Arrays.asList(issue(RuleId.OCTAL_VALUES, 1, 8, "forbidden explicit octal value \"0o10\"")),
                check(RuleId.OCTAL_VALUES, lines("a: 0o10", "")));
        assertTrue(check(RuleId.OCTAL_VALUES, lines("a: 0", "b: '010'", "c: 019", "d: 10", "")).isEmpty());
        assertTrue(check(RuleId.OCTAL_VALUES, lines("a: 010", ""), "forbid-implicit-octal", false).isEmpty());
    }

    @Test
    public void float_values(){
        assertEquals(Arrays.asList(issue(RuleId.FLOAT_VALUES, 1, 4, "forbidden decimal missing 0 prefix \".5\"")),
                check(RuleId.FLOAT_VALUES, lines("a: .5", ""), "require-numeral-before-decimal", true));
        assertEquals(Arrays.asList(issue(RuleId.FLOAT_VALUES, 1, 4, "forbidden not a number value \".nan\"")),
                check(RuleId.FLOAT_VALUES, lines("a: .nan", ""), "forbid-nan", true));
        assertEquals(Arrays.asList(issue(RuleId.FLOAT_VALUES, 1, 4, "forbidden infinite value \"-.inf\"")),
                check(RuleId.FLOAT_VALUES, lines("a: -.inf", ""), "forbid-inf", true));
        assertEquals(Arrays.asList(issue(RuleId.FLOAT_VALUES, 1, 4, "forbidden scientific notation \"1e3\"")),
                check(RuleId.FLOAT_VALUES, lines("a: 1e3", ""), "forbid-scientific-notation", true));
        assertTrue(check(RuleId.FLOAT_VALUES, lines("a: .5", "b: .nan", "c: 1e3", "")).isEmpty());
    }

    @Test
    public void empty_values(){
        assertEquals(Arrays.asList(issue(RuleId.EMPTY_VALUES, 1, 3, "empty value in block mapping")),
                check(RuleId.EMPTY_VALUES, lines("a:", "b: 1", "")));
        assertEquals(Arrays.asList(issue(RuleId.EMPTY_VALUES, 1, 7, "empty value in flow mapping")),
                check(RuleId.EMPTY_VALUES, lines("c: {a: , b: 1}", "")));
        assertEquals(Arrays.asList(issue(RuleId.EMPTY_VALUES, 1, 2, "empty value in block sequence")),
                check(RuleId.EMPTY_VALUES, lines("-", "- a", "")));
        assertTrue(check(RuleId.EMPTY_VALUES, lines("a:", "b: 1", ""), "forbid-in-block-mappings", false).isEmpty());
    }

    @Test
    public void quoted_strings_required(){
        assertEquals(Arrays.asList(issue(RuleId.QUOTED_STRINGS, 1, 4, "string value is not quoted with any quotes")),
                check(RuleId.QUOTED_STRINGS, lines("a: foo", "")));
        assertTrue(check(RuleId.QUOTED_STRINGS, lines("a: 'foo'", "b: 1", "c: true", "d: |", "  text", "")).isEmpty());
    }

    @Test
    public void quoted_strings_quote_type(){
        List<Issue> issues = check(RuleId.QUOTED_STRINGS, lines("a: 'foo'", "b: \"bar\"", ""), "quote-type", "double");
        assertEquals(1, issues.size());
        assertEquals(issue(RuleId.QUOTED_STRINGS, 1, 4, "string value is not quoted with double quotes"), issues.get(0));
    }

    @Test
    public void quoted_strings_only_when_needed(){
        List<Issue> issues = check(RuleId.QUOTED_STRINGS, lines("a: 'foo'", "b: 'yes'", "c: ': x'", "d: bar", ""),
                "required", QuotedStringsRule.ONLY_WHEN_NEEDED);
        assertEquals("issues " + issues, 1, issues.size());
        assertEquals(issue(RuleId.QUOTED_STRINGS, 1, 4, "string value is redundantly quoted with any quotes"), issues.get(0));
    }

    @Test
    public void quoted_strings_extra_required(){
        List<Issue> issues = check(RuleId.QUOTED_STRINGS, lines("url: http://example.com", "name: foo", ""),
                "required", false, "extra-required", Arrays.asList("^http://"));
        assertEquals(Arrays.asList(issue(RuleId.QUOTED_STRINGS, 1, 6, "string value is not quoted")), issues);
    }

    @Test(expected = IllegalArgumentException.class)
    public void quoted_strings_conflicting_options(){
        rule(RuleId.QUOTED_STRINGS, "required", true, "extra-required", Arrays.asList("^x"));
    }
}

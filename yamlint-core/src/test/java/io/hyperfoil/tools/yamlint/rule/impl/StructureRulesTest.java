package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static io.hyperfoil.tools.yamlint.rule.impl.RuleCheck.*;
import static org.junit.Assert.*;

public class StructureRulesTest {

    @Test
    public void key_duplicates(){
        assertEquals(Arrays.asList(issue(RuleId.KEY_DUPLICATES, 3, 1, "duplication of key \"a\" in mapping")),
                check(RuleId.KEY_DUPLICATES, lines("a: 1", "b: 2", "a: 3", "")));
        assertTrue(check(RuleId.KEY_DUPLICATES, lines("a:", "  x: 1", "b:", "  x: 2", "")).isEmpty());
    }

    @Test
    public void key_duplicates_nested(){
        List<Issue> issues = check(RuleId.KEY_DUPLICATES, lines("a:", "  b: 1", "  b: 2", ""));
        assertEquals(Arrays.asList(issue(RuleId.KEY_DUPLICATES, 3, 3, "duplication of key \"b\" in mapping")), issues);
    }

    @Test
    public void key_duplicates_merge_keys(){
        String content = lines("base: &b {x: 1}", "other: &o {y: 2}", "c:", "  <<: *b", "  <<: *o", "");
        assertTrue(check(RuleId.KEY_DUPLICATES, content).isEmpty());
        assertEquals(1, check(RuleId.KEY_DUPLICATES, content, "forbid-duplicated-merge-keys", true).size());
    }

    @Test
    public void key_ordering(){
        assertEquals(Arrays.asList(issue(RuleId.KEY_ORDERING, 2, 1, "wrong ordering of key \"a\" in mapping")),
                check(RuleId.KEY_ORDERING, lines("b: 1", "a: 2", "")));
        assertTrue(check(RuleId.KEY_ORDERING, lines("a: 1", "b:", "  z: 1", "  c: 2", ""), "ignored-keys", Arrays.asList("^z")).isEmpty());
        assertTrue(check(RuleId.KEY_ORDERING, lines("a: 1", "b: 2", "")).isEmpty());
    }

    @Test
    public void anchors_undeclared_alias(){
        assertEquals(Arrays.asList(issue(RuleId.ANCHORS, 1, 4, "found undeclared alias \"x\"")),
                check(RuleId.ANCHORS, lines("a: *x", "")));
        assertTrue(check(RuleId.ANCHORS, lines("a: &x 1", "b: *x", "")).isEmpty());
    }

    @Test
    public void anchors_do_not_cross_documents(){
        assertEquals(1, check(RuleId.ANCHORS, lines("---", "a: &x 1", "---", "b: *x", "")).size());
    }

    @Test
    public void anchors_duplicated_and_unused(){
        assertEquals(Arrays.asList(issue(RuleId.ANCHORS, 2, 4, "found duplicated anchor \"x\"")),
                check(RuleId.ANCHORS, lines("a: &x 1", "b: &x 2", "c: *x", ""), "forbid-duplicated-anchors", true));
        assertEquals(Arrays.asList(issue(RuleId.ANCHORS, 1, 4, "found unused anchor \"x\"")),
                check(RuleId.ANCHORS, lines("a: &x 1", ""), "forbid-unused-anchors", true));
    }

    @Test
    public void indentation(){
        assertEquals(Arrays.asList(issue(RuleId.INDENTATION, 2, 1, "wrong indentation: expected 2 but found 0")),
                check(RuleId.INDENTATION, lines("items:", "- x", "")));
        assertTrue(check(RuleId.INDENTATION, lines("items:", "- x", ""), "indent-sequences", false).isEmpty());
        assertTrue(check(RuleId.INDENTATION, lines("a:", "    b: 1", ""), "spaces", "consistent").isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void indentation_rejects_zero_spaces(){
        rule(RuleId.INDENTATION, "spaces", 0);
    }

    @Test
    public void comments(){
        assertEquals(Arrays.asList(issue(RuleId.COMMENTS, 1, 6, "too few spaces before comment")),
                check(RuleId.COMMENTS, lines("a: 1 # note", "")));
        assertEquals(Arrays.asList(issue(RuleId.COMMENTS, 1, 2, "missing starting space in comment")),
                check(RuleId.COMMENTS, lines("#note", "a: 1", "")));
        assertTrue(check(RuleId.COMMENTS, lines("#!/usr/bin/env yamlint", "a: 1  # note", "## title", "")).isEmpty());
    }

    @Test
    public void comments_indentation(){
        assertEquals(Arrays.asList(issue(RuleId.COMMENTS_INDENTATION, 3, 2, "comment not indented like content")),
                check(RuleId.COMMENTS_INDENTATION, lines("a:", "  b: 1", " # bad", "c: 2", "")));
        assertTrue(check(RuleId.COMMENTS_INDENTATION, lines("a:", "  b: 1", "  # nested", "# top", "c: 2", "")).isEmpty());
    }
}

package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.IndentationChecker;
import io.hyperfoil.tools.yamlint.analysis.IndentationMismatch;
import io.hyperfoil.tools.yamlint.rule.AbstractRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Arrays;
import java.util.List;

/**
 * Reports the mismatches found by the {@link IndentationChecker}.
 */
public class IndentationRule extends AbstractRule {

    public static final String CONSISTENT = "consistent";

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.integerOr("spaces", 2, CONSISTENT),
            RuleOption.choice("indent-sequences", true, true, false, "whatever", CONSISTENT),
            RuleOption.bool("check-multi-line-strings", false)
    );

    private final IndentationChecker checker;

    public IndentationRule(RuleSettings settings){
        super(settings);
        Object value = options.get("spaces");
        Integer spaces = value instanceof Integer ? (Integer) value : null;
        if(spaces != null && spaces <= 0){
            throw new IllegalArgumentException("spaces must be a positive integer or \"" + CONSISTENT + "\"");
        }
        checker = new IndentationChecker(spaces,
                IndentationChecker.IndentSequences.from(options.get("indent-sequences")),
                options.getBoolean("check-multi-line-strings"));
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        for(IndentationMismatch mismatch : checker.check(analysis.getTokens())){
            issues.add(issue(mismatch.getLine(), mismatch.getColumn(), mismatch.getMessage()));
        }
    }
}

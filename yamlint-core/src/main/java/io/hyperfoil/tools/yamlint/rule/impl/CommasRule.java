package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

public class CommasRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.integer("max-spaces-before", 0),
            RuleOption.integer("min-spaces-after", 1),
            RuleOption.integer("max-spaces-after", 1)
    );

    private final int maxBefore;
    private final int minAfter;
    private final int maxAfter;

    public CommasRule(RuleSettings settings){
        super(settings);
        maxBefore = options.getInt("max-spaces-before");
        minAfter = options.getInt("min-spaces-after");
        maxAfter = options.getInt("max-spaces-after");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(!tokens.is(index, Token.ID.FlowEntry)){
            return;
        }
        Token prev = tokens.token(index - 1);
        Token token = tokens.token(index);
        if(prev != null && maxBefore != -1 && prev.getEndMark().getLine() < token.getStartMark().getLine()){
            issues.add(issue(tokens.lineOf(index), Math.max(1, token.getStartMark().getColumn()), "too many spaces before comma"));
        }else{
            add(issues, spacesBefore(tokens, index, -1, maxBefore, null, "too many spaces before comma"));
        }
        add(issues, spacesAfter(tokens, index, minAfter, maxAfter, "too few spaces after comma", "too many spaces after comma"));
    }
}

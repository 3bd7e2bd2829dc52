package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Collections;
import java.util.List;

public class HyphensRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.integer("max-spaces-after", 1));

    private final int maxAfter;

    public HyphensRule(RuleSettings settings){
        super(settings);
        maxAfter = options.getInt("max-spaces-after");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(tokens.is(index, Token.ID.BlockEntry)){
            add(issues, spacesAfter(tokens, index, -1, maxAfter, null, "too many spaces after hyphen"));
        }
    }
}

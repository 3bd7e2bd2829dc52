package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

public class ColonsRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.integer("max-spaces-before", 0),
            RuleOption.integer("max-spaces-after", 1)
    );

    private final int maxBefore;
    private final int maxAfter;

    public ColonsRule(RuleSettings settings){
        super(settings);
        maxBefore = options.getInt("max-spaces-before");
        maxAfter = options.getInt("max-spaces-after");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(tokens.is(index, Token.ID.Value)){
            // "*alias :" needs the space
            boolean afterAlias = tokens.is(index - 1, Token.ID.Alias)
                    && tokens.offsetOf(index) - tokens.token(index - 1).getEndMark().getIndex() == 1;
            if(!afterAlias){
                add(issues, spacesBefore(tokens, index, -1, maxBefore, null, "too many spaces before colon"));
                add(issues, spacesAfter(tokens, index, -1, maxAfter, null, "too many spaces after colon"));
            }
        }
        if(tokens.is(index, Token.ID.Key) && isExplicitKey(tokens, index)){
            add(issues, spacesAfter(tokens, index, -1, maxAfter, null, "too many spaces after question mark"));
        }
    }

    static boolean isExplicitKey(TokenAnalysis tokens, int index){
        Token token = tokens.token(index);
        int start = token.getStartMark().getIndex();
        return start < token.getEndMark().getIndex() && tokens.charAt(start) == '?';
    }
}

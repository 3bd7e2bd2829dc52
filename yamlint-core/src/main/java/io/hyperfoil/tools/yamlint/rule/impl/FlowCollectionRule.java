package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.List;

/**
 * Shared checks of {@link BracesRule} and {@link BracketsRule}.
 */
abstract class FlowCollectionRule extends TokenRule {

    private final Token.ID open;
    private final Token.ID close;
    private final String collection;
    private final String marks;
    private final Object forbid;
    private final int minInside;
    private final int maxInside;
    private final int minInsideEmpty;
    private final int maxInsideEmpty;

    FlowCollectionRule(RuleSettings settings, Token.ID open, Token.ID close, String collection, String marks){
        super(settings);
        this.open = open;
        this.close = close;
        this.collection = collection;
        this.marks = marks;
        this.forbid = options.get("forbid");
        this.minInside = options.getInt("min-spaces-inside");
        this.maxInside = options.getInt("max-spaces-inside");
        int minEmpty = options.getInt("min-spaces-inside-empty");
        int maxEmpty = options.getInt("max-spaces-inside-empty");
        this.minInsideEmpty = minEmpty != -1 ? minEmpty : minInside;
        this.maxInsideEmpty = maxEmpty != -1 ? maxEmpty : maxInside;
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        Token.ID kind = tokens.kind(index);
        if(kind == open){
            boolean empty = tokens.is(index + 1, close);
            if(Boolean.TRUE.equals(forbid) || ("non-empty".equals(forbid) && !empty)){
                Token token = tokens.token(index);
                issues.add(issue(tokens.lineOf(index), token.getEndMark().getColumn() + 1, "forbidden " + collection));
            }else if(empty){
                add(issues, spacesAfter(tokens, index, minInsideEmpty, maxInsideEmpty,
                        "too few spaces inside empty " + marks, "too many spaces inside empty " + marks));
            }else{
                add(issues, spacesAfter(tokens, index, minInside, maxInside,
                        "too few spaces inside " + marks, "too many spaces inside " + marks));
            }
        }else if(kind == close && !tokens.is(index - 1, open)){
            add(issues, spacesBefore(tokens, index, minInside, maxInside,
                    "too few spaces inside " + marks, "too many spaces inside " + marks));
        }
    }
}

package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import org.yaml.snakeyaml.tokens.Token;

import java.util.List;

/**
 * A rule that looks at each token with its neighbours.
 */
public abstract class TokenRule extends AbstractRule {

    protected TokenRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        TokenAnalysis tokens = analysis.getTokens();
        start(tokens);
        for(int i=0; i<tokens.size(); i++){
            token(tokens, i, issues);
        }
    }

    /**
     * Called before the first token of every file, rules with state reset it here.
     */
    protected void start(TokenAnalysis tokens){}

    /**
     * @param index the token to check, {@code index - 1} and {@code index + 1} are its neighbours
     */
    protected abstract void token(TokenAnalysis tokens, int index, List<Issue> issues);

    /**
     * Checks the spaces between a token and the next one on the same line, -1 disables a bound.
     */
    protected Issue spacesAfter(TokenAnalysis tokens, int index, int min, int max, String minMessage, String maxMessage){
        Token token = tokens.token(index);
        Token next = tokens.token(index + 1);
        if(next == null || token.getEndMark().getLine() != next.getStartMark().getLine()){
            return null;
        }
        int spaces = next.getStartMark().getIndex() - token.getEndMark().getIndex();
        int line = token.getStartMark().getLine() + 1;
        if(max != -1 && spaces > max){
            return issue(line, next.getStartMark().getColumn(), maxMessage);
        }else if(min != -1 && spaces < min){
            return issue(line, next.getStartMark().getColumn() + 1, minMessage);
        }
        return null;
    }

    /**
     * Checks the spaces between a token and the previous one on the same line, -1 disables a bound.
     */
    protected Issue spacesBefore(TokenAnalysis tokens, int index, int min, int max, String minMessage, String maxMessage){
        Token token = tokens.token(index);
        Token prev = tokens.token(index - 1);
        if(prev == null || prev.getEndMark().getLine() != token.getStartMark().getLine()){
            return null;
        }
        int prevEnd = prev.getEndMark().getIndex();
        // scalars can end at the start of the following line
        if(prevEnd > 0 && tokens.charAt(prevEnd - 1) == '\n'){
            return null;
        }
        int spaces = token.getStartMark().getIndex() - prevEnd;
        int line = token.getStartMark().getLine() + 1;
        if(max != -1 && spaces > max){
            return issue(line, token.getStartMark().getColumn(), maxMessage);
        }else if(min != -1 && spaces < min){
            return issue(line, token.getStartMark().getColumn() + 1, minMessage);
        }
        return null;
    }

    protected static void add(List<Issue> issues, Issue issue){
        if(issue != null){
            issues.add(issue);
        }
    }
}

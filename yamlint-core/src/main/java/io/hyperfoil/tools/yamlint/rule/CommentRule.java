package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.Comment;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;

import java.util.List;

/**
 * A rule that looks at each comment.
 */
public abstract class CommentRule extends AbstractRule {

    protected CommentRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        TokenAnalysis tokens = analysis.getTokens();
        for(Comment comment : tokens.getComments()){
            comment(tokens, comment, issues);
        }
    }

    protected abstract void comment(TokenAnalysis tokens, Comment comment, List<Issue> issues);
}

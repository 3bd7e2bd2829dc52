package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.Comment;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.CommentRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Collections;
import java.util.List;

/**
 * Comments on their own line must be indented like the content before or after them.
 */
public class CommentsIndentationRule extends CommentRule {

    public static final List<RuleOption> OPTIONS = Collections.emptyList();

    public CommentsIndentationRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void comment(TokenAnalysis tokens, Comment comment, List<Issue> issues){
        int before = comment.getTokenBefore();
        boolean afterStart = tokens.is(before, Token.ID.StreamStart);
        if(!afterStart && tokens.token(before).getEndMark().getLine() + 1 == comment.getLine()){
            return;
        }
        int after = comment.getTokenAfter();
        int nextIndent = after < 0 || tokens.is(after, Token.ID.StreamEnd) ? 0 : tokens.columnOf(after);
        int prevIndent = afterStart ? 0 : tokens.lineIndent(before);
        if(prevIndent <= nextIndent){
            prevIndent = nextIndent;
        }
        // a comment back at a lower valid indentation moves the following ones with it
        Comment previous = comment.getCommentBefore();
        if(previous != null && !previous.isInline()){
            prevIndent = previous.getColumn() - 1;
        }
        int column = comment.getColumn() - 1;
        if(column != prevIndent && column != nextIndent){
            issues.add(issue(comment.getLine(), comment.getColumn(), "comment not indented like content"));
        }
    }
}

package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.Comment;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.CommentRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Arrays;
import java.util.List;

/**
 * A space after the '#' and enough spaces between content and a trailing comment.
 */
public class CommentsRule extends CommentRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.bool("require-starting-space", true),
            RuleOption.bool("ignore-shebangs", true),
            RuleOption.integer("min-spaces-from-content", 2)
    );

    private final boolean requireStartingSpace;
    private final boolean ignoreShebangs;
    private final int minSpacesFromContent;

    public CommentsRule(RuleSettings settings){
        super(settings);
        requireStartingSpace = options.getBoolean("require-starting-space");
        ignoreShebangs = options.getBoolean("ignore-shebangs");
        minSpacesFromContent = options.getInt("min-spaces-from-content");
    }

    @Override
    protected void comment(TokenAnalysis tokens, Comment comment, List<Issue> issues){
        if(minSpacesFromContent != -1 && comment.isInline()){
            int contentEnd = tokens.token(comment.getTokenBefore()).getEndMark().getIndex();
            if(comment.getOffset() - contentEnd < minSpacesFromContent){
                issues.add(issue(comment.getLine(), comment.getColumn(), "too few spaces before comment"));
            }
        }
        if(requireStartingSpace){
            int textStart = comment.getOffset() + 1;
            while(textStart < tokens.length() && tokens.charAt(textStart) == '#'){
                textStart++;
            }
            if(textStart < tokens.length()){
                if(ignoreShebangs && comment.getLine() == 1 && comment.getColumn() == 1 && isShebang(tokens, textStart)){
                    return;
                }
                int c = tokens.charAt(textStart);
                if(c != ' ' && c != '\n' && c != '\r' && c != 0){
                    issues.add(issue(comment.getLine(), comment.getColumn() + textStart - comment.getOffset(), "missing starting space in comment"));
                }
            }
        }
    }

    private static boolean isShebang(TokenAnalysis tokens, int textStart){
        return tokens.charAt(textStart) == '!'
                && textStart + 1 < tokens.length()
                && !Character.isWhitespace(tokens.charAt(textStart + 1));
    }
}

package io.hyperfoil.tools.yamlint.analysis;

import org.yaml.snakeyaml.tokens.Token;

/**
 * A comment found between two tokens. Lines and columns are 1-based, the offset is the code point index of the '#'.
 */
public class Comment {

    private final int line;
    private final int column;
    private final int offset;
    private final int tokenBefore;
    private final int tokenAfter;
    private final Comment commentBefore;
    private final TokenAnalysis tokens;

    Comment(TokenAnalysis tokens, int line, int column, int offset, int tokenBefore, int tokenAfter, Comment commentBefore){
        this.tokens = tokens;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.tokenBefore = tokenBefore;
        this.tokenAfter = tokenAfter;
        this.commentBefore = commentBefore;
    }

    public int getLine(){return line;}
    public int getColumn(){return column;}
    public int getOffset(){return offset;}

    /**
     * @return index of the token before the comment
     */
    public int getTokenBefore(){return tokenBefore;}

    /**
     * @return index of the token after the comment, or -1 when the comment is after the last token
     */
    public int getTokenAfter(){return tokenAfter;}

    public Comment getCommentBefore(){return commentBefore;}

    public boolean isInline(){
        Token before = tokens.token(tokenBefore);
        if(before.getTokenId() == Token.ID.StreamStart){
            return false;
        }
        int endOffset = before.getEndMark().getIndex();
        return line == before.getEndMark().getLine() + 1
                && endOffset > 0
                && tokens.charAt(endOffset - 1) != '\n';
    }

    public String getText(){
        int end = offset;
        while(end < tokens.length() && tokens.charAt(end) != '\n' && tokens.charAt(end) != '\r'){
            end++;
        }
        return tokens.substring(offset, end);
    }

    @Override
    public String toString(){
        return line + ":" + column + " " + getText();
    }
}

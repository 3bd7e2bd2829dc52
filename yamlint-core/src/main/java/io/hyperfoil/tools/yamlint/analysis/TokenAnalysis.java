package io.hyperfoil.tools.yamlint.analysis;

import org.yaml.snakeyaml.tokens.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The token stream of one document with the 1-based line and the flow nesting depth of every token.
 * Also recovers the comments the scanner skips over.
 */
public class TokenAnalysis {

    public static TokenAnalysis analyze(String content){
        return new TokenAnalysis(content, YamlScanner.scan(content));
    }

    private final List<Token> tokens;
    private final int[] lines;
    private final int[] flowDepths;
    private final int[] buffer;
    private List<Comment> comments;

    TokenAnalysis(String content, List<Token> tokens){
        this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
        this.buffer = content == null ? new int[0] : content.codePoints().toArray();
        this.lines = new int[tokens.size()];
        this.flowDepths = new int[tokens.size()];
        int depth = 0;
        for(int i=0; i<tokens.size(); i++){
            Token token = tokens.get(i);
            lines[i] = token.getStartMark().getLine() + 1;
            switch (token.getTokenId()){
                case FlowMappingStart:
                case FlowSequenceStart:
                    depth++;
                    flowDepths[i] = depth;
                    break;
                case FlowMappingEnd:
                case FlowSequenceEnd:
                    flowDepths[i] = depth;
                    if(depth > 0){
                        depth--;
                    }
                    break;
                default:
                    flowDepths[i] = depth;
            }
        }
    }

    public int size(){return tokens.size();}
    public List<Token> getTokens(){return tokens;}

    public Token token(int index){
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }
    public Token.ID kind(int index){
        Token token = token(index);
        return token == null ? null : token.getTokenId();
    }
    public boolean is(int index, Token.ID... kinds){
        Token.ID kind = kind(index);
        if(kind == null){
            return false;
        }
        for(Token.ID k : kinds){
            if(k == kind){
                return true;
            }
        }
        return false;
    }

    /**
     * @return the 1-based line the token starts on
     */
    public int lineOf(int index){return lines[index];}

    /**
     * @return the 0-based column the token starts at
     */
    public int columnOf(int index){return tokens.get(index).getStartMark().getColumn();}
    public int offsetOf(int index){return tokens.get(index).getStartMark().getIndex();}
    public int flowDepth(int index){return flowDepths[index];}
    public boolean isInFlow(int index){return flowDepths[index] > 0;}

    public List<Integer> tokensForLine(int line){
        List<Integer> rtrn = new ArrayList<>();
        for(int i=0; i<lines.length; i++){
            if(lines[i] == line){
                rtrn.add(i);
            }else if(lines[i] > line){
                break;
            }
        }
        return rtrn;
    }

    public int length(){return buffer.length;}
    public int charAt(int offset){return buffer[offset];}
    public String substring(int start, int end){
        return new String(buffer, start, Math.max(0, end - start));
    }

    /**
     * Indentation of the line the token starts on.
     */
    public int lineIndent(int index){
        int pointer = offsetOf(index);
        int start = pointer;
        while(start > 0 && buffer[start - 1] != '\n'){
            start--;
        }
        int content = start;
        while(content < buffer.length && buffer[content] == ' '){
            content++;
        }
        return content - start;
    }

    public List<Comment> getComments(){
        if(comments == null){
            comments = Collections.unmodifiableList(findComments());
        }
        return comments;
    }

    private List<Comment> findComments(){
        List<Comment> rtrn = new ArrayList<>();
        for(int i=0; i<tokens.size(); i++){
            Token current = tokens.get(i);
            Token next = token(i + 1);
            int from = current.getEndMark().getIndex();
            int to;
            if(next == null){
                to = buffer.length;
            }else if(current.getEndMark().getLine() == next.getStartMark().getLine()
                    && current.getTokenId() != Token.ID.StreamStart
                    && next.getTokenId() != Token.ID.StreamEnd){
                continue;
            }else{
                to = next.getStartMark().getIndex();
            }
            int line = current.getEndMark().getLine() + 1;
            int column = current.getEndMark().getColumn() + 1;
            int lineStart = from;
            Comment before = null;
            for(int p = from; p <= to; p++){
                if(p == to || buffer[p] == '\n'){
                    for(int c = lineStart; c < p; c++){
                        if(buffer[c] == '#'){
                            Comment comment = new Comment(this, line, column + (c - lineStart), c, i, next == null ? -1 : i + 1, before);
                            rtrn.add(comment);
                            before = comment;
                            break;
                        }
                    }
                    line++;
                    column = 1;
                    lineStart = p + 1;
                }
            }
        }
        return rtrn;
    }
}

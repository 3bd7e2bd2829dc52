package io.hyperfoil.tools.yamlint.analysis;

import org.jboss.logging.Logger;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the expected indentation of every line from the token stream.
 * <p>
 * A stack of {@link Parent} frames follows the structure of the document: mappings, sequences, sequence entries,
 * keys and values push a frame with the column their content must start at and pop it when the structure ends.
 * The first visible token of each line is compared to the column of the frame on top of the stack.
 * When {@code spaces} is not fixed the indentation width is learnt from the first indented construct.
 */
public class IndentationChecker {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public enum IndentSequences {
        /** sequences under a key must be indented */
        Indented,
        /** sequences under a key must not be indented */
        NotIndented,
        /** both forms are accepted */
        Whatever,
        /** the first sequence found decides for the rest of the document */
        Consistent;

        public static IndentSequences from(Object value){
            if(Boolean.TRUE.equals(value)){
                return Indented;
            }else if(Boolean.FALSE.equals(value)){
                return NotIndented;
            }else if("whatever".equals(value)){
                return Whatever;
            }else if("consistent".equals(value)){
                return Consistent;
            }
            return null;
        }
    }

    private final Integer spaces;
    private final IndentSequences indentSequences;
    private final boolean checkMultiLineStrings;

    public IndentationChecker(){
        this(2, IndentSequences.Indented, false);
    }

    /**
     * @param spaces the indentation width, null to use the width of the first indented construct
     */
    public IndentationChecker(Integer spaces, IndentSequences indentSequences, boolean checkMultiLineStrings){
        this.spaces = spaces;
        this.indentSequences = indentSequences;
        this.checkMultiLineStrings = checkMultiLineStrings;
    }

    public List<IndentationMismatch> check(TokenAnalysis tokens){
        return new Scan(tokens).run();
    }

    private static class UnexpectedToken extends RuntimeException {
        UnexpectedToken(){
            super("cannot infer indentation: unexpected token", null, false, false);
        }
    }

    private class Scan {

        private final TokenAnalysis tokens;
        private final List<Parent> stack = new ArrayList<>();
        private final List<IndentationMismatch> problems = new ArrayList<>();
        private int curLine = -1;
        private int curLineIndent = 0;
        private Integer spaces;
        private IndentSequences sequences;

        Scan(TokenAnalysis tokens){
            this.tokens = tokens;
            this.spaces = IndentationChecker.this.spaces;
            this.sequences = IndentationChecker.this.indentSequences;
        }

        List<IndentationMismatch> run(){
            stack.add(new Parent(Parent.Type.Root, 0));
            for(int i=0; i<tokens.size(); i++){
                try {
                    step(i);
                } catch (UnexpectedToken e) {
                    logger.debugf("unexpected %s at %d:%d", tokens.kind(i), tokens.lineOf(i), tokens.columnOf(i) + 1);
                    problems.add(new IndentationMismatch(tokens.lineOf(i), IndentationMismatch.UNKNOWN, tokens.columnOf(i), e.getMessage()));
                }
            }
            return problems;
        }

        private Parent top(){
            return stack.get(stack.size() - 1);
        }
        private Parent below(){
            return stack.size() > 1 ? stack.get(stack.size() - 2) : null;
        }
        private void pop(){
            if(stack.size() > 1){
                stack.remove(stack.size() - 1);
            }
        }

        private int startLine(int index){return tokens.token(index).getStartMark().getLine();}
        private int endLine(int index){return tokens.token(index).getEndMark().getLine();}

        private int detectIndent(int base, int index){
            Token next = tokens.token(index);
            if(next == null){
                return spaces == null ? base : base + spaces;
            }
            return detectIndentFound(base, next.getStartMark().getColumn());
        }

        private int detectIndentFound(int base, int found){
            if(spaces == null){
                spaces = found - base;
            }
            return base + spaces;
        }

        private boolean isExplicitKey(int index){
            Token token = tokens.token(index);
            int start = token.getStartMark().getIndex();
            return start < token.getEndMark().getIndex() && tokens.charAt(start) == '?';
        }

        private int realEndLine(int index){
            Token token = tokens.token(index);
            int endLine = token.getEndMark().getLine() + 1;
            if(token.getTokenId() != Token.ID.Scalar){
                return endLine;
            }
            int pos = Math.min(token.getEndMark().getIndex(), tokens.length()) - 1;
            int limit = token.getStartMark().getIndex() - 1;
            while(pos >= 0 && pos >= limit && Character.isWhitespace(tokens.charAt(pos))){
                if(tokens.charAt(pos) == '\n'){
                    endLine--;
                }
                pos--;
            }
            return endLine;
        }

        private void report(int index, int line, int expected, int found){
            if(tokens.is(index, Token.ID.BlockEntry)){
                for(int s = stack.size() - 1; s >= 0; s--){
                    Parent parent = stack.get(s);
                    if(parent.getType() == Parent.Type.Key){
                        if(parent.isReported()){
                            return;
                        }
                        parent.setReported(true);
                        break;
                    }
                }
            }
            problems.add(new IndentationMismatch(line, expected, found));
        }

        private void step(int i){
            Token token = tokens.token(i);
            Token.ID kind = token.getTokenId();
            int prev = i - 1;
            int next = i + 1;

            boolean visible = kind != Token.ID.StreamStart
                    && kind != Token.ID.StreamEnd
                    && kind != Token.ID.BlockEnd
                    && !(kind == Token.ID.Scalar && ((ScalarToken) token).getValue().isEmpty());
            int line = tokens.lineOf(i);
            boolean firstInLine = visible && line > curLine;
            int found = token.getStartMark().getColumn();

            if(firstInLine){
                int expected = top().getIndent();
                if(kind == Token.ID.FlowMappingEnd || kind == Token.ID.FlowSequenceEnd){
                    expected = top().getLineIndent();
                }else if(top().getType() == Parent.Type.Key && top().isExplicitKey() && kind != Token.ID.Value){
                    expected = detectIndent(expected, i);
                }
                if(found != expected){
                    report(i, line, expected, found);
                }
            }

            if(kind == Token.ID.Scalar && checkMultiLineStrings){
                checkScalar(i);
            }

            if(visible){
                curLine = realEndLine(i);
                if(firstInLine){
                    curLineIndent = found;
                }
            }

            switch (kind){
                case BlockMappingStart:
                    if(!tokens.is(next, Token.ID.Key) || startLine(next) != startLine(i)){
                        throw new UnexpectedToken();
                    }
                    stack.add(new Parent(Parent.Type.BlockMap, found));
                    break;
                case FlowMappingStart:
                case FlowSequenceStart: {
                    int indent = tokens.token(next) != null && startLine(next) == startLine(i)
                            ? tokens.columnOf(next)
                            : detectIndent(curLineIndent, next);
                    Parent.Type type = kind == Token.ID.FlowMappingStart ? Parent.Type.FlowMap : Parent.Type.FlowSeq;
                    stack.add(new Parent(type, indent, curLineIndent));
                    break;
                }
                case BlockSequenceStart:
                    if(!tokens.is(next, Token.ID.BlockEntry) || startLine(next) != startLine(i)){
                        throw new UnexpectedToken();
                    }
                    stack.add(new Parent(Parent.Type.BlockSeq, found));
                    break;
                case BlockEntry:
                    if(tokens.token(next) != null && !tokens.is(next, Token.ID.BlockEntry, Token.ID.BlockEnd)){
                        if(top().getType() != Parent.Type.BlockSeq){
                            Parent implicit = new Parent(Parent.Type.BlockSeq, found);
                            implicit.setImplicitBlockSeq(true);
                            stack.add(implicit);
                        }
                        int indent;
                        if(startLine(next) == endLine(i) || tokens.columnOf(next) == found){
                            indent = tokens.columnOf(next);
                        }else{
                            indent = detectIndent(found, next);
                        }
                        stack.add(new Parent(Parent.Type.BlockEntry, indent));
                    }
                    break;
                case Key: {
                    Parent key = new Parent(Parent.Type.Key, top().getIndent());
                    key.setExplicitKey(isExplicitKey(i));
                    stack.add(key);
                    break;
                }
                case Value:
                    next = pushValue(i, prev, next);
                    break;
                default:
            }

            boolean consumed = false;
            while(true){
                Parent top = top();
                Parent.Type type = top.getType();
                if(type == Parent.Type.FlowSeq && kind == Token.ID.FlowSequenceEnd && !consumed){
                    pop();
                    consumed = true;
                }else if(type == Parent.Type.FlowMap && kind == Token.ID.FlowMappingEnd && !consumed){
                    pop();
                    consumed = true;
                }else if((type == Parent.Type.BlockMap || type == Parent.Type.BlockSeq) && kind == Token.ID.BlockEnd
                        && !top.isImplicitBlockSeq() && !consumed){
                    pop();
                    consumed = true;
                }else if(type == Parent.Type.BlockEntry
                        && kind != Token.ID.BlockEntry
                        && below() != null && below().isImplicitBlockSeq()
                        && kind != Token.ID.Anchor && kind != Token.ID.Tag
                        && !tokens.is(next, Token.ID.BlockEntry)){
                    pop();
                    pop();
                }else if(type == Parent.Type.BlockEntry && tokens.is(next, Token.ID.BlockEntry, Token.ID.BlockEnd)){
                    pop();
                }else if(type == Parent.Type.Value && kind != Token.ID.Value && kind != Token.ID.Anchor && kind != Token.ID.Tag){
                    if(below() == null || below().getType() != Parent.Type.Key){
                        throw new UnexpectedToken();
                    }
                    pop();
                    pop();
                }else if(type == Parent.Type.Key
                        && tokens.is(next, Token.ID.BlockEnd, Token.ID.FlowMappingEnd, Token.ID.FlowSequenceEnd, Token.ID.Key)){
                    pop();
                }else{
                    break;
                }
            }
        }

        /**
         * Pushes the frame of a value and returns the index of the token that starts the value.
         */
        private int pushValue(int i, int prev, int next){
            if(top().getType() != Parent.Type.Key){
                throw new UnexpectedToken();
            }
            Parent key = top();
            // key: &anchor or key: !!tag with the value on the following line
            if(tokens.is(next, Token.ID.Anchor, Token.ID.Tag) && tokens.token(prev) != null && tokens.token(next + 1) != null){
                if(startLine(next) == startLine(prev) && startLine(next) < startLine(next + 1)){
                    next = next + 1;
                }
            }
            if(tokens.token(next) == null
                    || tokens.is(next, Token.ID.BlockEnd, Token.ID.FlowMappingEnd, Token.ID.FlowSequenceEnd, Token.ID.Key)){
                return next;
            }
            int indent;
            if(key.isExplicitKey()){
                indent = detectIndent(key.getIndent(), next);
            }else if(tokens.token(prev) != null && startLine(next) == startLine(prev)){
                indent = tokens.columnOf(next);
            }else if(tokens.is(next, Token.ID.BlockSequenceStart, Token.ID.BlockEntry)){
                indent = sequenceIndent(key, next);
            }else{
                indent = detectIndent(key.getIndent(), next);
            }
            stack.add(new Parent(Parent.Type.Value, indent));
            return next;
        }

        private int sequenceIndent(Parent key, int next){
            switch (sequences){
                case NotIndented:
                    return key.getIndent();
                case Indented:
                    if(spaces == null && tokens.columnOf(next) - key.getIndent() == 0){
                        // the width is not known yet and the sequence gives no hint
                        return IndentationMismatch.UNKNOWN;
                    }
                    return detectIndent(key.getIndent(), next);
                default:
                    if(tokens.columnOf(next) == key.getIndent()){
                        if(sequences == IndentSequences.Consistent){
                            sequences = IndentSequences.NotIndented;
                        }
                        return key.getIndent();
                    }
                    if(sequences == IndentSequences.Consistent){
                        sequences = IndentSequences.Indented;
                    }
                    return detectIndent(key.getIndent(), next);
            }
        }

        private void checkScalar(int i){
            ScalarToken token = (ScalarToken) tokens.token(i);
            if(token.getStartMark().getLine() == token.getEndMark().getLine()){
                return;
            }
            Integer expected = null;
            int lineNo = tokens.lineOf(i);
            int lineStart = token.getStartMark().getIndex();
            int end = Math.min(token.getEndMark().getIndex() - 1, tokens.length());
            while(true){
                int newline = -1;
                for(int p = lineStart; p < end; p++){
                    if(tokens.charAt(p) == '\n'){
                        newline = p;
                        break;
                    }
                }
                if(newline < 0){
                    break;
                }
                lineStart = newline + 1;
                lineNo++;
                int indent = 0;
                while(lineStart + indent < tokens.length() && tokens.charAt(lineStart + indent) == ' '){
                    indent++;
                }
                if(lineStart + indent >= tokens.length()){
                    break;
                }
                if(tokens.charAt(lineStart + indent) == '\n' || tokens.charAt(lineStart + indent) == '\r'){
                    continue;
                }
                if(expected == null){
                    expected = scalarIndent(i, token, indent);
                }
                if(indent != expected){
                    problems.add(new IndentationMismatch(lineNo, expected, indent));
                }
            }
        }

        private int scalarIndent(int i, ScalarToken token, int found){
            int column = token.getStartMark().getColumn();
            if(token.getPlain()){
                return column;
            }
            DumperOptions.ScalarStyle style = token.getStyle();
            if(style == DumperOptions.ScalarStyle.DOUBLE_QUOTED || style == DumperOptions.ScalarStyle.SINGLE_QUOTED){
                return column + 1;
            }
            Parent top = top();
            switch (top.getType()){
                case BlockEntry:
                case Key:
                    return detectIndentFound(column, found);
                case Value:
                    if(tokens.lineOf(i) > curLine){
                        return detectIndentFound(top.getIndent(), found);
                    }else if(below() != null && below().isExplicitKey()){
                        return detectIndentFound(column, found);
                    }
                    return detectIndentFound(below() == null ? 0 : below().getIndent(), found);
                default:
                    return detectIndentFound(top.getIndent(), found);
            }
        }
    }
}

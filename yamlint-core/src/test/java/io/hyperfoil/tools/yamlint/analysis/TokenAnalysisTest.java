package io.hyperfoil.tools.yamlint.analysis;

import org.junit.Test;
import org.yaml.snakeyaml.tokens.Token;

import java.util.List;

import static org.junit.Assert.*;

public class TokenAnalysisTest {

    private static int indexOf(TokenAnalysis tokens, Token.ID kind, int occurrence){
        int seen = 0;
        for(int i=0; i<tokens.size(); i++){
            if(tokens.is(i, kind)){
                if(seen == occurrence){
                    return i;
                }
                seen++;
            }
        }
        return -1;
    }

    @Test
    public void flow_depth_nested(){
        TokenAnalysis tokens = TokenAnalysis.analyze("a: {b: [1, 2]}\n");
        int mapStart = indexOf(tokens, Token.ID.FlowMappingStart, 0);
        int seqStart = indexOf(tokens, Token.ID.FlowSequenceStart, 0);
        int seqEnd = indexOf(tokens, Token.ID.FlowSequenceEnd, 0);
        int mapEnd = indexOf(tokens, Token.ID.FlowMappingEnd, 0);
        assertEquals("flow mapping start", 1, tokens.flowDepth(mapStart));
        assertEquals("flow sequence start", 2, tokens.flowDepth(seqStart));
        assertEquals("scalar inside the sequence", 2, tokens.flowDepth(seqStart + 1));
        assertEquals("closing bracket keeps its depth", 2, tokens.flowDepth(seqEnd));
        assertEquals("closing brace keeps its depth", 1, tokens.flowDepth(mapEnd));
        assertFalse("key a is outside any flow", tokens.isInFlow(indexOf(tokens, Token.ID.Scalar, 0)));
        assertEquals("block end after the flow", 0, tokens.flowDepth(indexOf(tokens, Token.ID.BlockEnd, 0)));
    }

    @Test
    public void flow_depth_never_negative(){
        TokenAnalysis tokens = TokenAnalysis.analyze("a: 1]\n");
        for(int i=0; i<tokens.size(); i++){
            assertTrue("depth at " + i, tokens.flowDepth(i) >= 0);
        }
    }

    @Test
    public void lines_are_one_based(){
        TokenAnalysis tokens = TokenAnalysis.analyze("a: 1\nb: 2\n");
        int b = indexOf(tokens, Token.ID.Scalar, 2);
        assertEquals("b", 2, tokens.lineOf(b));
        assertEquals("b column", 0, tokens.columnOf(b));
        List<Integer> second = tokens.tokensForLine(2);
        assertTrue("line 2 tokens " + second, second.contains(b));
    }

    @Test
    public void malformed_input_still_has_tokens(){
        TokenAnalysis tokens = TokenAnalysis.analyze("a: [1, 2\nb: \"open\n");
        assertTrue("tokens before the error are kept", tokens.size() > 0);
        assertTrue(tokens.is(0, Token.ID.StreamStart));
    }

    @Test
    public void null_safe_neighbours(){
        TokenAnalysis tokens = TokenAnalysis.analyze("a: 1\n");
        assertNull(tokens.token(-1));
        assertNull(tokens.kind(tokens.size()));
        assertFalse(tokens.is(-1, Token.ID.StreamStart));
    }

    @Test
    public void comments_between_tokens(){
        TokenAnalysis tokens = TokenAnalysis.analyze(String.join("\n",
                "a: 1  # note",
                "# full",
                "b: 2",
                ""
        ));
        List<Comment> comments = tokens.getComments();
        assertEquals("comments " + comments, 2, comments.size());
        Comment inline = comments.get(0);
        assertEquals(1, inline.getLine());
        assertEquals(7, inline.getColumn());
        assertTrue("trailing comment", inline.isInline());
        assertEquals("# note", inline.getText());
        Comment full = comments.get(1);
        assertEquals(2, full.getLine());
        assertEquals(1, full.getColumn());
        assertFalse("own line comment", full.isInline());
        assertSame(inline, full.getCommentBefore());
    }
}

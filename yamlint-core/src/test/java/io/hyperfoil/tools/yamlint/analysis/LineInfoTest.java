package io.hyperfoil.tools.yamlint.analysis;

import org.junit.Test;

import static org.junit.Assert.*;

public class LineInfoTest {

    @Test
    public void key_value_line(){
        LineInfo info = LineInfo.of(3, "  key: \"value\"  ");
        assertEquals(3, info.getLineNumber());
        assertEquals(2, info.getIndentation());
        assertEquals(2, info.getTrailingWhitespaceCount());
        assertTrue(info.hasTrailingWhitespace());
        assertTrue(info.hasColon());
        assertTrue(info.hasQuotes());
        assertFalse(info.hasBraces());
        assertFalse(info.hasBrackets());
        assertFalse(info.isEmpty());
        assertFalse(info.isComment());
        assertFalse(info.isListItem());
    }

    @Test
    public void comment_line(){
        LineInfo info = LineInfo.of(1, "    # comment");
        assertTrue(info.isComment());
        assertEquals(4, info.getIndentation());
        assertFalse(info.hasTrailingWhitespace());
    }

    @Test
    public void blank_line(){
        LineInfo info = LineInfo.of(1, "   ");
        assertTrue(info.isEmpty());
        assertEquals("whitespace only counts as trailing", 3, info.getTrailingWhitespaceCount());
        assertEquals(3, info.getLength());
    }

    @Test
    public void list_item_with_flow(){
        LineInfo info = LineInfo.of(1, "- {a: [1]}");
        assertTrue(info.isListItem());
        assertTrue(info.hasBraces());
        assertTrue(info.hasBrackets());
    }

    @Test
    public void length_counts_code_points(){
        LineInfo info = LineInfo.of(1, "k: 😀");
        assertEquals(4, info.getLength());
    }
}

package io.hyperfoil.tools.yamlint.analysis;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class ContentAnalysisTest {

    @Test
    public void duplicate_in_same_nested_mapping(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "a:",
                "  b: 1",
                "  b: 2",
                ""
        ));
        List<DuplicateKey> duplicates = analysis.getDuplicateKeys();
        assertEquals("duplicates " + duplicates, 1, duplicates.size());
        DuplicateKey duplicate = duplicates.get(0);
        assertEquals("b", duplicate.getKey());
        assertEquals(2, duplicate.getFirstLine());
        assertEquals(3, duplicate.getLine());
        assertEquals(2, duplicate.getColumn());
    }

    @Test
    public void sibling_mappings_do_not_share_keys(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "a:",
                "  x: 1",
                "b:",
                "  x: 2",
                ""
        ));
        assertTrue("duplicates " + analysis.getDuplicateKeys(), analysis.getDuplicateKeys().isEmpty());
    }

    @Test
    public void repeated_root_key(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "name: one",
                "other:",
                "  name: nested",
                "name: two",
                ""
        ));
        List<DuplicateKey> duplicates = analysis.getDuplicateKeys();
        assertEquals("duplicates " + duplicates, 1, duplicates.size());
        assertEquals("name", duplicates.get(0).getKey());
        assertEquals(1, duplicates.get(0).getFirstLine());
        assertEquals(4, duplicates.get(0).getLine());
    }

    @Test
    public void list_items_are_separate_contexts(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "items:",
                "  - name: a",
                "    value: 1",
                "  - name: b",
                "    value: 2",
                ""
        ));
        assertTrue("duplicates " + analysis.getDuplicateKeys(), analysis.getDuplicateKeys().isEmpty());
    }

    @Test
    public void duplicate_inside_one_list_item(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "- name: a",
                "  name: b",
                ""
        ));
        assertEquals("duplicates " + analysis.getDuplicateKeys(), 1, analysis.getDuplicateKeys().size());
        assertEquals(2, analysis.getDuplicateKeys().get(0).getLine());
    }

    @Test
    public void document_marker_closes_contexts(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "---",
                "a: 1",
                "---",
                "a: 2",
                ""
        ));
        assertTrue("duplicates " + analysis.getDuplicateKeys(), analysis.getDuplicateKeys().isEmpty());
    }

    @Test
    public void block_scalar_body_is_not_keys(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "script: |",
                "  a: 1",
                "  a: 1",
                "next: value",
                ""
        ));
        assertTrue("duplicates " + analysis.getDuplicateKeys(), analysis.getDuplicateKeys().isEmpty());
    }

    @Test
    public void quoted_and_plain_keys_are_the_same_key(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "\"key\": 1",
                "key: 2",
                ""
        ));
        assertEquals(1, analysis.getDuplicateKeys().size());
    }

    @Test
    public void contexts_close_at_lower_indentation(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "a:",
                "  b: 1",
                "c: 2",
                ""
        ));
        List<MappingContext> contexts = analysis.getContexts();
        assertEquals("contexts " + contexts, 2, contexts.size());
        MappingContext root = contexts.get(0);
        MappingContext nested = contexts.get(1);
        assertEquals(0, root.getIndentation());
        assertEquals(2, nested.getIndentation());
        assertEquals(2, nested.getStartLine());
        assertEquals(2, nested.getEndLine());
        assertFalse(nested.isActive());
        assertEquals(3, root.getEndLine());
        assertEquals(Arrays.asList("a", "c"), Arrays.asList(root.getKeys().keySet().toArray()));
    }

    @Test
    public void truthy_words_per_line(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "enabled: yes",
                "list: [on, off]",
                "plain: value",
                ""
        ));
        assertEquals(Arrays.asList("yes"), analysis.getTruthyValues().get(1));
        assertFalse("flow punctuation is part of the word", analysis.getTruthyValues().containsKey(2));
        assertFalse(analysis.getTruthyValues().containsKey(3));
    }

    @Test
    public void empty_values(){
        ContentAnalysis analysis = ContentAnalysis.analyze(String.join("\n",
                "parent:",
                "  child: 1",
                "- item:",
                "blank:   ",
                ""
        ));
        assertEquals("parent", analysis.getEmptyValues().get(1));
        assertFalse(analysis.getEmptyValues().containsKey(2));
        assertEquals("item", analysis.getEmptyValues().get(3));
        assertEquals("blank", analysis.getEmptyValues().get(4));
    }

    @Test
    public void document_flags(){
        ContentAnalysis analysis = ContentAnalysis.analyze("---\na: 1\n...");
        assertTrue(analysis.startsWithDocumentStart());
        assertTrue(analysis.endsWithDocumentEnd());
        assertFalse(analysis.endsWithNewline());
        assertTrue(ContentAnalysis.analyze("a: 1\n").endsWithNewline());
    }

    @Test
    public void split_lines(){
        assertEquals(Arrays.asList("a", "b"), ContentAnalysis.splitLines("a\r\nb\n"));
        assertEquals(Arrays.asList("a", "", "b"), ContentAnalysis.splitLines("a\n\nb"));
        assertTrue(ContentAnalysis.splitLines("").isEmpty());
    }

    @Test
    public void tokens_on_demand(){
        ContentAnalysis analysis = ContentAnalysis.analyze("a: 1\n", false);
        assertFalse(analysis.hasTokens());
        assertTrue(analysis.getTokens().size() > 0);
    }
}

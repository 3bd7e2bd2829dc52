package io.hyperfoil.tools.yamlint.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for rules that rewrite the content.
 */
public final class TextEdits {

    private TextEdits(){}

    /**
     * @return "\r\n" when the content already uses it, "\n" otherwise
     */
    public static String lineBreak(String content){
        int newline = content.indexOf('\n');
        return newline > 0 && content.charAt(newline - 1) == '\r' ? "\r\n" : "\n";
    }

    /**
     * @return the offset each line starts at, index 0 is line 1
     */
    public static List<Integer> lineStarts(String content){
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for(int i=0; i<content.length(); i++){
            if(content.charAt(i) == '\n' && i + 1 < content.length()){
                starts.add(i + 1);
            }
        }
        return starts;
    }

    /**
     * Inserts a line before each of the given 1-based lines.
     * @param lines line numbers in any order, each inserted once
     */
    public static String insertLines(String content, List<Integer> lines, String text){
        List<Integer> starts = lineStarts(content);
        String lineBreak = lineBreak(content);
        StringBuilder builder = new StringBuilder(content);
        lines.stream().distinct().sorted((a, b) -> b - a).forEach(line -> {
            int offset = line - 1 < starts.size() ? starts.get(line - 1) : content.length();
            builder.insert(offset, text + lineBreak);
        });
        return builder.toString();
    }

    /**
     * @return the string offset of a code point index
     */
    public static int offset(String content, int codePointIndex){
        return content.offsetByCodePoints(0, Math.min(codePointIndex, content.codePointCount(0, content.length())));
    }
}

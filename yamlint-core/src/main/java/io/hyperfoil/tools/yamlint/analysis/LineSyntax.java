package io.hyperfoil.tools.yamlint.analysis;

import java.util.regex.Pattern;

/**
 * Line level YAML syntax helpers used by the single pass analysis.
 */
public final class LineSyntax {

    private static final Pattern BLOCK_SCALAR = Pattern.compile("^(?:[!&]\\S*\\s+)*[|>][0-9+-]*$");

    private LineSyntax(){}

    static boolean isBlank(char c){
        return c == ' ' || c == '\t';
    }

    public static boolean isListMarker(String content){
        return content.startsWith("-") && (content.length() == 1 || isBlank(content.charAt(1)));
    }

    /**
     * @return the content after any leading "- " sequence entry markers
     */
    public static String stripListMarkers(String content){
        String rtrn = content;
        while(isListMarker(rtrn)){
            int skip = 1;
            while(skip < rtrn.length() && isBlank(rtrn.charAt(skip))){
                skip++;
            }
            rtrn = rtrn.substring(skip);
        }
        return rtrn;
    }

    public static boolean isDocumentMarker(String trimmed){
        return trimmed.equals("---") || trimmed.equals("...") || trimmed.startsWith("--- ") || trimmed.startsWith("... ");
    }

    /**
     * Finds the ':' that separates a key from its value. The content must start at the key.
     * @return the index of the separator or -1 when the content is not a key
     */
    public static int separator(String content){
        if(content.isEmpty()){
            return -1;
        }
        char first = content.charAt(0);
        if(first == '"' || first == '\''){
            int end = closingQuote(content, first);
            if(end < 0){
                return -1;
            }
            int i = end + 1;
            while(i < content.length() && isBlank(content.charAt(i))){
                i++;
            }
            return isSeparatorAt(content, i) ? i : -1;
        }
        if("{[?#|>%@`".indexOf(first) >= 0){
            return -1;
        }
        for(int i=0; i<content.length(); i++){
            char c = content.charAt(i);
            if(c == '#' && i > 0 && isBlank(content.charAt(i - 1))){
                return -1;
            }
            if(isSeparatorAt(content, i)){
                return i;
            }
        }
        return -1;
    }

    private static boolean isSeparatorAt(String content, int i){
        return i < content.length() && content.charAt(i) == ':' && (i + 1 == content.length() || isBlank(content.charAt(i + 1)));
    }

    private static int closingQuote(String content, char quote){
        for(int i=1; i<content.length(); i++){
            char c = content.charAt(i);
            if(quote == '"' && c == '\\'){
                i++;
            }else if(c == quote){
                if(quote == '\'' && i + 1 < content.length() && content.charAt(i + 1) == '\''){
                    i++;
                }else{
                    return i;
                }
            }
        }
        return -1;
    }

    public static String key(String content, int separator){
        String key = content.substring(0, separator).trim();
        if(key.length() >= 2){
            char first = key.charAt(0);
            if((first == '"' || first == '\'') && key.charAt(key.length() - 1) == first){
                key = key.substring(1, key.length() - 1);
                if(first == '\''){
                    key = key.replace("''", "'");
                }
            }
        }
        return key;
    }

    /**
     * @return the value after the separator without a trailing comment, trimmed
     */
    public static String value(String content, int separator){
        return stripComment(content.substring(separator + 1)).trim();
    }

    static String stripComment(String text){
        for(int i=0; i<text.length(); i++){
            if(text.charAt(i) == '#' && (i == 0 || isBlank(text.charAt(i - 1)))){
                return text.substring(0, i);
            }
        }
        return text;
    }

    public static boolean opensBlockScalar(String value){
        return BLOCK_SCALAR.matcher(value).matches();
    }
}

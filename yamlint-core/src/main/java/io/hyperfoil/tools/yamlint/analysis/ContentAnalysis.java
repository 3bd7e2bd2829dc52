package io.hyperfoil.tools.yamlint.analysis;

import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Everything the rules need to know about one file, computed in a single pass and shared read-only by all rules.
 */
public class ContentAnalysis {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final Set<String> TRUTHY_WORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "yes", "no", "on", "off", "y", "n", "true", "false", "1", "0", "enable", "disable", "enabled", "disabled"
    )));

    public static ContentAnalysis analyze(String content){
        return analyze(content, true);
    }

    public static ContentAnalysis analyze(String content, boolean includeTokens){
        if(content == null){
            content = "";
        }
        List<LineInfo> lines = new ArrayList<>();
        ContextStack stack = new ContextStack();
        Map<Integer,List<String>> truthy = new LinkedHashMap<>();
        Map<Integer,String> empty = new LinkedHashMap<>();

        List<String> texts = splitLines(content);
        for(int i=0; i<texts.size(); i++){
            int lineNumber = i + 1;
            String text = texts.get(i);
            LineInfo info = LineInfo.of(lineNumber, text);
            lines.add(info);
            stack.accept(info);

            List<String> words = truthyWords(text);
            if(!words.isEmpty()){
                truthy.put(lineNumber, words);
            }
            if(!info.isEmpty() && !info.isComment()){
                String body = LineSyntax.stripListMarkers(text.substring(info.getIndentation()));
                int separator = LineSyntax.separator(body);
                if(separator >= 0 && body.substring(separator + 1).trim().isEmpty()){
                    empty.put(lineNumber, LineSyntax.key(body, separator));
                }
            }
        }
        stack.finish(lines.size());

        TokenAnalysis tokens = includeTokens ? TokenAnalysis.analyze(content) : null;
        logger.tracef("analyzed %d lines, %d contexts, %d duplicate keys", lines.size(), stack.getContexts().size(), stack.getDuplicates().size());
        return new ContentAnalysis(content, lines, stack, truthy, empty, tokens);
    }

    /**
     * Splits on '\n' and drops the '\r' of "\r\n". A trailing line break does not start another line.
     */
    public static List<String> splitLines(String content){
        List<String> rtrn = new ArrayList<>();
        int start = 0;
        for(int i=0; i<content.length(); i++){
            if(content.charAt(i) == '\n'){
                int end = i > start && content.charAt(i - 1) == '\r' ? i - 1 : i;
                rtrn.add(content.substring(start, end));
                start = i + 1;
            }
        }
        if(start < content.length()){
            rtrn.add(content.substring(start));
        }
        return rtrn;
    }

    static List<String> truthyWords(String line){
        List<String> rtrn = new ArrayList<>();
        for(String word : line.trim().split("\\s+")){
            int end = word.length();
            while(end > 0 && word.charAt(end - 1) == ','){
                end--;
            }
            String trimmed = word.substring(0, end);
            if(!trimmed.isEmpty() && TRUTHY_WORDS.contains(trimmed.toLowerCase(Locale.ROOT))){
                rtrn.add(trimmed);
            }
        }
        return rtrn;
    }

    private final String content;
    private final List<LineInfo> lines;
    private final List<MappingContext> contexts;
    private final List<DuplicateKey> duplicates;
    private final Map<Integer,List<String>> truthyValues;
    private final Map<Integer,String> emptyValues;
    private final TokenAnalysis tokens;

    private ContentAnalysis(String content, List<LineInfo> lines, ContextStack stack, Map<Integer,List<String>> truthyValues,
                            Map<Integer,String> emptyValues, TokenAnalysis tokens){
        this.content = content;
        this.lines = Collections.unmodifiableList(lines);
        this.contexts = stack.getContexts();
        this.duplicates = stack.getDuplicates();
        this.truthyValues = Collections.unmodifiableMap(truthyValues);
        this.emptyValues = Collections.unmodifiableMap(emptyValues);
        this.tokens = tokens;
    }

    public String getContent(){return content;}
    public List<LineInfo> getLines(){return lines;}
    public int getLineCount(){return lines.size();}

    /**
     * @param lineNumber 1-based line number
     */
    public LineInfo getLine(int lineNumber){
        return lineNumber >= 1 && lineNumber <= lines.size() ? lines.get(lineNumber - 1) : null;
    }

    public List<MappingContext> getContexts(){return contexts;}
    public List<DuplicateKey> getDuplicateKeys(){return duplicates;}

    /**
     * Words of the truthy vocabulary found on each line, keyed by line number.
     */
    public Map<Integer,List<String>> getTruthyValues(){return truthyValues;}

    /**
     * Keys with a blank value, keyed by line number.
     */
    public Map<Integer,String> getEmptyValues(){return emptyValues;}

    public boolean startsWithDocumentStart(){return content.startsWith("---");}
    public boolean endsWithDocumentEnd(){return content.endsWith("...");}
    public boolean endsWithNewline(){return content.endsWith("\n");}

    public boolean hasTokens(){return tokens != null;}

    /**
     * @return the token analysis, tokenizing the content now if the analysis was built without tokens
     */
    public TokenAnalysis getTokens(){
        return tokens != null ? tokens : TokenAnalysis.analyze(content);
    }
}

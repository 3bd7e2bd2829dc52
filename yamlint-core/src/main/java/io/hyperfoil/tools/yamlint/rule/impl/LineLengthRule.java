package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.analysis.YamlScanner;
import io.hyperfoil.tools.yamlint.rule.LineRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

/**
 * Lines longer than the maximum. Long words that cannot be broken, like URLs, can be allowed.
 */
public class LineLengthRule extends LineRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.integer("max", 80),
            RuleOption.bool("allow-non-breakable-words", true),
            RuleOption.bool("allow-non-breakable-inline-mappings", false)
    );

    private final int max;
    private final boolean allowWords;
    private final boolean allowInlineMappings;

    public LineLengthRule(RuleSettings settings){
        super(settings);
        max = options.getInt("max");
        allowInlineMappings = options.getBoolean("allow-non-breakable-inline-mappings");
        allowWords = options.getBoolean("allow-non-breakable-words") || allowInlineMappings;
    }

    @Override
    protected void line(ContentAnalysis analysis, LineInfo line, List<Issue> issues){
        if(line.getLength() <= max){
            return;
        }
        String text = line.getText();
        if(allowWords){
            int start = 0;
            while(start < text.length() && text.charAt(start) == ' '){
                start++;
            }
            if(start != text.length()){
                if(text.charAt(start) == '#'){
                    while(start < text.length() && text.charAt(start) == '#'){
                        start++;
                    }
                    start++;
                }else if(text.charAt(start) == '-'){
                    start += 2;
                }
                if(start >= text.length() || text.indexOf(' ', start) < 0){
                    return;
                }
                if(allowInlineMappings && isNonBreakableMapping(text)){
                    return;
                }
            }
        }
        issues.add(issue(line.getLineNumber(), max + 1, "line too long (" + line.getLength() + " > " + max + " characters)"));
    }

    /**
     * @return true when the line is a mapping whose value has no space, e.g. {@code url: http://example.com/very/long}
     */
    static boolean isNonBreakableMapping(String text){
        List<Token> tokens = YamlScanner.scan(text);
        int i = 0;
        while(i < tokens.size() && tokens.get(i).getTokenId() != Token.ID.BlockMappingStart){
            i++;
        }
        for(; i < tokens.size() - 1; i++){
            if(tokens.get(i).getTokenId() == Token.ID.Value){
                Token value = tokens.get(i + 1);
                if(value.getTokenId() != Token.ID.Scalar){
                    return false;
                }
                int column = value.getStartMark().getColumn();
                int offset = text.offsetByCodePoints(0, Math.min(column, text.codePointCount(0, text.length())));
                return text.indexOf(' ', offset) < 0;
            }
        }
        return false;
    }
}

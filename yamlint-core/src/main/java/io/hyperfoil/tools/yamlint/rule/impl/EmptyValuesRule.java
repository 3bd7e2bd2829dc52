package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.analysis.LineSyntax;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

/**
 * Keys and sequence entries without a value.
 */
public class EmptyValuesRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.bool("forbid-in-block-mappings", true),
            RuleOption.bool("forbid-in-flow-mappings", true),
            RuleOption.bool("forbid-in-block-sequences", true)
    );

    private final boolean blockMappings;
    private final boolean flowMappings;
    private final boolean blockSequences;

    public EmptyValuesRule(RuleSettings settings){
        super(settings);
        blockMappings = options.getBoolean("forbid-in-block-mappings");
        flowMappings = options.getBoolean("forbid-in-flow-mappings");
        blockSequences = options.getBoolean("forbid-in-block-sequences");
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        if(analysis.hasTokens()){
            super.scan(analysis, issues);
        }else if(blockMappings){
            // without tokens only the keys found by the line scan can be reported
            analysis.getEmptyValues().forEach((line, key) -> {
                LineInfo info = analysis.getLine(line);
                String body = info.getText().substring(info.getIndentation());
                body = LineSyntax.stripListMarkers(body);
                int separator = LineSyntax.separator(body);
                int column = info.getText().length() - body.length() + separator + 2;
                issues.add(issue(line, column, "empty value in block mapping"));
            });
        }
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        Token token = tokens.token(index);
        int line = tokens.lineOf(index);
        int column = token.getEndMark().getColumn() + 1;
        if(tokens.is(index, Token.ID.Value)){
            if(blockMappings && tokens.is(index + 1, Token.ID.Key, Token.ID.BlockEnd)){
                issues.add(issue(line, column, "empty value in block mapping"));
            }
            if(flowMappings && tokens.is(index + 1, Token.ID.FlowEntry, Token.ID.FlowMappingEnd)){
                issues.add(issue(line, column, "empty value in flow mapping"));
            }
        }
        if(blockSequences && tokens.is(index, Token.ID.BlockEntry) && tokens.is(index + 1, Token.ID.Key, Token.ID.BlockEnd, Token.ID.BlockEntry)){
            issues.add(issue(line, column, "empty value in block sequence"));
        }
    }
}

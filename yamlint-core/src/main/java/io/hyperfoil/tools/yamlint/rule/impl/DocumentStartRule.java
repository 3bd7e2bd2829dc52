package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TextEdits;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class DocumentStartRule extends TokenRule {

    public static final String MISSING = "missing document start \"---\"";

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.bool("present", true));

    private final boolean present;

    public DocumentStartRule(RuleSettings settings){
        super(settings);
        present = options.getBoolean("present");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(present){
            if(tokens.is(index - 1, Token.ID.StreamStart, Token.ID.DocumentEnd, Token.ID.Directive)
                    && !tokens.is(index, Token.ID.DocumentStart, Token.ID.Directive, Token.ID.StreamEnd)){
                issues.add(issue(tokens.lineOf(index), 1, MISSING));
            }
        }else if(tokens.is(index, Token.ID.DocumentStart)){
            issues.add(issue(tokens.lineOf(index), tokens.columnOf(index) + 1, "found forbidden document start \"---\""));
        }
    }

    @Override
    public FixResult fix(String content, String path){
        if(!present){
            return FixResult.unchanged(content);
        }
        List<Integer> lines = checkWithAnalysis(content, path, ContentAnalysis.analyze(content)).stream()
                .map(Issue::getLine)
                .distinct()
                .collect(Collectors.toList());
        if(lines.isEmpty()){
            return FixResult.unchanged(content);
        }
        return new FixResult(TextEdits.insertLines(content, lines, "---"), lines.size());
    }
}

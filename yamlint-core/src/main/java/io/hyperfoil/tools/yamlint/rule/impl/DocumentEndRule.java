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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DocumentEndRule extends TokenRule {

    public static final String MISSING = "missing document end \"...\"";

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.bool("present", true));

    private final boolean present;

    public DocumentEndRule(RuleSettings settings){
        super(settings);
        present = options.getBoolean("present");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(present){
            boolean endedBefore = tokens.is(index - 1, Token.ID.DocumentEnd, Token.ID.StreamStart);
            if(tokens.is(index, Token.ID.StreamEnd) && !endedBefore){
                // the stream end sits on the line after the last line break
                issues.add(issue(Math.max(1, tokens.token(index).getStartMark().getLine()), 1, MISSING));
            }else if(tokens.is(index, Token.ID.DocumentStart) && !endedBefore && !tokens.is(index - 1, Token.ID.Directive)){
                issues.add(issue(tokens.lineOf(index), 1, MISSING));
            }
        }else if(tokens.is(index, Token.ID.DocumentEnd)){
            issues.add(issue(tokens.lineOf(index), tokens.columnOf(index) + 1, "found forbidden document end \"...\""));
        }
    }

    @Override
    public FixResult fix(String content, String path){
        if(!present || isIgnored(path)){
            return FixResult.unchanged(content);
        }
        TokenAnalysis tokens = ContentAnalysis.analyze(content).getTokens();
        List<Integer> before = new ArrayList<>();
        boolean atEnd = false;
        for(int i=1; i<tokens.size(); i++){
            if(tokens.is(i - 1, Token.ID.DocumentEnd, Token.ID.StreamStart)){
                continue;
            }
            if(tokens.is(i, Token.ID.StreamEnd)){
                atEnd = true;
            }else if(tokens.is(i, Token.ID.DocumentStart) && !tokens.is(i - 1, Token.ID.Directive)){
                before.add(tokens.lineOf(i));
            }
        }
        if(before.isEmpty() && !atEnd){
            return FixResult.unchanged(content);
        }
        String fixed = TextEdits.insertLines(content, before, "...");
        if(atEnd){
            String lineBreak = TextEdits.lineBreak(fixed);
            fixed = (fixed.endsWith("\n") ? fixed : fixed + lineBreak) + "..." + lineBreak;
        }
        return new FixResult(fixed, before.size() + (atEnd ? 1 : 0));
    }
}

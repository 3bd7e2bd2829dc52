package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.rule.AbstractRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TextEdits;

import java.util.Collections;
import java.util.List;

public class NewLineAtEndOfFileRule extends AbstractRule {

    public static final List<RuleOption> OPTIONS = Collections.emptyList();

    public NewLineAtEndOfFileRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        if(analysis.getContent().isEmpty() || analysis.endsWithNewline()){
            return;
        }
        LineInfo last = analysis.getLine(analysis.getLineCount());
        issues.add(issue(last.getLineNumber(), last.getLength() + 1, "no new line character at the end of file"));
    }

    @Override
    public FixResult fix(String content, String path){
        if(content.isEmpty() || content.endsWith("\n") || isIgnored(path)){
            return FixResult.unchanged(content);
        }
        return new FixResult(content + TextEdits.lineBreak(content), 1);
    }
}

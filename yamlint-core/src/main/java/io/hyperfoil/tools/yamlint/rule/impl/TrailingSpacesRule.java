package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.rule.LineRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Collections;
import java.util.List;

public class TrailingSpacesRule extends LineRule {

    public static final List<RuleOption> OPTIONS = Collections.emptyList();

    public TrailingSpacesRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void line(ContentAnalysis analysis, LineInfo line, List<Issue> issues){
        if(line.hasTrailingWhitespace()){
            issues.add(issue(line.getLineNumber(), line.getLength() - line.getTrailingWhitespaceCount() + 1, "trailing spaces"));
        }
    }

    @Override
    public FixResult fix(String content, String path){
        if(isIgnored(path)){
            return FixResult.unchanged(content);
        }
        StringBuilder fixed = new StringBuilder(content.length());
        int fixes = 0;
        int start = 0;
        while(start <= content.length()){
            int newline = content.indexOf('\n', start);
            int end = newline < 0 ? content.length() : newline;
            int lineEnd = end > start && content.charAt(end - 1) == '\r' ? end - 1 : end;
            int trimmed = lineEnd;
            while(trimmed > start && (content.charAt(trimmed - 1) == ' ' || content.charAt(trimmed - 1) == '\t')){
                trimmed--;
            }
            if(trimmed != lineEnd){
                fixes++;
            }
            fixed.append(content, start, trimmed).append(content, lineEnd, end);
            if(newline < 0){
                break;
            }
            fixed.append('\n');
            start = newline + 1;
        }
        return fixes == 0 ? FixResult.unchanged(content) : new FixResult(fixed.toString(), fixes);
    }
}

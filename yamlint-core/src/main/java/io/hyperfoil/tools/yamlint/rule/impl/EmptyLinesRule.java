package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.rule.AbstractRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Arrays;
import java.util.List;

/**
 * Limits runs of blank lines, with separate limits at the start and the end of the file.
 */
public class EmptyLinesRule extends AbstractRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.integer("max", 2),
            RuleOption.integer("max-start", 0),
            RuleOption.integer("max-end", 0)
    );

    private final int max;
    private final int maxStart;
    private final int maxEnd;

    public EmptyLinesRule(RuleSettings settings){
        super(settings);
        max = options.getInt("max");
        maxStart = options.getInt("max-start");
        maxEnd = options.getInt("max-end");
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        String content = analysis.getContent();
        // a file made of a single line break is fine
        if(content.equals("\n") || content.equals("\r\n")){
            return;
        }
        List<LineInfo> lines = analysis.getLines();
        int i = 0;
        while(i < lines.size()){
            if(!lines.get(i).getText().isEmpty()){
                i++;
                continue;
            }
            int start = i;
            while(i < lines.size() && lines.get(i).getText().isEmpty()){
                i++;
            }
            int end = i - 1;
            int blank = end - start + 1;
            int limit = max;
            if(end == lines.size() - 1 && analysis.endsWithNewline()){
                limit = maxEnd;
            }else if(start == 0){
                limit = maxStart;
            }
            if(blank > limit){
                issues.add(issue(end + 1, 1, "too many blank lines (" + blank + " > " + limit + ")"));
            }
        }
    }
}

package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;

import java.util.List;

/**
 * A rule that looks at each line on its own.
 */
public abstract class LineRule extends AbstractRule {

    protected LineRule(RuleSettings settings){
        super(settings);
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        for(LineInfo line : analysis.getLines()){
            line(analysis, line, issues);
        }
    }

    protected abstract void line(ContentAnalysis analysis, LineInfo line, List<Issue> issues);
}

package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.Severity;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.config.PathPatterns;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of the built in rules: skips ignored paths and tags issues with the rule id and configured severity.
 */
public abstract class AbstractRule implements Rule {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    protected final RuleSettings settings;
    protected final RuleOptions options;
    private final PathPatterns ignore;

    protected AbstractRule(RuleSettings settings){
        this.settings = settings;
        this.options = settings.getOptions();
        this.ignore = PathPatterns.substrings(settings.getIgnore());
    }

    @Override
    public RuleId getId(){return settings.getId();}
    public Severity getSeverity(){return settings.getSeverity();}

    public boolean isIgnored(String path){
        return ignore.matches(path);
    }

    @Override
    public List<Issue> check(String content, String path){
        return checkWithAnalysis(content, path, ContentAnalysis.analyze(content));
    }

    @Override
    public List<Issue> checkWithAnalysis(String content, String path, ContentAnalysis analysis){
        if(isIgnored(path)){
            logger.debugf("%s ignores %s", getId(), path);
            return Collections.emptyList();
        }
        List<Issue> issues = new ArrayList<>();
        scan(analysis, issues);
        return issues;
    }

    @Override
    public boolean canFix(){
        return getId().canFix();
    }

    protected abstract void scan(ContentAnalysis analysis, List<Issue> issues);

    protected Issue issue(int line, int column, String message){
        return new Issue(line, column, message, settings.getSeverity(), getId().getId());
    }

    @Override
    public String toString(){
        return settings.toString();
    }
}

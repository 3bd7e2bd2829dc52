package io.hyperfoil.tools.yamlint;

import java.util.Collections;
import java.util.List;

/**
 * The issues of one file and, in fix mode, the fixed content.
 */
public class LintResult {

    private final String path;
    private final List<Issue> issues;
    private final FixResult fix;

    public LintResult(String path, List<Issue> issues, FixResult fix){
        this.path = path;
        this.issues = Collections.unmodifiableList(issues);
        this.fix = fix;
    }

    public String getPath(){return path;}
    public List<Issue> getIssues(){return issues;}
    public FixResult getFix(){return fix;}

    public boolean hasIssues(){return !issues.isEmpty();}
    public long getErrorCount(){
        return issues.stream().filter(Issue::isError).count();
    }
    public long getWarningCount(){
        return issues.stream().filter(issue -> Severity.WARNING.equals(issue.getSeverity())).count();
    }

    @Override
    public String toString(){
        return path + " issues=" + issues.size() + " " + fix;
    }
}

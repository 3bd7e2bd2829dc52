package io.hyperfoil.tools.yamlint.format;

import io.hyperfoil.tools.yamlint.Issue;

/**
 * One issue per line for editors and CI tools: {@code file:line:column: [level] message (rule)}
 */
public class ParsableFormatter implements Formatter {

    @Override
    public String formatIssue(String path, Issue issue){
        return path + ":" + issue.getLine() + ":" + issue.getColumn() + ": [" + issue.getSeverity().getLabel() + "] "
                + issue.getMessage() + (issue.getRuleId() == null ? "" : " (" + issue.getRuleId() + ")");
    }

    @Override
    public String formatFile(String path){
        return null;
    }
}

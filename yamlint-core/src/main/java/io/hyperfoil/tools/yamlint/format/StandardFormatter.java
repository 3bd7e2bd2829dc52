package io.hyperfoil.tools.yamlint.format;

import io.hyperfoil.tools.yamlint.Issue;

/**
 * <pre>
 * config.yaml
 *   3:7       error    duplication of key "a" in mapping  (key-duplicates)
 * </pre>
 */
public class StandardFormatter implements Formatter {

    @Override
    public String formatIssue(String path, Issue issue){
        StringBuilder line = new StringBuilder("  " + issue.getLine() + ":" + issue.getColumn());
        pad(line, 12);
        line.append(issue.getSeverity().getLabel());
        pad(line, 21);
        line.append(issue.getMessage());
        if(issue.getRuleId() != null){
            line.append("  (").append(issue.getRuleId()).append(")");
        }
        return line.toString();
    }

    static void pad(StringBuilder line, int width){
        while(line.length() < width){
            line.append(' ');
        }
    }

    @Override
    public String formatFile(String path){
        return path;
    }
}

package io.hyperfoil.tools.yamlint.format;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.Severity;

/**
 * The standard layout with ANSI colors. Padding counts the escape sequences so columns line up on a terminal.
 */
public class ColoredFormatter implements Formatter {

    static final String RESET = "\u001b[0m";
    static final String DIM = "\u001b[2m";
    static final String UNDERLINE = "\u001b[4m";
    static final String RED = "\u001b[31m";
    static final String YELLOW = "\u001b[33m";

    @Override
    public String formatIssue(String path, Issue issue){
        StringBuilder line = new StringBuilder("  " + DIM + issue.getLine() + ":" + issue.getColumn() + RESET);
        StandardFormatter.pad(line, 20);
        String color = Severity.WARNING.equals(issue.getSeverity()) ? YELLOW : RED;
        line.append(color).append(issue.getSeverity().getLabel()).append(RESET);
        StandardFormatter.pad(line, 38);
        line.append(issue.getMessage());
        if(issue.getRuleId() != null){
            line.append("  ").append(DIM).append("(").append(issue.getRuleId()).append(")").append(RESET);
        }
        return line.toString();
    }

    @Override
    public String formatFile(String path){
        return UNDERLINE + path + RESET;
    }
}

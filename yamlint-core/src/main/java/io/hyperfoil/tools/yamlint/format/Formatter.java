package io.hyperfoil.tools.yamlint.format;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.LintResult;

/**
 * Turns the issues of a file into the text written to the console.
 */
public interface Formatter {

    /**
     * @param terminal whether the output is a terminal, used by {@link OutputFormat#Auto}
     */
    static Formatter create(OutputFormat format, boolean terminal){
        switch (format){
            case Colored:
                return new ColoredFormatter();
            case Parsable:
                return new ParsableFormatter();
            case Auto:
                return terminal ? new ColoredFormatter() : new StandardFormatter();
            default:
                return new StandardFormatter();
        }
    }

    String formatIssue(String path, Issue issue);

    /**
     * @return the line printed before the issues of a file, null when issues are not grouped by file
     */
    String formatFile(String path);

    /**
     * @return the text for all issues of the result, empty when it has none
     */
    default String format(LintResult result){
        if(!result.hasIssues()){
            return "";
        }
        StringBuilder builder = new StringBuilder();
        String header = formatFile(result.getPath());
        if(header != null){
            builder.append(header).append(System.lineSeparator());
        }
        for(Issue issue : result.getIssues()){
            builder.append(formatIssue(result.getPath(), issue)).append(System.lineSeparator());
        }
        if(header != null){
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }
}

package io.hyperfoil.tools.yamlint;

import java.util.Comparator;
import java.util.Objects;

/**
 * A problem reported by a rule. Line and column start at 1.
 */
public class Issue implements Comparable<Issue> {

    public static final Comparator<Issue> BY_POSITION = Comparator.comparingInt(Issue::getLine).thenComparingInt(Issue::getColumn);

    private final int line;
    private final int column;
    private final String message;
    private final Severity severity;
    private final String ruleId;

    public Issue(int line, int column, String message, Severity severity, String ruleId){
        this.line = line;
        this.column = column;
        this.message = message;
        this.severity = severity;
        this.ruleId = ruleId;
    }

    public int getLine(){return line;}
    public int getColumn(){return column;}
    public String getMessage(){return message;}
    public Severity getSeverity(){return severity;}
    public String getRuleId(){return ruleId;}
    public boolean isError(){return Severity.ERROR.equals(severity);}

    @Override
    public int compareTo(Issue o){
        return BY_POSITION.compare(this, o);
    }

    @Override
    public boolean equals(Object o){
        if(this == o) return true;
        if(!(o instanceof Issue)) return false;
        Issue issue = (Issue) o;
        return line == issue.line && column == issue.column && message.equals(issue.message)
                && severity == issue.severity && Objects.equals(ruleId, issue.ruleId);
    }

    @Override
    public int hashCode(){
        return Objects.hash(line, column, message, severity, ruleId);
    }

    @Override
    public String toString(){
        return line + ":" + column + " " + severity + " " + message + " (" + ruleId + ")";
    }
}

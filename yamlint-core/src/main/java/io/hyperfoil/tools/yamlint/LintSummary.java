package io.hyperfoil.tools.yamlint;

import java.util.Collections;
import java.util.List;

/**
 * Results of a run over many files, in the order the files were given.
 */
public class LintSummary {

    private final List<LintResult> results;
    private final List<FileError> errors;

    public LintSummary(List<LintResult> results, List<FileError> errors){
        this.results = Collections.unmodifiableList(results);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<LintResult> getResults(){return results;}
    public List<FileError> getErrors(){return errors;}
    public boolean hasFileErrors(){return !errors.isEmpty();}

    public long getErrorCount(){
        return results.stream().mapToLong(LintResult::getErrorCount).sum();
    }
    public long getWarningCount(){
        return results.stream().mapToLong(LintResult::getWarningCount).sum();
    }
    public int getFixesApplied(){
        return results.stream().mapToInt(result -> result.getFix().getFixesApplied()).sum();
    }

    /**
     * @param strict when true warnings alone fail the run
     * @return 0 when clean, 1 for errors or unreadable files, 2 for warnings in strict mode
     */
    public int getExitCode(boolean strict){
        if(hasFileErrors() || getErrorCount() > 0){
            return 1;
        }
        if(strict && getWarningCount() > 0){
            return 2;
        }
        return 0;
    }

    @Override
    public String toString(){
        return "files=" + results.size() + " errors=" + getErrorCount() + " warnings=" + getWarningCount() + " fileErrors=" + errors.size();
    }
}

package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;

import java.util.List;

public interface Rule {

    RuleId getId();

    List<Issue> check(String content, String path);

    /**
     * Checks the content with an analysis shared by all rules. The analysis must not be modified.
     */
    default List<Issue> checkWithAnalysis(String content, String path, ContentAnalysis analysis){
        return check(content, path);
    }

    default boolean canFix(){
        return false;
    }

    default FixResult fix(String content, String path){
        return FixResult.unchanged(content);
    }
}

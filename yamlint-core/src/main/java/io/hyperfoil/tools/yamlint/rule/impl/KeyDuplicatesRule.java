package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.DuplicateKey;
import io.hyperfoil.tools.yamlint.rule.AbstractRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Collections;
import java.util.List;

/**
 * Reports keys that appear twice in the same mapping. Repeated {@code <<} merge keys are allowed unless configured.
 */
public class KeyDuplicatesRule extends AbstractRule {

    public static final String MERGE_KEY = "<<";

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.bool("forbid-duplicated-merge-keys", false));

    private final boolean forbidMergeKeys;

    public KeyDuplicatesRule(RuleSettings settings){
        super(settings);
        forbidMergeKeys = options.getBoolean("forbid-duplicated-merge-keys");
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        for(DuplicateKey duplicate : analysis.getDuplicateKeys()){
            if(MERGE_KEY.equals(duplicate.getKey()) && !forbidMergeKeys){
                continue;
            }
            issues.add(issue(duplicate.getLine(), duplicate.getColumn() + 1, "duplication of key \"" + duplicate.getKey() + "\" in mapping"));
        }
    }
}

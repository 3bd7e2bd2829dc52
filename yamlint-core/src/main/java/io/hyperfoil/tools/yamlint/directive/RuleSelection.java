package io.hyperfoil.tools.yamlint.directive;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The rules a directive applies to: either every rule or a set of rule ids.
 */
public class RuleSelection {

    public static final RuleSelection ALL = new RuleSelection(true, Collections.emptySet());

    public static RuleSelection of(Set<String> ruleIds){
        return new RuleSelection(false, new LinkedHashSet<>(ruleIds));
    }

    private final boolean all;
    private final Set<String> ruleIds;

    private RuleSelection(boolean all, Set<String> ruleIds){
        this.all = all;
        this.ruleIds = Collections.unmodifiableSet(ruleIds);
    }

    public boolean isAll(){return all;}
    public Set<String> getRuleIds(){return ruleIds;}
    public boolean isEmpty(){return !all && ruleIds.isEmpty();}

    public boolean applies(String ruleId){
        return all || ruleIds.contains(ruleId);
    }

    public RuleSelection merge(RuleSelection other){
        if(all || other.all){
            return ALL;
        }
        Set<String> merged = new LinkedHashSet<>(ruleIds);
        merged.addAll(other.ruleIds);
        return new RuleSelection(false, merged);
    }

    @Override
    public String toString(){
        return all ? "*" : ruleIds.toString();
    }
}

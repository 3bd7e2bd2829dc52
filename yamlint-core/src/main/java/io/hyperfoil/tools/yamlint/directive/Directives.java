package io.hyperfoil.tools.yamlint.directive;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * The suppression comments of one file.
 * <p>
 * Ranged records start at a line and last until a later record changes them. Line records only cover their own line
 * and take precedence over ranged records.
 */
public class Directives {

    public static final Directives NONE = new Directives();

    private final TreeMap<Integer,RuleSelection> disables = new TreeMap<>();
    private final TreeMap<Integer,RuleSelection> enables = new TreeMap<>();
    private final Map<Integer,RuleSelection> lines = new HashMap<>();

    void disableFrom(int line, RuleSelection rules){
        disables.merge(line, rules, RuleSelection::merge);
    }
    void enableFrom(int line, RuleSelection rules){
        enables.merge(line, rules, RuleSelection::merge);
    }
    void disableLine(int line, RuleSelection rules){
        lines.merge(line, rules, RuleSelection::merge);
    }

    public boolean isEmpty(){
        return disables.isEmpty() && enables.isEmpty() && lines.isEmpty();
    }

    public Map<Integer,RuleSelection> getDisables(){return Collections.unmodifiableMap(disables);}
    public Map<Integer,RuleSelection> getEnables(){return Collections.unmodifiableMap(enables);}
    public Map<Integer,RuleSelection> getLineDisables(){return Collections.unmodifiableMap(lines);}

    public boolean isSuppressed(int line, String ruleId){
        RuleSelection scoped = lines.get(line);
        if(scoped != null && scoped.applies(ruleId)){
            return true;
        }
        int disabled = latest(disables, line, ruleId);
        if(disabled < 0){
            return false;
        }
        int enabled = latest(enables, line, ruleId);
        return enabled < disabled;
    }

    /**
     * @return the greatest line not after {@code line} with a record for the rule, -1 if there is none
     */
    private static int latest(TreeMap<Integer,RuleSelection> records, int line, String ruleId){
        NavigableMap<Integer,RuleSelection> before = records.headMap(line, true);
        for(Map.Entry<Integer,RuleSelection> entry : before.descendingMap().entrySet()){
            if(entry.getValue().applies(ruleId)){
                return entry.getKey();
            }
        }
        return -1;
    }

    @Override
    public String toString(){
        return "disable=" + disables + " enable=" + enables + " line=" + lines;
    }
}

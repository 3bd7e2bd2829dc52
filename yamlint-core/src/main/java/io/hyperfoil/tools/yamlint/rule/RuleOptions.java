package io.hyperfoil.tools.yamlint.rule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Option values of one configured rule, defaults included.
 */
public class RuleOptions {

    public static final RuleOptions EMPTY = new RuleOptions(Collections.emptyMap());

    public static RuleOptions defaults(List<RuleOption> options){
        Map<String,Object> values = new LinkedHashMap<>();
        options.forEach(option -> values.put(option.getName(), option.getDefaultValue()));
        return new RuleOptions(values);
    }

    private final Map<String,Object> values;

    private RuleOptions(Map<String,Object> values){
        this.values = Collections.unmodifiableMap(values);
    }

    public RuleOptions with(String name, Object value){
        Map<String,Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new RuleOptions(copy);
    }

    public boolean has(String name){return values.containsKey(name);}
    public Object get(String name){return values.get(name);}
    public Map<String,Object> asMap(){return values;}

    public int getInt(String name){
        Object value = values.get(name);
        return value instanceof Number ? ((Number) value).intValue() : -1;
    }

    public boolean getBoolean(String name){
        return Boolean.TRUE.equals(values.get(name));
    }

    public String getString(String name){
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(String name){
        Object value = values.get(name);
        return value instanceof List ? (List<String>) value : Collections.emptyList();
    }

    @Override
    public String toString(){
        return values.toString();
    }
}

package io.hyperfoil.tools.yamlint.rule;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A configurable option of a rule with its default value and the values it accepts.
 */
public class RuleOption {

    enum Kind {Integer, Boolean, Choice, IntegerOrChoice, StringList}

    public static RuleOption integer(String name, int defaultValue){
        return new RuleOption(name, Kind.Integer, defaultValue, Collections.emptyList());
    }
    public static RuleOption bool(String name, boolean defaultValue){
        return new RuleOption(name, Kind.Boolean, defaultValue, Collections.emptyList());
    }
    public static RuleOption choice(String name, Object defaultValue, Object... choices){
        return new RuleOption(name, Kind.Choice, defaultValue, Arrays.asList(choices));
    }
    public static RuleOption integerOr(String name, Object defaultValue, Object... choices){
        return new RuleOption(name, Kind.IntegerOrChoice, defaultValue, Arrays.asList(choices));
    }
    public static RuleOption stringList(String name, String... defaultValue){
        return new RuleOption(name, Kind.StringList, Collections.unmodifiableList(Arrays.asList(defaultValue)), Collections.emptyList());
    }

    private final String name;
    private final Kind kind;
    private final Object defaultValue;
    private final List<Object> choices;

    private RuleOption(String name, Kind kind, Object defaultValue, List<Object> choices){
        this.name = name;
        this.kind = kind;
        this.defaultValue = defaultValue;
        this.choices = choices;
    }

    public String getName(){return name;}
    public Object getDefaultValue(){return defaultValue;}

    /**
     * @return the value to store for the option, or null when the value is not accepted
     */
    public Object accept(Object value){
        switch (kind){
            case Integer:
                return toInteger(value);
            case Boolean:
                return value instanceof Boolean ? value : null;
            case Choice:
                return choices.contains(value) ? value : null;
            case IntegerOrChoice:
                Integer number = toInteger(value);
                return number != null ? number : (choices.contains(value) ? value : null);
            case StringList:
                if(value instanceof String){
                    return Collections.singletonList((String) value);
                }
                if(value instanceof List){
                    List<String> strings = new ArrayList<>();
                    for(Object entry : (List<?>) value){
                        if(entry == null || entry instanceof List || entry instanceof java.util.Map){
                            return null;
                        }
                        strings.add(entry.toString());
                    }
                    return Collections.unmodifiableList(strings);
                }
                return null;
            default:
                return null;
        }
    }

    private static Integer toInteger(Object value){
        if(value instanceof Integer){
            return (Integer) value;
        }
        if(value instanceof Long && (Long) value <= java.lang.Integer.MAX_VALUE && (Long) value >= java.lang.Integer.MIN_VALUE){
            return ((Long) value).intValue();
        }
        return null;
    }

    public String describe(){
        switch (kind){
            case Integer:
                return "an integer";
            case Boolean:
                return "true or false";
            case Choice:
                return "one of " + choices;
            case IntegerOrChoice:
                return "an integer or one of " + choices;
            default:
                return "a list of strings";
        }
    }

    @Override
    public String toString(){
        return name + "=" + defaultValue;
    }
}

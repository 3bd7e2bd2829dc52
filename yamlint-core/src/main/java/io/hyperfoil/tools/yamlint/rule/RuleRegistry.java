package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.rule.impl.AnchorsRule;
import io.hyperfoil.tools.yamlint.rule.impl.BracesRule;
import io.hyperfoil.tools.yamlint.rule.impl.BracketsRule;
import io.hyperfoil.tools.yamlint.rule.impl.ColonsRule;
import io.hyperfoil.tools.yamlint.rule.impl.CommasRule;
import io.hyperfoil.tools.yamlint.rule.impl.CommentsIndentationRule;
import io.hyperfoil.tools.yamlint.rule.impl.CommentsRule;
import io.hyperfoil.tools.yamlint.rule.impl.DocumentEndRule;
import io.hyperfoil.tools.yamlint.rule.impl.DocumentStartRule;
import io.hyperfoil.tools.yamlint.rule.impl.EmptyLinesRule;
import io.hyperfoil.tools.yamlint.rule.impl.EmptyValuesRule;
import io.hyperfoil.tools.yamlint.rule.impl.FloatValuesRule;
import io.hyperfoil.tools.yamlint.rule.impl.HyphensRule;
import io.hyperfoil.tools.yamlint.rule.impl.IndentationRule;
import io.hyperfoil.tools.yamlint.rule.impl.KeyDuplicatesRule;
import io.hyperfoil.tools.yamlint.rule.impl.KeyOrderingRule;
import io.hyperfoil.tools.yamlint.rule.impl.LineLengthRule;
import io.hyperfoil.tools.yamlint.rule.impl.NewLineAtEndOfFileRule;
import io.hyperfoil.tools.yamlint.rule.impl.NewLinesRule;
import io.hyperfoil.tools.yamlint.rule.impl.OctalValuesRule;
import io.hyperfoil.tools.yamlint.rule.impl.QuotedStringsRule;
import io.hyperfoil.tools.yamlint.rule.impl.TrailingSpacesRule;
import io.hyperfoil.tools.yamlint.rule.impl.TruthyRule;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps each {@link RuleId} to its options and a factory for the rule.
 */
public final class RuleRegistry {

    private static class Entry {
        final List<RuleOption> options;
        final Function<RuleSettings,Rule> factory;

        Entry(List<RuleOption> options, Function<RuleSettings,Rule> factory){
            this.options = options;
            this.factory = factory;
        }
    }

    private static final Map<RuleId,Entry> ENTRIES = new EnumMap<>(RuleId.class);
    static {
        register(RuleId.ANCHORS, AnchorsRule.OPTIONS, AnchorsRule::new);
        register(RuleId.BRACES, BracesRule.OPTIONS, BracesRule::new);
        register(RuleId.BRACKETS, BracketsRule.OPTIONS, BracketsRule::new);
        register(RuleId.COLONS, ColonsRule.OPTIONS, ColonsRule::new);
        register(RuleId.COMMAS, CommasRule.OPTIONS, CommasRule::new);
        register(RuleId.COMMENTS, CommentsRule.OPTIONS, CommentsRule::new);
        register(RuleId.COMMENTS_INDENTATION, CommentsIndentationRule.OPTIONS, CommentsIndentationRule::new);
        register(RuleId.DOCUMENT_END, DocumentEndRule.OPTIONS, DocumentEndRule::new);
        register(RuleId.DOCUMENT_START, DocumentStartRule.OPTIONS, DocumentStartRule::new);
        register(RuleId.EMPTY_LINES, EmptyLinesRule.OPTIONS, EmptyLinesRule::new);
        register(RuleId.EMPTY_VALUES, EmptyValuesRule.OPTIONS, EmptyValuesRule::new);
        register(RuleId.FLOAT_VALUES, FloatValuesRule.OPTIONS, FloatValuesRule::new);
        register(RuleId.HYPHENS, HyphensRule.OPTIONS, HyphensRule::new);
        register(RuleId.INDENTATION, IndentationRule.OPTIONS, IndentationRule::new);
        register(RuleId.KEY_DUPLICATES, KeyDuplicatesRule.OPTIONS, KeyDuplicatesRule::new);
        register(RuleId.KEY_ORDERING, KeyOrderingRule.OPTIONS, KeyOrderingRule::new);
        register(RuleId.LINE_LENGTH, LineLengthRule.OPTIONS, LineLengthRule::new);
        register(RuleId.NEW_LINE_AT_END_OF_FILE, NewLineAtEndOfFileRule.OPTIONS, NewLineAtEndOfFileRule::new);
        register(RuleId.NEW_LINES, NewLinesRule.OPTIONS, NewLinesRule::new);
        register(RuleId.OCTAL_VALUES, OctalValuesRule.OPTIONS, OctalValuesRule::new);
        register(RuleId.QUOTED_STRINGS, QuotedStringsRule.OPTIONS, QuotedStringsRule::new);
        register(RuleId.TRAILING_SPACES, TrailingSpacesRule.OPTIONS, TrailingSpacesRule::new);
        register(RuleId.TRUTHY, TruthyRule.OPTIONS, TruthyRule::new);
    }

    private static void register(RuleId id, List<RuleOption> options, Function<RuleSettings,Rule> factory){
        ENTRIES.put(id, new Entry(options, factory));
    }

    private RuleRegistry(){}

    public static List<RuleOption> options(RuleId id){
        return ENTRIES.get(id).options;
    }

    /**
     * @return the option of the rule with that name or null if the rule has no such option
     */
    public static RuleOption option(RuleId id, String name){
        for(RuleOption option : options(id)){
            if(option.getName().equals(name)){
                return option;
            }
        }
        return null;
    }

    /**
     * Creates a new instance of the rule. Rules keep per file state so instances should not be shared between threads.
     * @throws IllegalArgumentException when the options are inconsistent
     */
    public static Rule create(RuleSettings settings){
        return ENTRIES.get(settings.getId()).factory.apply(settings);
    }
}

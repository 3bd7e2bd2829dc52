package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

/**
 * Spaces inside flow mappings, or flow mappings at all.
 */
public class BracesRule extends FlowCollectionRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.choice("forbid", false, false, true, "non-empty"),
            RuleOption.integer("min-spaces-inside", 0),
            RuleOption.integer("max-spaces-inside", 0),
            RuleOption.integer("min-spaces-inside-empty", -1),
            RuleOption.integer("max-spaces-inside-empty", -1)
    );

    public BracesRule(RuleSettings settings){
        super(settings, Token.ID.FlowMappingStart, Token.ID.FlowMappingEnd, "flow mapping", "braces");
    }
}

package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;

/**
 * Spaces inside flow sequences, or flow sequences at all.
 */
public class BracketsRule extends FlowCollectionRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.choice("forbid", false, false, true, "non-empty"),
            RuleOption.integer("min-spaces-inside", 0),
            RuleOption.integer("max-spaces-inside", 0),
            RuleOption.integer("min-spaces-inside-empty", -1),
            RuleOption.integer("max-spaces-inside-empty", -1)
    );

    public BracketsRule(RuleSettings settings){
        super(settings, Token.ID.FlowSequenceStart, Token.ID.FlowSequenceEnd, "flow sequence", "brackets");
    }
}

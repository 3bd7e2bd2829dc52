package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.AliasToken;
import org.yaml.snakeyaml.tokens.AnchorToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aliases must refer to an anchor declared earlier in the same document, optionally anchors must be unique and used.
 */
public class AnchorsRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.bool("forbid-undeclared-aliases", true),
            RuleOption.bool("forbid-duplicated-anchors", false),
            RuleOption.bool("forbid-unused-anchors", false)
    );

    private static class Anchor {
        final int line;
        final int column;
        boolean used = false;

        Anchor(int line, int column){
            this.line = line;
            this.column = column;
        }
    }

    private final boolean forbidUndeclared;
    private final boolean forbidDuplicated;
    private final boolean forbidUnused;
    private Map<String,Anchor> anchors = new LinkedHashMap<>();

    public AnchorsRule(RuleSettings settings){
        super(settings);
        forbidUndeclared = options.getBoolean("forbid-undeclared-aliases");
        forbidDuplicated = options.getBoolean("forbid-duplicated-anchors");
        forbidUnused = options.getBoolean("forbid-unused-anchors");
    }

    @Override
    protected void start(TokenAnalysis tokens){
        anchors = new LinkedHashMap<>();
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(!forbidUndeclared && !forbidDuplicated && !forbidUnused){
            return;
        }
        Token token = tokens.token(index);
        if(tokens.is(index, Token.ID.StreamStart, Token.ID.DocumentStart, Token.ID.DocumentEnd)){
            anchors = new LinkedHashMap<>();
        }
        int line = tokens.lineOf(index);
        int column = tokens.columnOf(index) + 1;
        if(token instanceof AliasToken){
            String name = ((AliasToken) token).getValue();
            Anchor anchor = anchors.get(name);
            if(anchor == null){
                if(forbidUndeclared){
                    issues.add(issue(line, column, "found undeclared alias \"" + name + "\""));
                }
            }else{
                anchor.used = true;
            }
        }
        if(token instanceof AnchorToken){
            String name = ((AnchorToken) token).getValue();
            if(forbidDuplicated && anchors.containsKey(name)){
                issues.add(issue(line, column, "found duplicated anchor \"" + name + "\""));
            }
            anchors.put(name, new Anchor(line, column));
        }
        if(forbidUnused && tokens.is(index + 1, Token.ID.StreamEnd, Token.ID.DocumentStart, Token.ID.DocumentEnd)){
            anchors.forEach((name, anchor) -> {
                if(!anchor.used){
                    issues.add(issue(anchor.line, anchor.column, "found unused anchor \"" + name + "\""));
                }
            });
        }
    }
}

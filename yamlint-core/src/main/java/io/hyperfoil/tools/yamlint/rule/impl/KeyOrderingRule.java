package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Keys of a mapping must be in alphabetical order.
 */
public class KeyOrderingRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.stringList("ignored-keys"));

    private static class Level {
        final boolean mapping;
        final List<String> keys = new ArrayList<>();

        Level(boolean mapping){
            this.mapping = mapping;
        }
    }

    private final List<Pattern> ignored;
    private Deque<Level> stack = new ArrayDeque<>();

    public KeyOrderingRule(RuleSettings settings){
        super(settings);
        ignored = options.getStringList("ignored-keys").stream().map(Pattern::compile).collect(Collectors.toList());
    }

    @Override
    protected void start(TokenAnalysis tokens){
        stack = new ArrayDeque<>();
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(tokens.is(index, Token.ID.BlockMappingStart, Token.ID.FlowMappingStart)){
            stack.push(new Level(true));
        }else if(tokens.is(index, Token.ID.BlockSequenceStart, Token.ID.FlowSequenceStart)){
            stack.push(new Level(false));
        }else if(tokens.is(index, Token.ID.BlockEnd, Token.ID.FlowMappingEnd, Token.ID.FlowSequenceEnd)){
            stack.poll();
        }else if(tokens.is(index, Token.ID.Key) && tokens.is(index + 1, Token.ID.Scalar)){
            // keys can also appear in flow sequences
            Level level = stack.peek();
            if(level == null || !level.mapping){
                return;
            }
            String key = ((ScalarToken) tokens.token(index + 1)).getValue();
            if(ignored.stream().anyMatch(pattern -> pattern.matcher(key).lookingAt())){
                return;
            }
            if(level.keys.stream().anyMatch(previous -> key.compareTo(previous) < 0)){
                issues.add(issue(tokens.lineOf(index + 1), tokens.columnOf(index + 1) + 1, "wrong ordering of key \"" + key + "\" in mapping"));
            }else{
                level.keys.add(key);
            }
        }
    }
}

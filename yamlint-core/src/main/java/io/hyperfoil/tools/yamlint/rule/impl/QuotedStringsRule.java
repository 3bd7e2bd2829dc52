package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.analysis.YamlScanner;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.nodes.NodeId;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.TagToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Quoting style of string scalars. Plain scalars that resolve to another type (numbers, booleans, null) are not strings
 * and are never checked.
 */
public class QuotedStringsRule extends TokenRule {

    public static final String ONLY_WHEN_NEEDED = "only-when-needed";

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.choice("quote-type", "any", "any", "single", "double"),
            RuleOption.choice("required", true, true, false, ONLY_WHEN_NEEDED),
            RuleOption.stringList("extra-required"),
            RuleOption.stringList("extra-allowed"),
            RuleOption.bool("allow-quoted-quotes", false),
            RuleOption.bool("check-keys", false)
    );

    private static final String FLOW_CHARACTERS = ",[]{}";

    private final String quoteType;
    private final Object required;
    private final List<Pattern> extraRequired;
    private final List<Pattern> extraAllowed;
    private final boolean allowQuotedQuotes;
    private final boolean checkKeys;
    private final Resolver resolver = new Resolver();

    public QuotedStringsRule(RuleSettings settings){
        super(settings);
        quoteType = options.getString("quote-type");
        required = options.get("required");
        extraRequired = patterns(options.getStringList("extra-required"));
        extraAllowed = patterns(options.getStringList("extra-allowed"));
        allowQuotedQuotes = options.getBoolean("allow-quoted-quotes");
        checkKeys = options.getBoolean("check-keys");
        if(Boolean.TRUE.equals(required) && !extraAllowed.isEmpty()){
            throw new IllegalArgumentException("cannot use both \"required: true\" and \"extra-allowed\"");
        }
        if(Boolean.TRUE.equals(required) && !extraRequired.isEmpty()){
            throw new IllegalArgumentException("cannot use both \"required: true\" and \"extra-required\"");
        }
        if(Boolean.FALSE.equals(required) && !extraAllowed.isEmpty()){
            throw new IllegalArgumentException("cannot use both \"required: false\" and \"extra-allowed\"");
        }
    }

    private static List<Pattern> patterns(List<String> regexes){
        try {
            return regexes.stream().map(Pattern::compile).collect(Collectors.toList());
        } catch (PatternSyntaxException e){
            throw new IllegalArgumentException("invalid regular expression " + e.getPattern(), e);
        }
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(!tokens.is(index, Token.ID.Scalar) || !tokens.is(index - 1, Token.ID.BlockEntry, Token.ID.FlowEntry,
                Token.ID.FlowSequenceStart, Token.ID.Tag, Token.ID.Value, Token.ID.Key)){
            return;
        }
        boolean key = tokens.is(index - 1, Token.ID.Key);
        if(key && !checkKeys){
            return;
        }
        String node = key ? "key" : "value";
        // explicit types like !!str or !!int
        if(tokens.is(index - 1, Token.ID.Tag) && "!!".equals(((TagToken) tokens.token(index - 1)).getValue().getHandle())){
            return;
        }
        ScalarToken token = (ScalarToken) tokens.token(index);
        String value = token.getValue();
        boolean plain = token.getPlain();
        Tag tag = resolver.resolve(NodeId.scalar, value, true);
        if(plain && !Tag.STR.equals(tag)){
            return;
        }
        DumperOptions.ScalarStyle style = token.getStyle();
        if(style == DumperOptions.ScalarStyle.LITERAL || style == DumperOptions.ScalarStyle.FOLDED){
            return;
        }
        String message = null;
        if(Boolean.TRUE.equals(required)){
            if(plain || !(quoteMatches(style) || quotedQuotes(token))){
                message = "string " + node + " is not quoted with " + quoteType + " quotes";
            }
        }else if(Boolean.FALSE.equals(required)){
            if(!plain && !quoteMatches(style) && !quotedQuotes(token)){
                message = "string " + node + " is not quoted with " + quoteType + " quotes";
            }else if(plain && matchesAny(extraRequired, value)){
                message = "string " + node + " is not quoted";
            }
        }else{
            if(!plain && Tag.STR.equals(tag) && !value.isEmpty() && !quotesNeeded(value, tokens.isInFlow(index))){
                if(!matchesAny(extraRequired, value) && !matchesAny(extraAllowed, value)){
                    message = "string " + node + " is redundantly quoted with " + quoteType + " quotes";
                }
            }else if(!plain && !quoteMatches(style) && !quotedQuotes(token)){
                message = "string " + node + " is not quoted with " + quoteType + " quotes";
            }else if(plain && matchesAny(extraRequired, value)){
                message = "string " + node + " is not quoted";
            }
        }
        if(message != null){
            issues.add(issue(tokens.lineOf(index), tokens.columnOf(index) + 1, message));
        }
    }

    private boolean quoteMatches(DumperOptions.ScalarStyle style){
        switch (quoteType){
            case "single":
                return style == DumperOptions.ScalarStyle.SINGLE_QUOTED;
            case "double":
                return style == DumperOptions.ScalarStyle.DOUBLE_QUOTED;
            default:
                return true;
        }
    }

    private boolean quotedQuotes(ScalarToken token){
        if(!allowQuotedQuotes || token.getPlain()){
            return false;
        }
        DumperOptions.ScalarStyle style = token.getStyle();
        return (style == DumperOptions.ScalarStyle.SINGLE_QUOTED && token.getValue().contains("\""))
                || (style == DumperOptions.ScalarStyle.DOUBLE_QUOTED && token.getValue().contains("'"));
    }

    private static boolean matchesAny(List<Pattern> patterns, String value){
        return patterns.stream().anyMatch(pattern -> pattern.matcher(value).find());
    }

    /**
     * @return false when the value would scan back to the same plain scalar without quotes
     */
    static boolean quotesNeeded(String value, boolean inFlow){
        if(inFlow && value.chars().anyMatch(c -> FLOW_CHARACTERS.indexOf(c) >= 0)){
            return true;
        }
        List<Token> tokens = YamlScanner.scan("key: " + value);
        // StreamStart, BlockMappingStart, Key, Scalar, Value come from the "key: " prefix
        if(tokens.size() < 7){
            return true;
        }
        Token first = tokens.get(5);
        Token second = tokens.get(6);
        return !(first instanceof ScalarToken
                && ((ScalarToken) first).getPlain()
                && second.getTokenId() == Token.ID.BlockEnd
                && value.equals(((ScalarToken) first).getValue()));
    }
}

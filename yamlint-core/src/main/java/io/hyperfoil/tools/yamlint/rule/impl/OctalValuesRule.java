package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Plain scalars such as 010 or 0o10 that YAML 1.1 and 1.2 read as octal numbers.
 */
public class OctalValuesRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.bool("forbid-implicit-octal", true),
            RuleOption.bool("forbid-explicit-octal", true)
    );

    private static final Pattern OCTAL = Pattern.compile("[0-7]+");

    private final boolean forbidImplicit;
    private final boolean forbidExplicit;

    public OctalValuesRule(RuleSettings settings){
        super(settings);
        forbidImplicit = options.getBoolean("forbid-implicit-octal");
        forbidExplicit = options.getBoolean("forbid-explicit-octal");
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        if(tokens.is(index - 1, Token.ID.Tag) || !tokens.is(index, Token.ID.Scalar)){
            return;
        }
        ScalarToken token = (ScalarToken) tokens.token(index);
        if(!token.getPlain()){
            return;
        }
        String value = token.getValue();
        int column = token.getEndMark().getColumn() + 1;
        if(forbidImplicit && value.length() > 1 && value.charAt(0) == '0' && isDigits(value) && OCTAL.matcher(value.substring(1)).matches()){
            issues.add(issue(tokens.lineOf(index), column, "forbidden implicit octal value \"" + value + "\""));
        }
        if(forbidExplicit && value.length() > 2 && value.startsWith("0o") && OCTAL.matcher(value.substring(2)).matches()){
            issues.add(issue(tokens.lineOf(index), column, "forbidden explicit octal value \"" + value + "\""));
        }
    }

    private static boolean isDigits(String value){
        return value.chars().allMatch(Character::isDigit);
    }
}

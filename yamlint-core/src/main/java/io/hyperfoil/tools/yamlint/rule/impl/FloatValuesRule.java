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

public class FloatValuesRule extends TokenRule {

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.bool("require-numeral-before-decimal", false),
            RuleOption.bool("forbid-scientific-notation", false),
            RuleOption.bool("forbid-nan", false),
            RuleOption.bool("forbid-inf", false)
    );

    private static final Pattern MISSING_NUMERAL = Pattern.compile("[-+]?(\\.[0-9]+)([eE][-+]?[0-9]+)?");
    private static final Pattern SCIENTIFIC = Pattern.compile("[-+]?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)([eE][-+]?[0-9]+)");
    private static final Pattern INF = Pattern.compile("[-+]?(\\.inf|\\.Inf|\\.INF)");
    private static final Pattern NAN = Pattern.compile("\\.nan|\\.NaN|\\.NAN");

    private final boolean requireNumeral;
    private final boolean forbidScientific;
    private final boolean forbidNan;
    private final boolean forbidInf;

    public FloatValuesRule(RuleSettings settings){
        super(settings);
        requireNumeral = options.getBoolean("require-numeral-before-decimal");
        forbidScientific = options.getBoolean("forbid-scientific-notation");
        forbidNan = options.getBoolean("forbid-nan");
        forbidInf = options.getBoolean("forbid-inf");
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
        int line = tokens.lineOf(index);
        int column = tokens.columnOf(index) + 1;
        if(forbidNan && NAN.matcher(value).matches()){
            issues.add(issue(line, column, "forbidden not a number value \"" + value + "\""));
        }
        if(forbidInf && INF.matcher(value).matches()){
            issues.add(issue(line, column, "forbidden infinite value \"" + value + "\""));
        }
        if(forbidScientific && SCIENTIFIC.matcher(value).matches()){
            issues.add(issue(line, column, "forbidden scientific notation \"" + value + "\""));
        }
        if(requireNumeral && MISSING_NUMERAL.matcher(value).matches()){
            issues.add(issue(line, column, "forbidden decimal missing 0 prefix \"" + value + "\""));
        }
    }
}

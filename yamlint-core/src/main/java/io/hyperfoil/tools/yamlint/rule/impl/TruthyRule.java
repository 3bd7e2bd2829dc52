package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.FixResult;
import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.analysis.LineInfo;
import io.hyperfoil.tools.yamlint.analysis.TokenAnalysis;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import io.hyperfoil.tools.yamlint.rule.TextEdits;
import io.hyperfoil.tools.yamlint.rule.TokenRule;
import org.yaml.snakeyaml.tokens.DirectiveToken;
import org.yaml.snakeyaml.tokens.ScalarToken;
import org.yaml.snakeyaml.tokens.Token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Plain scalars that YAML 1.1 reads as booleans but are not in the allowed values, like {@code yes} or {@code Off}.
 */
public class TruthyRule extends TokenRule {

    public static final List<String> TRUTHY_1_1 = Collections.unmodifiableList(Arrays.asList(
            "YES", "Yes", "yes", "NO", "No", "no",
            "TRUE", "True", "true", "FALSE", "False", "false",
            "ON", "On", "on", "OFF", "Off", "off"
    ));
    public static final List<String> TRUTHY_1_2 = Collections.unmodifiableList(Arrays.asList(
            "TRUE", "True", "true", "FALSE", "False", "false"
    ));

    public static final List<RuleOption> OPTIONS = Arrays.asList(
            RuleOption.stringList("allowed-values", "true", "false"),
            RuleOption.bool("check-keys", true)
    );

    private final Set<String> allowed;
    private final boolean checkKeys;
    private final String message;

    private boolean yaml12;
    private Set<String> forbidden;

    public TruthyRule(RuleSettings settings){
        super(settings);
        allowed = new LinkedHashSet<>(options.getStringList("allowed-values"));
        for(String value : allowed){
            if(!TRUTHY_1_1.contains(value)){
                throw new IllegalArgumentException("allowed-values should only contain truthy values, found " + value);
            }
        }
        checkKeys = options.getBoolean("check-keys");
        message = "truthy value should be one of [" + String.join(", ", new TreeSet<>(allowed)) + "]";
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        if(analysis.hasTokens()){
            super.scan(analysis, issues);
            return;
        }
        // line scan without tokens, keys and values cannot be told apart
        Set<String> bad = forbidden(false);
        analysis.getTruthyValues().forEach((line, words) -> {
            LineInfo info = analysis.getLine(line);
            if(info.isComment()){
                return;
            }
            int from = 0;
            for(String word : words){
                int at = info.getText().indexOf(word, from);
                if(bad.contains(word) && at >= 0){
                    issues.add(issue(line, info.getText().codePointCount(0, at) + 1, message));
                }
                from = at >= 0 ? at + word.length() : from;
            }
        });
    }

    @Override
    protected void start(TokenAnalysis tokens){
        yaml12 = false;
        forbidden = null;
    }

    @Override
    protected void token(TokenAnalysis tokens, int index, List<Issue> issues){
        Token token = tokens.token(index);
        if(token instanceof DirectiveToken && "YAML".equals(((DirectiveToken<?>) token).getName())){
            List<?> version = ((DirectiveToken<?>) token).getValue();
            yaml12 = version != null && version.size() == 2 && Integer.valueOf(1).equals(version.get(0)) && Integer.valueOf(2).equals(version.get(1));
        }else if(tokens.is(index, Token.ID.DocumentEnd)){
            yaml12 = false;
            forbidden = null;
        }
        if(tokens.is(index - 1, Token.ID.Tag)){
            return;
        }
        if(!checkKeys && tokens.is(index - 1, Token.ID.Key) && tokens.is(index, Token.ID.Scalar)){
            return;
        }
        if(token instanceof ScalarToken && ((ScalarToken) token).getPlain()){
            if(forbidden == null){
                forbidden = forbidden(yaml12);
            }
            if(forbidden.contains(((ScalarToken) token).getValue())){
                issues.add(issue(tokens.lineOf(index), tokens.columnOf(index) + 1, message));
            }
        }
    }

    private Set<String> forbidden(boolean yaml12){
        Set<String> rtrn = new HashSet<>(yaml12 ? TRUTHY_1_2 : TRUTHY_1_1);
        rtrn.removeAll(allowed);
        return rtrn;
    }

    /**
     * @return the allowed lower case boolean with the same meaning, or null when it is not allowed
     */
    String replacement(String value){
        String lower = value.toLowerCase(Locale.ROOT);
        String rtrn = "yes".equals(lower) || "on".equals(lower) || "true".equals(lower) ? "true" : "false";
        return allowed.contains(rtrn) ? rtrn : null;
    }

    @Override
    public FixResult fix(String content, String path){
        if(isIgnored(path)){
            return FixResult.unchanged(content);
        }
        TokenAnalysis tokens = TokenAnalysis.analyze(content);
        List<Issue> found = new ArrayList<>();
        start(tokens);
        List<int[]> edits = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for(int i=0; i<tokens.size(); i++){
            int before = found.size();
            token(tokens, i, found);
            if(found.size() > before){
                String replacement = replacement(((ScalarToken) tokens.token(i)).getValue());
                if(replacement != null){
                    Token token = tokens.token(i);
                    edits.add(new int[]{token.getStartMark().getIndex(), token.getEndMark().getIndex()});
                    values.add(replacement);
                }
            }
        }
        if(edits.isEmpty()){
            return FixResult.unchanged(content);
        }
        StringBuilder builder = new StringBuilder(content);
        for(int i=edits.size() - 1; i>=0; i--){
            int start = TextEdits.offset(content, edits.get(i)[0]);
            int end = TextEdits.offset(content, edits.get(i)[1]);
            builder.replace(start, end, values.get(i));
        }
        return new FixResult(builder.toString(), edits.size());
    }
}

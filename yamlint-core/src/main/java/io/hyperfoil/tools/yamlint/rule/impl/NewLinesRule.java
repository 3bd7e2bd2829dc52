package io.hyperfoil.tools.yamlint.rule.impl;

import io.hyperfoil.tools.yamlint.Issue;
import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.rule.AbstractRule;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.util.Collections;
import java.util.List;

/**
 * The line break of the first line must match the configured type.
 */
public class NewLinesRule extends AbstractRule {

    public static final List<RuleOption> OPTIONS = Collections.singletonList(RuleOption.choice("type", "unix", "unix", "dos", "platform"));

    private final String lineBreak;

    public NewLinesRule(RuleSettings settings){
        super(settings);
        switch (options.getString("type")){
            case "dos":
                lineBreak = "\r\n";
                break;
            case "platform":
                lineBreak = System.lineSeparator();
                break;
            default:
                lineBreak = "\n";
        }
    }

    @Override
    protected void scan(ContentAnalysis analysis, List<Issue> issues){
        String content = analysis.getContent();
        int newline = content.indexOf('\n');
        if(newline < 0){
            return;
        }
        int end = newline > 0 && content.charAt(newline - 1) == '\r' ? newline - 1 : newline;
        if(!content.startsWith(lineBreak, end)){
            String expected = lineBreak.replace("\r", "\\r").replace("\n", "\\n");
            issues.add(issue(1, content.codePointCount(0, end) + 1, "wrong new line character: expected " + expected));
        }
    }
}

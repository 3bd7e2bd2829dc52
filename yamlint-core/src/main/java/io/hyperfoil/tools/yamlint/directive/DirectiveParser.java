package io.hyperfoil.tools.yamlint.directive;

import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads suppression comments such as {@code # yamllint disable rule:line-length}.
 * <p>
 * A comment on its own line disables or enables rules from that line on, {@code disable-line} on its own line covers
 * the following line. A trailing comment only ever covers the line it is on.
 */
public class DirectiveParser {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final String[] PREFIXES = {"yamllint", "yamlint"};

    private static final String PRODUCT = "(?:" + String.join("|", PREFIXES) + ")";
    private static final Pattern DIRECTIVE = Pattern.compile("^# " + PRODUCT + " (disable-line|disable|enable)((?: rule:\\S+)*)\\s*$");
    private static final Pattern RULE = Pattern.compile("rule:(\\S+)");

    enum Kind {Disable, Enable, DisableLine}

    private final Set<String> knownRules;

    /**
     * @param knownRules rule ids a directive may name, other ids are dropped
     */
    public DirectiveParser(Set<String> knownRules){
        this.knownRules = knownRules;
    }

    public Directives parse(String content){
        Directives directives = new Directives();
        if(content == null || content.indexOf('#') < 0){
            return directives;
        }
        List<String> lines = ContentAnalysis.splitLines(content);
        for(int i=0; i<lines.size(); i++){
            int lineNumber = i + 1;
            String line = lines.get(i);
            String trimmed = line.trim();
            if(trimmed.startsWith("#")){
                Matcher matcher = DIRECTIVE.matcher(trimmed);
                if(matcher.matches()){
                    Kind kind = kind(matcher.group(1));
                    RuleSelection rules = rules(matcher.group(2), lineNumber);
                    switch (kind){
                        case Disable:
                            directives.disableFrom(lineNumber, rules);
                            break;
                        case Enable:
                            directives.enableFrom(lineNumber, rules);
                            break;
                        case DisableLine:
                            directives.disableLine(lineNumber + 1, rules);
                            break;
                    }
                }
            }else{
                int comment = inlineComment(line);
                if(comment >= 0){
                    Matcher matcher = DIRECTIVE.matcher(line.substring(comment).trim());
                    if(matcher.matches()){
                        directives.disableLine(lineNumber, rules(matcher.group(2), lineNumber));
                    }
                }
            }
        }
        if(!directives.isEmpty()){
            logger.debugf("directives %s", directives);
        }
        return directives;
    }

    private static Kind kind(String keyword){
        switch (keyword){
            case "disable":
                return Kind.Disable;
            case "enable":
                return Kind.Enable;
            default:
                return Kind.DisableLine;
        }
    }

    private RuleSelection rules(String list, int line){
        if(list == null || list.isBlank()){
            return RuleSelection.ALL;
        }
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = RULE.matcher(list);
        while(matcher.find()){
            String id = matcher.group(1);
            if(knownRules.contains(id)){
                ids.add(id);
            }else{
                logger.debugf("ignoring unknown rule %s in directive on line %d", id, line);
            }
        }
        return RuleSelection.of(ids);
    }

    /**
     * @return the index of the '#' starting a trailing comment, -1 if the line has none
     */
    static int inlineComment(String line){
        boolean single = false;
        boolean dbl = false;
        for(int i=0; i<line.length(); i++){
            char c = line.charAt(i);
            if(dbl){
                if(c == '\\'){
                    i++;
                }else if(c == '"'){
                    dbl = false;
                }
            }else if(single){
                if(c == '\''){
                    single = false;
                }
            }else if(c == '#'){
                if(i == 0 || Character.isWhitespace(line.charAt(i - 1))){
                    return i;
                }
            }else if((c == '"' || c == '\'') && opensScalar(line, i)){
                if(c == '"'){
                    dbl = true;
                }else{
                    single = true;
                }
            }
        }
        return -1;
    }

    private static boolean opensScalar(String line, int i){
        if(i == 0){
            return true;
        }
        char before = line.charAt(i - 1);
        return Character.isWhitespace(before) || before == ':' || before == '[' || before == '{' || before == ',' || before == '-';
    }
}

package io.hyperfoil.tools.yamlint;

import io.hyperfoil.tools.yamlint.analysis.ContentAnalysis;
import io.hyperfoil.tools.yamlint.config.LintConfig;
import io.hyperfoil.tools.yamlint.directive.DirectiveParser;
import io.hyperfoil.tools.yamlint.directive.Directives;
import io.hyperfoil.tools.yamlint.rule.Rule;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Runs the enabled rules of a configuration over one document.
 * <p>
 * Rules are created for every call so one linter can be shared between threads.
 */
public class Linter {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final LintConfig config;
    private final DirectiveParser directiveParser;

    public Linter(LintConfig config){
        this.config = config;
        this.directiveParser = new DirectiveParser(RuleId.ids());
    }

    public LintConfig getConfig(){return config;}

    /**
     * @param path the path used for the ignore patterns of rules, may be null
     * @return the issues that are not suppressed by a directive, sorted by line then column
     */
    public List<Issue> lint(String content, String path){
        Directives directives = directiveParser.parse(content);
        ContentAnalysis analysis = ContentAnalysis.analyze(content);
        List<Issue> issues = new ArrayList<>();
        for(Rule rule : config.createRules()){
            List<Issue> found = rule.checkWithAnalysis(content, path, analysis);
            logger.tracef("%s found %d issues in %s", rule.getId(), found.size(), path);
            issues.addAll(found);
        }
        List<Issue> rtrn = issues.stream()
                .filter(issue -> !directives.isSuppressed(issue.getLine(), issue.getRuleId()))
                .sorted(Issue.BY_POSITION)
                .collect(Collectors.toList());
        logger.debugf("%s: %d issues, %d suppressed", path, rtrn.size(), issues.size() - rtrn.size());
        return rtrn;
    }

    /**
     * Applies the fixes of the enabled rules in fix order then lints the fixed content.
     */
    public LintResult fix(String content, String path){
        FixResult fixed = FixResult.unchanged(content);
        for(Rule rule : config.createFixers()){
            FixResult next = rule.fix(fixed.getContent(), path);
            if(next.isChanged()){
                logger.debugf("%s applied %d fixes to %s", rule.getId(), next.getFixesApplied(), path);
            }
            fixed = fixed.then(next);
        }
        return new LintResult(path, lint(fixed.getContent(), path), fixed);
    }

    public LintResult check(String content, String path){
        return new LintResult(path, lint(content, path), FixResult.unchanged(content));
    }
}

package io.hyperfoil.tools.yamlint.config;

import io.hyperfoil.tools.yamlint.rule.Rule;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import io.hyperfoil.tools.yamlint.rule.RuleRegistry;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable lint configuration: the settings of every rule, the globally ignored paths and the names of yaml files.
 */
public class LintConfig {

    public static final List<String> DEFAULT_YAML_FILES = Collections.unmodifiableList(Arrays.asList("*.yaml", "*.yml", ".yamllint"));

    /**
     * Every rule with its built in settings, matching the {@code default} preset.
     */
    public static LintConfig builtIn(){
        Map<RuleId,RuleSettings> rules = new EnumMap<>(RuleId.class);
        for(RuleId id : RuleId.values()){
            rules.put(id, RuleSettings.defaults(id));
        }
        return new LintConfig(rules, Collections.emptyList(), DEFAULT_YAML_FILES);
    }

    private final Map<RuleId,RuleSettings> rules;
    private final List<String> ignore;
    private final PathPatterns ignorePatterns;
    private final List<String> yamlFiles;
    private final List<PathMatcher> yamlMatchers;

    LintConfig(Map<RuleId,RuleSettings> rules, List<String> ignore, List<String> yamlFiles){
        EnumMap<RuleId,RuleSettings> copy = new EnumMap<>(RuleId.class);
        copy.putAll(rules);
        this.rules = Collections.unmodifiableMap(copy);
        this.ignore = Collections.unmodifiableList(new ArrayList<>(ignore));
        this.ignorePatterns = PathPatterns.files(ignore);
        this.yamlFiles = Collections.unmodifiableList(new ArrayList<>(yamlFiles));
        this.yamlMatchers = new ArrayList<>();
        for(String glob : yamlFiles){
            try {
                yamlMatchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob));
            } catch (IllegalArgumentException e) {
                throw new ConfigException("invalid yaml-files pattern " + glob + ": " + e.getMessage(), e);
            }
        }
    }

    public RuleSettings getSettings(RuleId id){return rules.get(id);}
    public Map<RuleId,RuleSettings> getRules(){return rules;}
    public List<String> getIgnore(){return ignore;}
    public List<String> getYamlFiles(){return yamlFiles;}

    public List<RuleSettings> getEnabledRules(){
        return rules.values().stream().filter(RuleSettings::isEnabled).collect(Collectors.toList());
    }

    public LintConfig withRule(RuleSettings settings){
        Map<RuleId,RuleSettings> copy = new EnumMap<>(rules);
        copy.put(settings.getId(), settings);
        return new LintConfig(copy, ignore, yamlFiles);
    }
    public LintConfig withIgnore(List<String> ignore){
        return new LintConfig(rules, ignore, yamlFiles);
    }
    public LintConfig withYamlFiles(List<String> yamlFiles){
        return new LintConfig(rules, ignore, yamlFiles);
    }

    /**
     * @return new instances of the enabled rules, ordered by rule id
     */
    public List<Rule> createRules(){
        return getEnabledRules().stream().map(RuleRegistry::create).collect(Collectors.toList());
    }

    /**
     * @return new instances of the enabled rules that can fix content, in the order the fixes run
     */
    public List<Rule> createFixers(){
        return getEnabledRules().stream()
                .filter(settings -> settings.getId().canFix())
                .sorted(Comparator.comparingInt(settings -> settings.getId().getFixOrder()))
                .map(RuleRegistry::create)
                .collect(Collectors.toList());
    }

    public boolean isIgnored(String path){
        return ignorePatterns.matches(path);
    }

    /**
     * @return true when the file name, or the relative path, matches one of the yaml-files globs
     */
    public boolean isYamlFile(String path){
        Path candidate = Paths.get(PathPatterns.normalize(path));
        Path fileName = candidate.getFileName();
        for(PathMatcher matcher : yamlMatchers){
            if(matcher.matches(candidate) || (fileName != null && matcher.matches(fileName))){
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString(){
        return "rules=" + rules.values() + " ignore=" + ignore + " yaml-files=" + yamlFiles;
    }
}

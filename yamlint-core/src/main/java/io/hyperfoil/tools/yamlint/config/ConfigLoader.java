package io.hyperfoil.tools.yamlint.config;

import io.hyperfoil.tools.yamlint.Severity;
import io.hyperfoil.tools.yamlint.rule.RuleId;
import io.hyperfoil.tools.yamlint.rule.RuleOption;
import io.hyperfoil.tools.yamlint.rule.RuleRegistry;
import io.hyperfoil.tools.yamlint.rule.RuleSettings;
import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads lint configuration files.
 * <pre>
 * extends: default
 * ignore: |
 *   generated/
 * yaml-files: ['*.yaml', '*.yml']
 * rules:
 *   line-length:
 *     max: 120
 *     level: warning
 *   document-start: disable
 * </pre>
 */
public class ConfigLoader {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    public static final List<String> PRESETS = Collections.unmodifiableList(Arrays.asList("default", "relaxed"));
    public static final List<String> DISCOVERED_FILES = Collections.unmodifiableList(Arrays.asList(".yamllint", ".yamllint.yaml", ".yamllint.yml"));

    private static final String PRESET_PATH = "io/hyperfoil/tools/yamlint/conf/";

    private ConfigLoader(){}

    /**
     * Picks the configuration the command line asks for.
     * @param configFile the -c file or null
     * @param configData the -d yaml or preset name or null
     * @param workingDir where the search for a project configuration file starts
     */
    public static LintConfig discover(Path configFile, String configData, Path workingDir){
        if(configFile != null){
            logger.debugf("using configuration file %s", configFile);
            return load(configFile);
        }
        if(configData != null){
            logger.debug("using configuration data from the command line");
            String trimmed = configData.trim();
            return PRESETS.contains(trimmed) ? preset(trimmed) : parse(configData, workingDir);
        }
        Path found = find(workingDir);
        if(found != null){
            logger.debugf("using project configuration %s", found);
            return load(found);
        }
        logger.debug("using the default configuration");
        return preset("default");
    }

    /**
     * @return the nearest configuration file in the directory or one of its parents, null if there is none
     */
    public static Path find(Path directory){
        Path current = directory == null ? null : directory.toAbsolutePath().normalize();
        while(current != null){
            for(String name : DISCOVERED_FILES){
                Path candidate = current.resolve(name);
                if(Files.isRegularFile(candidate)){
                    return candidate;
                }
            }
            current = current.getParent();
        }
        return null;
    }

    public static LintConfig load(Path file){
        String content;
        try {
            content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
        Path parent = file.toAbsolutePath().getParent();
        return parse(content, parent);
    }

    public static LintConfig preset(String name){
        if(!PRESETS.contains(name)){
            throw new ConfigException("unknown configuration preset " + name);
        }
        try (InputStream stream = ConfigLoader.class.getClassLoader().getResourceAsStream(PRESET_PATH + name + ".yaml")){
            if(stream == null){
                throw new ConfigException("missing configuration preset " + name);
            }
            return parse(new String(stream.readAllBytes(), StandardCharsets.UTF_8), null);
        } catch (IOException e) {
            throw new ConfigException("cannot read configuration preset " + name, e);
        }
    }

    /**
     * @param baseDir directory that relative {@code extends} paths resolve against, null for the working directory
     */
    public static LintConfig parse(String content, Path baseDir){
        Object loaded;
        try {
            loaded = new Yaml(new SafeConstructor(new LoaderOptions())).load(content);
        } catch (YAMLException e) {
            throw new ConfigException("invalid config: " + e.getMessage(), e);
        }
        if(!(loaded instanceof Map)){
            throw new ConfigException("invalid config: not a mapping");
        }
        Map<?,?> map = (Map<?,?>) loaded;
        for(Object key : map.keySet()){
            if(!Arrays.asList("extends", "rules", "ignore", "yaml-files").contains(key)){
                throw new ConfigException("invalid config: unknown key " + key);
            }
        }

        LintConfig config = LintConfig.builtIn();
        Object extend = map.get("extends");
        if(extend != null){
            if(!(extend instanceof String)){
                throw new ConfigException("invalid config: extends should be a preset name or a file path");
            }
            config = base((String) extend, baseDir);
        }
        if(map.containsKey("ignore")){
            config = config.withIgnore(stringList("ignore", map.get("ignore"), true));
        }
        if(map.containsKey("yaml-files")){
            config = config.withYamlFiles(stringList("yaml-files", map.get("yaml-files"), false));
        }
        Object rules = map.get("rules");
        if(rules != null){
            if(!(rules instanceof Map)){
                throw new ConfigException("invalid config: rules should be a mapping");
            }
            for(Map.Entry<?,?> entry : ((Map<?,?>) rules).entrySet()){
                config = config.withRule(rule(config, String.valueOf(entry.getKey()), entry.getValue()));
            }
        }
        validate(config);
        return config;
    }

    private static LintConfig base(String extend, Path baseDir){
        if(PRESETS.contains(extend)){
            return preset(extend);
        }
        Path path = baseDir == null ? Path.of(extend) : baseDir.resolve(extend);
        if(!Files.isRegularFile(path)){
            throw new ConfigException("invalid config: extends " + extend + " is neither a preset nor a file");
        }
        return load(path);
    }

    private static RuleSettings rule(LintConfig config, String name, Object value){
        RuleId id = RuleId.fromId(name);
        if(id == null){
            throw new ConfigException("invalid config: no such rule: \"" + name + "\"");
        }
        RuleSettings settings = config.getSettings(id);
        if("enable".equals(value)){
            return settings.withEnabled(true);
        }
        if("disable".equals(value)){
            return settings.withEnabled(false);
        }
        if(!(value instanceof Map)){
            throw new ConfigException("invalid config: rule \"" + name + "\" should be enable, disable or a mapping");
        }
        settings = settings.withEnabled(true);
        for(Map.Entry<?,?> entry : ((Map<?,?>) value).entrySet()){
            String option = String.valueOf(entry.getKey());
            Object optionValue = entry.getValue();
            if("level".equals(option)){
                if("disable".equals(optionValue)){
                    settings = settings.withEnabled(false);
                }else{
                    Severity severity = optionValue instanceof String ? Severity.from((String) optionValue) : null;
                    if(severity == null){
                        throw new ConfigException("invalid config: level should be \"error\", \"warning\" or \"info\" for rule \"" + name + "\"");
                    }
                    settings = settings.withSeverity(severity);
                }
            }else if("ignore".equals(option)){
                settings = settings.withIgnore(stringList(name + ".ignore", optionValue, true));
            }else{
                RuleOption ruleOption = RuleRegistry.option(id, option);
                if(ruleOption == null){
                    throw new ConfigException("invalid config: unknown option \"" + option + "\" for rule \"" + name + "\"");
                }
                Object accepted = ruleOption.accept(optionValue);
                if(accepted == null){
                    throw new ConfigException("invalid config: option \"" + option + "\" of \"" + name + "\" should be " + ruleOption.describe());
                }
                settings = settings.withOption(option, accepted);
            }
        }
        return settings;
    }

    /**
     * @param block when true a string value is read as one pattern per line
     */
    private static List<String> stringList(String name, Object value, boolean block){
        if(value instanceof String){
            return block ? PathPatterns.lines((String) value) : Collections.singletonList((String) value);
        }
        if(value instanceof List){
            List<String> rtrn = new ArrayList<>();
            for(Object entry : (List<?>) value){
                if(!(entry instanceof String)){
                    throw new ConfigException("invalid config: " + name + " should contain file patterns");
                }
                rtrn.add((String) entry);
            }
            return rtrn;
        }
        throw new ConfigException("invalid config: " + name + " should be a list of file patterns");
    }

    private static void validate(LintConfig config){
        for(RuleSettings settings : config.getEnabledRules()){
            try {
                RuleRegistry.create(settings);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("invalid config: " + settings.getId() + ": " + e.getMessage(), e);
            }
        }
    }
}

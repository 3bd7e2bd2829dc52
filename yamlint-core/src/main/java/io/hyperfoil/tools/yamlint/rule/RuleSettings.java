package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Severity;

import java.util.Collections;
import java.util.List;

/**
 * How one rule is configured: whether it runs, the level of its issues, its options and the paths it skips.
 */
public class RuleSettings {

    public static RuleSettings defaults(RuleId id){
        return new RuleSettings(id, id.isEnabledByDefault(), id.getDefaultSeverity(),
                RuleOptions.defaults(RuleRegistry.options(id)), Collections.emptyList());
    }

    private final RuleId id;
    private final boolean enabled;
    private final Severity severity;
    private final RuleOptions options;
    private final List<String> ignore;

    public RuleSettings(RuleId id, boolean enabled, Severity severity, RuleOptions options, List<String> ignore){
        this.id = id;
        this.enabled = enabled;
        this.severity = severity;
        this.options = options;
        this.ignore = Collections.unmodifiableList(ignore);
    }

    public RuleId getId(){return id;}
    public boolean isEnabled(){return enabled;}
    public Severity getSeverity(){return severity;}
    public RuleOptions getOptions(){return options;}
    public List<String> getIgnore(){return ignore;}

    public RuleSettings withEnabled(boolean enabled){
        return new RuleSettings(id, enabled, severity, options, ignore);
    }
    public RuleSettings withSeverity(Severity severity){
        return new RuleSettings(id, enabled, severity, options, ignore);
    }
    public RuleSettings withOption(String name, Object value){
        return new RuleSettings(id, enabled, severity, options.with(name, value), ignore);
    }
    public RuleSettings withIgnore(List<String> ignore){
        return new RuleSettings(id, enabled, severity, options, ignore);
    }

    @Override
    public String toString(){
        return id + (enabled ? "" : " (disabled)") + " " + severity + " " + options;
    }
}

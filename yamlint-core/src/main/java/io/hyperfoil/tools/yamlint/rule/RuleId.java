package io.hyperfoil.tools.yamlint.rule;

import io.hyperfoil.tools.yamlint.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The rules yamlint knows about.
 */
public enum RuleId {
    ANCHORS("anchors", "Undeclared, duplicated and unused anchors", Severity.ERROR, true),
    BRACES("braces", "Spaces inside flow mappings", Severity.ERROR, true),
    BRACKETS("brackets", "Spaces inside flow sequences", Severity.ERROR, true),
    COLONS("colons", "Spaces around colons", Severity.ERROR, true),
    COMMAS("commas", "Spaces around commas", Severity.ERROR, true),
    COMMENTS("comments", "Spaces around the comment marker", Severity.WARNING, true),
    COMMENTS_INDENTATION("comments-indentation", "Comments indented like the content", Severity.WARNING, true),
    DOCUMENT_END("document-end", "Document end marker", Severity.ERROR, false, 100),
    DOCUMENT_START("document-start", "Document start marker", Severity.WARNING, true, 1),
    EMPTY_LINES("empty-lines", "Consecutive blank lines", Severity.ERROR, true),
    EMPTY_VALUES("empty-values", "Keys without a value", Severity.ERROR, false),
    FLOAT_VALUES("float-values", "Float value forms", Severity.ERROR, false),
    HYPHENS("hyphens", "Spaces after hyphens", Severity.ERROR, true),
    INDENTATION("indentation", "Indentation of block structures", Severity.ERROR, true),
    KEY_DUPLICATES("key-duplicates", "Keys repeated in one mapping", Severity.ERROR, true),
    KEY_ORDERING("key-ordering", "Alphabetical order of keys", Severity.ERROR, false),
    LINE_LENGTH("line-length", "Maximum line length", Severity.ERROR, true),
    NEW_LINE_AT_END_OF_FILE("new-line-at-end-of-file", "Line break at the end of the file", Severity.ERROR, true, 100),
    NEW_LINES("new-lines", "Line break characters", Severity.ERROR, true),
    OCTAL_VALUES("octal-values", "Implicit and explicit octal values", Severity.ERROR, false),
    QUOTED_STRINGS("quoted-strings", "Quoting of string values", Severity.ERROR, false),
    TRAILING_SPACES("trailing-spaces", "Whitespace at the end of lines", Severity.ERROR, true, 10),
    TRUTHY("truthy", "Truthy values other than the allowed ones", Severity.WARNING, true, 10);

    public static final int NO_FIX = -1;

    private static final Map<String,RuleId> BY_ID;
    static {
        Map<String,RuleId> byId = new LinkedHashMap<>();
        for(RuleId ruleId : values()){
            byId.put(ruleId.id, ruleId);
        }
        BY_ID = Collections.unmodifiableMap(byId);
    }

    public static RuleId fromId(String id){
        return BY_ID.get(id);
    }

    public static Set<String> ids(){
        return BY_ID.keySet();
    }

    private final String id;
    private final String description;
    private final Severity defaultSeverity;
    private final boolean enabledByDefault;
    private final int fixOrder;

    RuleId(String id, String description, Severity defaultSeverity, boolean enabledByDefault){
        this(id, description, defaultSeverity, enabledByDefault, NO_FIX);
    }
    RuleId(String id, String description, Severity defaultSeverity, boolean enabledByDefault, int fixOrder){
        this.id = id;
        this.description = description;
        this.defaultSeverity = defaultSeverity;
        this.enabledByDefault = enabledByDefault;
        this.fixOrder = fixOrder;
    }

    public String getId(){return id;}
    public String getDescription(){return description;}
    public Severity getDefaultSeverity(){return defaultSeverity;}
    public boolean isEnabledByDefault(){return enabledByDefault;}
    public boolean canFix(){return fixOrder != NO_FIX;}

    /**
     * Fixes run in increasing order, each on the output of the previous one.
     */
    public int getFixOrder(){return fixOrder;}

    @Override
    public String toString(){
        return id;
    }
}

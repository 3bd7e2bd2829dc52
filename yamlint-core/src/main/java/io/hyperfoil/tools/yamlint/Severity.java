package io.hyperfoil.tools.yamlint;

public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String label;

    Severity(String label){
        this.label = label;
    }

    public String getLabel(){return label;}

    /**
     * @return the severity for a configuration level, null if the level is not a severity
     */
    public static Severity from(String level){
        for(Severity severity : values()){
            if(severity.label.equals(level)){
                return severity;
            }
        }
        return null;
    }

    @Override
    public String toString(){
        return label;
    }
}

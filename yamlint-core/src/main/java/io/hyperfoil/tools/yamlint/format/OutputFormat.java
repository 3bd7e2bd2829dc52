package io.hyperfoil.tools.yamlint.format;

import java.util.Locale;

public enum OutputFormat {
    Standard, Colored, Parsable, Auto;

    /**
     * @return the format with that name ignoring case, null for an unknown name
     */
    public static OutputFormat from(String name){
        if(name == null){
            return null;
        }
        for(OutputFormat format : values()){
            if(format.name().toLowerCase(Locale.ROOT).equals(name.trim().toLowerCase(Locale.ROOT))){
                return format;
            }
        }
        return null;
    }

    @Override
    public String toString(){
        return name().toLowerCase(Locale.ROOT);
    }
}

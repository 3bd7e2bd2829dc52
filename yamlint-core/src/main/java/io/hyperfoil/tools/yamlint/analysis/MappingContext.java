package io.hyperfoil.tools.yamlint.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keys seen at one indentation while that indentation stays open.
 */
public class MappingContext {

    private final int startLine;
    private final int indentation;
    private final Map<String,Integer> keys;
    private int endLine;
    private boolean active;

    MappingContext(int startLine, int indentation){
        this.startLine = startLine;
        this.indentation = indentation;
        this.keys = new LinkedHashMap<>();
        this.endLine = -1;
        this.active = true;
    }

    /**
     * @return the line the key was first seen on, or null when it is the first occurrence
     */
    Integer addKey(String key, int line){
        Integer first = keys.get(key);
        if(first == null){
            keys.put(key, line);
        }
        return first;
    }

    void close(int line){
        if(active){
            active = false;
            endLine = Math.max(startLine, line);
        }
    }

    public int getStartLine(){return startLine;}

    /**
     * @return the last line of the context, -1 while it is still open
     */
    public int getEndLine(){return endLine;}
    public int getIndentation(){return indentation;}
    public boolean isActive(){return active;}
    public Map<String,Integer> getKeys(){return Collections.unmodifiableMap(keys);}

    @Override
    public String toString(){
        return "context@" + indentation + "[" + startLine + "-" + (active ? "" : endLine) + "]" + keys.keySet();
    }
}

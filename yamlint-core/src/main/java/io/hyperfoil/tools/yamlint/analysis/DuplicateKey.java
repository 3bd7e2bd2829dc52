package io.hyperfoil.tools.yamlint.analysis;

import java.util.Objects;

public class DuplicateKey {

    private final String key;
    private final int firstLine;
    private final int line;
    private final int column;

    public DuplicateKey(String key, int firstLine, int line, int column){
        this.key = key;
        this.firstLine = firstLine;
        this.line = line;
        this.column = column;
    }

    public String getKey(){return key;}
    public int getFirstLine(){return firstLine;}
    public int getLine(){return line;}

    /**
     * @return 0-based column of the duplicated key
     */
    public int getColumn(){return column;}

    @Override
    public boolean equals(Object o){
        if(this == o) return true;
        if(!(o instanceof DuplicateKey)) return false;
        DuplicateKey that = (DuplicateKey) o;
        return firstLine == that.firstLine && line == that.line && column == that.column && key.equals(that.key);
    }

    @Override
    public int hashCode(){
        return Objects.hash(key, firstLine, line, column);
    }

    @Override
    public String toString(){
        return key + "@" + firstLine + "," + line;
    }
}

package io.hyperfoil.tools.yamlint.analysis;

public class IndentationMismatch {

    public static final int UNKNOWN = -1;

    private final int line;
    private final int expected;
    private final int found;
    private final String message;

    public IndentationMismatch(int line, int expected, int found){
        this(line, expected, found, expected < 0
                ? "wrong indentation: expected at least " + (found + 1)
                : "wrong indentation: expected " + expected + " but found " + found);
    }
    public IndentationMismatch(int line, int expected, int found, String message){
        this.line = line;
        this.expected = expected;
        this.found = found;
        this.message = message;
    }

    public int getLine(){return line;}
    public int getExpected(){return expected;}
    public int getFound(){return found;}

    /**
     * @return 1-based column to report
     */
    public int getColumn(){return found + 1;}
    public String getMessage(){return message;}

    @Override
    public String toString(){
        return line + ":" + getColumn() + " " + message;
    }
}

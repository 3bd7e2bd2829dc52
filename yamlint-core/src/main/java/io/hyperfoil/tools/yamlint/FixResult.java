package io.hyperfoil.tools.yamlint;

public class FixResult {

    public static FixResult unchanged(String content){
        return new FixResult(content, 0);
    }

    private final String content;
    private final int fixesApplied;

    public FixResult(String content, int fixesApplied){
        this.content = content;
        this.fixesApplied = fixesApplied;
    }

    public String getContent(){return content;}
    public boolean isChanged(){return fixesApplied > 0;}
    public int getFixesApplied(){return fixesApplied;}

    /**
     * @return a result with the content of {@code next} and the fixes of both
     */
    public FixResult then(FixResult next){
        return new FixResult(next.content, fixesApplied + next.fixesApplied);
    }

    @Override
    public String toString(){
        return "fixes=" + fixesApplied;
    }
}

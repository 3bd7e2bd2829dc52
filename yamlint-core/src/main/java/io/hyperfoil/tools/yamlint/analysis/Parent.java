package io.hyperfoil.tools.yamlint.analysis;

/**
 * One frame of the indentation stack: the container that following tokens are nested in.
 */
public class Parent {

    public enum Type {
        /** the document itself, never removed */
        Root,
        BlockMap,
        FlowMap,
        BlockSeq,
        FlowSeq,
        /** a block sequence item, the column is where the item content starts */
        BlockEntry,
        Key,
        /** the value of the Key frame below it */
        Value
    }

    private final Type type;
    private final int indent;
    private final int lineIndent;
    private boolean explicitKey = false;
    private boolean implicitBlockSeq = false;
    private boolean reported = false;

    public Parent(Type type, int indent){
        this(type, indent, -1);
    }
    public Parent(Type type, int indent, int lineIndent){
        this.type = type;
        this.indent = indent;
        this.lineIndent = lineIndent;
    }

    public Type getType(){return type;}
    public int getIndent(){return indent;}

    /**
     * @return indentation of the line a flow container opened on
     */
    public int getLineIndent(){return lineIndent;}

    public boolean isExplicitKey(){return explicitKey;}
    public void setExplicitKey(boolean explicitKey){this.explicitKey = explicitKey;}

    /**
     * A sequence without a block sequence start token, e.g. an unindented sequence under a key.
     */
    public boolean isImplicitBlockSeq(){return implicitBlockSeq;}
    public void setImplicitBlockSeq(boolean implicitBlockSeq){this.implicitBlockSeq = implicitBlockSeq;}

    public boolean isReported(){return reported;}
    public void setReported(boolean reported){this.reported = reported;}

    @Override
    public String toString(){
        return type + ":" + indent;
    }
}

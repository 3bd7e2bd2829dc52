package io.hyperfoil.tools.yamlint.analysis;

/**
 * Structural flags of one physical line. Lines are numbered from 1.
 */
public class LineInfo {

    public static LineInfo of(int lineNumber, String line){
        int length = line.codePointCount(0, line.length());
        String trimmed = line.trim();
        int indentation = 0;
        while(indentation < line.length() && isBlank(line.charAt(indentation))){
            indentation++;
        }
        int trailing = 0;
        if(indentation < line.length()) {
            while (trailing < line.length() && isBlank(line.charAt(line.length() - 1 - trailing))) {
                trailing++;
            }
        }else{
            trailing = line.length();
        }
        return new LineInfo(
                lineNumber,
                line,
                length,
                trimmed.isEmpty(),
                trimmed.startsWith("#"),
                trailing,
                indentation,
                line.substring(indentation).startsWith("-"),
                line.indexOf(':') >= 0,
                line.indexOf('"') >= 0 || line.indexOf('\'') >= 0,
                line.indexOf('{') >= 0 || line.indexOf('}') >= 0,
                line.indexOf('[') >= 0 || line.indexOf(']') >= 0
        );
    }

    static boolean isBlank(char c){
        return c == ' ' || c == '\t';
    }

    private final int lineNumber;
    private final String text;
    private final int length;
    private final boolean empty;
    private final boolean comment;
    private final int trailingWhitespace;
    private final int indentation;
    private final boolean listItem;
    private final boolean colon;
    private final boolean quotes;
    private final boolean braces;
    private final boolean brackets;

    private LineInfo(int lineNumber, String text, int length, boolean empty, boolean comment, int trailingWhitespace, int indentation,
                     boolean listItem, boolean colon, boolean quotes, boolean braces, boolean brackets){
        this.lineNumber = lineNumber;
        this.text = text;
        this.length = length;
        this.empty = empty;
        this.comment = comment;
        this.trailingWhitespace = trailingWhitespace;
        this.indentation = indentation;
        this.listItem = listItem;
        this.colon = colon;
        this.quotes = quotes;
        this.braces = braces;
        this.brackets = brackets;
    }

    public int getLineNumber(){return lineNumber;}
    public String getText(){return text;}

    /**
     * @return the number of characters (code points) on the line, without the line break
     */
    public int getLength(){return length;}
    public boolean isEmpty(){return empty;}
    public boolean isComment(){return comment;}
    public boolean hasTrailingWhitespace(){return trailingWhitespace > 0;}
    public int getTrailingWhitespaceCount(){return trailingWhitespace;}
    public int getIndentation(){return indentation;}
    public boolean isListItem(){return listItem;}
    public boolean hasColon(){return colon;}
    public boolean hasQuotes(){return quotes;}
    public boolean hasBraces(){return braces;}
    public boolean hasBrackets(){return brackets;}

    @Override
    public String toString(){
        return lineNumber + ": " + text;
    }
}

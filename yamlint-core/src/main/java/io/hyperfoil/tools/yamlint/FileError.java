package io.hyperfoil.tools.yamlint;

/**
 * A file that could not be read or written.
 */
public class FileError {

    private final String path;
    private final String message;

    public FileError(String path, String message){
        this.path = path;
        this.message = message;
    }

    public String getPath(){return path;}
    public String getMessage(){return message;}

    @Override
    public String toString(){
        return "Error: " + message + "\n  file: " + path;
    }
}

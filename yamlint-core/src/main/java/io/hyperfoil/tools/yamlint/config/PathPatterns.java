package io.hyperfoil.tools.yamlint.config;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Matches relative paths against ignore patterns.
 * <p>
 * A pattern ending with '/' matches everything under that directory. A pattern with glob characters is matched as a
 * glob against the path and every sub path of it. Other patterns match the exact path, a path ending with "/" plus the
 * pattern, or a file name. Rule level patterns also match any path that contains them.
 */
public class PathPatterns {

    public static final PathPatterns NONE = new PathPatterns(Collections.emptyList(), false);

    /**
     * Patterns for the files yamlint skips entirely.
     */
    public static PathPatterns files(List<String> patterns){
        return new PathPatterns(patterns, false);
    }

    /**
     * Patterns for the files one rule skips.
     */
    public static PathPatterns substrings(List<String> patterns){
        return new PathPatterns(patterns, true);
    }

    /**
     * Splits a multi-line ignore block, dropping blank lines and comments.
     */
    public static List<String> lines(String block){
        List<String> rtrn = new ArrayList<>();
        for(String line : block.split("\\r?\\n")){
            String trimmed = line.trim();
            if(!trimmed.isEmpty() && !trimmed.startsWith("#")){
                rtrn.add(trimmed);
            }
        }
        return rtrn;
    }

    public static String normalize(String path){
        String rtrn = path.replace('\\', '/');
        while(rtrn.startsWith("./")){
            rtrn = rtrn.substring(2);
        }
        return rtrn;
    }

    private static boolean isGlob(String pattern){
        return pattern.indexOf('*') >= 0 || pattern.indexOf('?') >= 0 || pattern.indexOf('[') >= 0 || pattern.indexOf('{') >= 0;
    }

    private final List<String> patterns;
    private final List<PathMatcher> globs;
    private final boolean substring;

    private PathPatterns(List<String> patterns, boolean substring){
        this.patterns = new ArrayList<>();
        this.globs = new ArrayList<>();
        this.substring = substring;
        for(String pattern : patterns){
            String normalized = normalize(pattern.trim());
            if(normalized.isEmpty()){
                continue;
            }
            if(normalized.startsWith("/")){
                normalized = normalized.substring(1);
            }
            if(isGlob(normalized)){
                try {
                    globs.add(FileSystems.getDefault().getPathMatcher("glob:" + normalized));
                } catch (IllegalArgumentException e) {
                    throw new ConfigException("invalid ignore pattern " + pattern + ": " + e.getMessage(), e);
                }
            }else{
                this.patterns.add(normalized);
            }
        }
    }

    public boolean isEmpty(){
        return patterns.isEmpty() && globs.isEmpty();
    }

    public boolean matches(String path){
        if(path == null || isEmpty()){
            return false;
        }
        String normalized = normalize(path);
        for(String pattern : patterns){
            if(pattern.endsWith("/")){
                if(normalized.startsWith(pattern) || normalized.contains("/" + pattern)){
                    return true;
                }
            }else if(normalized.equals(pattern) || normalized.endsWith("/" + pattern) || fileName(normalized).equals(pattern)){
                return true;
            }else if(substring && normalized.contains(pattern)){
                return true;
            }
        }
        if(!globs.isEmpty()){
            Path candidate = Paths.get(normalized);
            for(int i=0; i<candidate.getNameCount(); i++){
                Path sub = candidate.subpath(i, candidate.getNameCount());
                for(PathMatcher glob : globs){
                    if(glob.matches(sub)){
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static String fileName(String path){
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    @Override
    public String toString(){
        return patterns.toString();
    }
}

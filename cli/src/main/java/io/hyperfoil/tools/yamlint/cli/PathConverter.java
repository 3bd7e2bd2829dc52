package io.hyperfoil.tools.yamlint.cli;

import picocli.CommandLine;

import java.nio.file.Path;
import java.nio.file.Paths;

public class PathConverter implements CommandLine.ITypeConverter<Path> {
    @Override
    public Path convert(String value) throws Exception {
        return Paths.get(expand(value));
    }

    static String expand(String value){
        return value.replaceFirst("^~", System.getProperty("user.home").replace("\\", "\\\\").replace("$", "\\$"));
    }
}

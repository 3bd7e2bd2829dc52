package io.hyperfoil.tools.yamlint.analysis;

import org.jboss.logging.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.reader.StreamReader;
import org.yaml.snakeyaml.scanner.Scanner;
import org.yaml.snakeyaml.scanner.ScannerImpl;
import org.yaml.snakeyaml.tokens.Token;

import java.io.StringReader;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs the snakeyaml scanner over the full text.
 * The scanner stops at the first lexical error, the tokens read up to that point are returned.
 */
public class YamlScanner {

    private static final Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private YamlScanner(){}

    public static List<Token> scan(String content){
        if(content == null){
            return Collections.emptyList();
        }
        LoaderOptions options = new LoaderOptions();
        options.setCodePointLimit(Integer.MAX_VALUE);
        List<Token> tokens = new ArrayList<>();
        try {
            Scanner scanner = new ScannerImpl(new StreamReader(new StringReader(content)), options);
            while (scanner.checkToken()) {
                tokens.add(scanner.getToken());
            }
        } catch (YAMLException e) {
            logger.debugf("scanner stopped after %d tokens: %s", tokens.size(), e.getMessage());
        }
        return tokens;
    }
}

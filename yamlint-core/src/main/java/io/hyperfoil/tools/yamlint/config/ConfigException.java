package io.hyperfoil.tools.yamlint.config;

/**
 * Invalid configuration, raised while the configuration is loaded.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message){
        super(message);
    }

    public ConfigException(String message, Throwable cause){
        super(message, cause);
    }
}

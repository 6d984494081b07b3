package com.platform.paas.error;

/**
 * Raised while loading catalog, name-policy or template sources at startup.
 * Always fatal: the process must not start with a half-loaded configuration.
 */
public class ConfigurationException extends ControlPlaneException {
    
    private final String source;
    
    public ConfigurationException(String source, String message) {
        super(ErrorCode.CONFIGURATION_ERROR, String.format("%s: %s", source, message));
        this.source = source;
    }
    
    public ConfigurationException(String source, String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, String.format("%s: %s", source, message), cause);
        this.source = source;
    }
    
    public String getSource() {
        return source;
    }
}

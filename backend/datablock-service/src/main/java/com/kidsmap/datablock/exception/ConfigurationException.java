package com.kidsmap.datablock.exception;

/**
 * 필수 설정 누락. 해당 컴포넌트 기동 시점에만 치명적이다.
 */
public class ConfigurationException extends DataBlockException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public static ConfigurationException missing(String component, String property) {
        return new ConfigurationException(component + " is enabled but '" + property + "' is not configured");
    }
}

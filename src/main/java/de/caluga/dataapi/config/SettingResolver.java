package de.caluga.dataapi.config;

@FunctionalInterface
public interface SettingResolver {
    Object resolveSetting(String name);
}

package com.scenetree.common;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Code takes an {@code IEnvGetter} instead of calling {@link System#getenv(String)}
 * so tests can supply their own values.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Returns the trimmed value, or {@code null} when the variable is unset or blank.
     */
    static String getTrimmedOrNull(IEnvGetter env, String name) {
        String value = env.get(name);
        return (value == null || value.isBlank()) ? null : value.trim();
    }

    static String getStringOr(IEnvGetter env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isEmpty()) ? value : defaultValue;
    }

    /**
     * Only the case-insensitive string "true" is true; unset or blank gives the default.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = getTrimmedOrNull(env, name);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }
}

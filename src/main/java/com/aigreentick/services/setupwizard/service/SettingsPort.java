package com.aigreentick.services.setupwizard.service;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.Optional;

/**
 * Typed access to the scoped key/value settings store.
 *
 * Boolean settings are stored as "Y"/"N". JSON settings are stored
 * serialized; a value that no longer decodes reads as absent.
 */
public interface SettingsPort {

    Optional<String> getString(String scope, String name);

    /**
     * @return true for "Y", false for "N", {@code defaultValue} when absent or unrecognised
     */
    boolean getBool(String scope, String name, boolean defaultValue);

    <T> Optional<T> getJson(String scope, String name, TypeReference<T> type);

    /** Insert or update the value. */
    void set(String scope, String name, String value);

    void setBool(String scope, String name, boolean value);

    void setJson(String scope, String name, Object value);

    void delete(String scope, String name);

    boolean exists(String scope, String name);
}

package com.cardroll.pack;

import com.cardroll.common.exception.ConfigurationException;
import com.cardroll.common.exception.ValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of the configured pack types by name.
 */
public class PackTypeRegistry {

    private final Map<String, PackType> packTypes;

    public PackTypeRegistry(Collection<PackType> packTypes) {
        if (packTypes.isEmpty()) {
            throw new ConfigurationException("At least one pack type must be configured");
        }
        Map<String, PackType> byName = new LinkedHashMap<>();
        for (PackType packType : packTypes) {
            if (byName.put(packType.getName(), packType) != null) {
                throw new ConfigurationException("Duplicate pack type: " + packType.getName());
            }
        }
        this.packTypes = Collections.unmodifiableMap(byName);
    }

    public Optional<PackType> find(String name) {
        return Optional.ofNullable(name).map(packTypes::get);
    }

    /**
     * @throws ValidationException if no pack type with that name is loaded
     */
    public PackType get(String name) {
        return find(name).orElseThrow(() -> new ValidationException("Unknown pack type: " + name));
    }

    public Collection<PackType> all() {
        return packTypes.values();
    }
}

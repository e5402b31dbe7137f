package com.hanyahunya.sandbox.application.service;

import com.hanyahunya.sandbox.domain.exception.UnknownSandboxTypeException;
import com.hanyahunya.sandbox.domain.model.SandboxType;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sandbox types known to this process, keyed by type id.
 * Built explicitly at startup and shared by reference; safe for concurrent use.
 */
@Slf4j
public class SandboxTypeRegistry {

    private final Map<String, SandboxType> types = new ConcurrentHashMap<>();

    /**
     * Registers a type, overwriting any previous registration under the same id.
     *
     * @return {@code false} when the registration is invalid and was ignored
     */
    public boolean register(SandboxType type) {
        String problem = validate(type);
        if (problem != null) {
            log.warn("Rejected sandbox type registration [{}]: {}", type == null ? null : type.name(), problem);
            return false;
        }

        SandboxType previous = types.put(type.name(), type);
        if (previous == null) {
            log.info("Registered sandbox type [{}] -> {}", type.name(), type.image());
        } else {
            log.info("Overwrote sandbox type [{}]: {} -> {}", type.name(), previous.image(), type.image());
        }
        return true;
    }

    public Optional<SandboxType> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(types.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public SandboxType require(String name) {
        return find(name).orElseThrow(() -> new UnknownSandboxTypeException(name));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public List<SandboxType> all() {
        return types.values().stream()
                .sorted(Comparator.comparing(SandboxType::name))
                .toList();
    }

    private String validate(SandboxType type) {
        if (type == null) return "type is null";
        if (type.name() == null || type.name().isBlank()) return "type id is blank";
        if (type.image() == null || type.image().isBlank()) return "image is blank";
        if (type.timeout().isNegative() || type.timeout().isZero()) return "timeout must be positive";
        return null;
    }
}

package io.surfworks.splitforge.core.dtype;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Table of custom scalar types, mapping codes at or above
 * {@link DataType#CUSTOM_BEGIN} to the names code generators print.
 *
 * <p>A registry is an ordinary object: create one per compiler instance (or per
 * test) and hand it to whatever needs it. Entries are never removed or rebound.
 *
 * <h2>Thread safety</h2>
 * <p>Registrations are serialized on the registry's monitor. Lookups do not lock;
 * they read {@link ConcurrentHashMap}s, so a lookup that runs after
 * {@link #register(String)} returned observes the new entry.
 *
 * <p>Example:
 * <pre>{@code
 * DatatypeRegistry registry = new DatatypeRegistry();
 * int posit = registry.register("posit16_t");
 * registry.getTypeName(posit);        // "posit16_t"
 * registry.getTypeCode("posit16_t");  // posit
 * }</pre>
 */
public final class DatatypeRegistry {

    private static final Logger LOG = Logger.getLogger(DatatypeRegistry.class.getName());

    private final Map<Integer, String> namesByCode = new ConcurrentHashMap<>();
    private final Map<String, Integer> codesByName = new ConcurrentHashMap<>();
    private int nextCode = DataType.CUSTOM_BEGIN;

    /**
     * Register a custom type under the next unused code.
     *
     * <p>Registering a name that is already present returns its existing code.
     *
     * @param name the type name emitted verbatim into generated source
     * @return the code bound to {@code name}
     */
    public synchronized int register(String name) {
        requireName(name);
        Integer existing = codesByName.get(name);
        if (existing != null) {
            return existing;
        }
        while (namesByCode.containsKey(nextCode)) {
            nextCode++;
        }
        int code = nextCode++;
        bind(name, code);
        return code;
    }

    /**
     * Register a custom type under an explicit code.
     *
     * @param name the type name
     * @param code the code, at least {@link DataType#CUSTOM_BEGIN}
     * @return {@code code}
     * @throws DuplicateTypeNameException if either the name or the code is bound to something else
     */
    public synchronized int register(String name, int code) {
        requireName(name);
        if (code < DataType.CUSTOM_BEGIN) {
            throw new IllegalArgumentException(
                "Custom type codes start at " + DataType.CUSTOM_BEGIN + ", got " + code);
        }
        Integer existingCode = codesByName.get(name);
        if (existingCode != null) {
            if (existingCode == code) {
                return code;
            }
            throw new DuplicateTypeNameException(name, existingCode, code);
        }
        String existingName = namesByCode.get(code);
        if (existingName != null) {
            throw new DuplicateTypeNameException(code, existingName, name);
        }
        bind(name, code);
        return code;
    }

    /**
     * @throws UnknownTypeCodeException if {@code code} has no binding
     */
    public String getTypeName(int code) {
        String name = namesByCode.get(code);
        if (name == null) {
            throw new UnknownTypeCodeException(code);
        }
        return name;
    }

    /**
     * @throws UnknownTypeNameException if {@code name} has no binding
     */
    public int getTypeCode(String name) {
        Integer code = codesByName.get(name);
        if (code == null) {
            throw new UnknownTypeNameException(name);
        }
        return code;
    }

    public boolean isRegistered(int code) {
        return namesByCode.containsKey(code);
    }

    public boolean isRegistered(String name) {
        return codesByName.containsKey(name);
    }

    /**
     * Build a {@link DataType.Custom} for a registered name.
     */
    public DataType customType(String name, int bits, int lanes) {
        return new DataType.Custom(getTypeCode(name), bits, lanes);
    }

    /**
     * Snapshot of all entries, ordered by code.
     */
    public Map<Integer, String> entries() {
        return new LinkedHashMap<>(new TreeMap<>(namesByCode));
    }

    public int size() {
        return namesByCode.size();
    }

    private void bind(String name, int code) {
        // name first: a reader resolving the code must be able to resolve the name back
        codesByName.put(name, code);
        namesByCode.put(code, name);
        LOG.fine("Registered custom type '" + name + "' as code " + code);
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Custom type name must not be blank");
        }
    }
}

package com.flowcraft.core.io;

import java.util.function.Supplier;

/**
 * Available canonical text backends.
 *
 * <p>
 * The default is read from the {@value #PROPERTY} system property
 * ({@code yaml} or {@code plain}); {@code yaml} when unset.
 */
public enum SerializerBackend {
    YAML(YamlFlowSerializer::new),
    PLAIN(PlainFlowSerializer::new);

    public static final String PROPERTY = "flowcraft.serializer";

    private final Supplier<FlowSerializer> factory;

    SerializerBackend(Supplier<FlowSerializer> factory) {
        this.factory = factory;
    }

    public FlowSerializer create() {
        return factory.get();
    }

    public static SerializerBackend configured() {
        String value = System.getProperty(PROPERTY);
        return value == null || value.isBlank() ? YAML : fromString(value.trim());
    }

    public static SerializerBackend fromString(String text) {
        for (SerializerBackend b : SerializerBackend.values()) {
            if (b.name().equalsIgnoreCase(text)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown SerializerBackend: " + text);
    }
}

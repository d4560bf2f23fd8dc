package com.pipedef.publisher.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLClassLoader;
import java.util.List;
import java.util.Objects;

/**
 * Every type declared by a loaded module, in the module's enumeration order. Owns the module's classloader,
 * which stays open until the catalog is closed at the end of the run.
 */
public final class TypeCatalog implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TypeCatalog.class);

    private final String source;
    private final List<Class<?>> types;
    private final URLClassLoader classLoader;

    TypeCatalog(String source, List<Class<?>> types, URLClassLoader classLoader) {
        this.source = Objects.requireNonNull(source, "source");
        this.types = List.copyOf(types);
        this.classLoader = classLoader;
    }

    /** Catalog over types that are already loaded (e.g. definitions on the publisher's own classpath). */
    public static TypeCatalog of(String source, List<Class<?>> types) {
        return new TypeCatalog(source, types, null);
    }

    /** Where the types came from; the module path for loaded modules. */
    public String getSource() {
        return source;
    }

    public List<Class<?>> getTypes() {
        return types;
    }

    @Override
    public void close() {
        if (classLoader == null) {
            return;
        }
        try {
            classLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close classloader of module {}: {}", source, e.getMessage());
        }
    }
}

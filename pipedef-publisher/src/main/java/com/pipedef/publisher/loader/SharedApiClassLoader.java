package com.pipedef.publisher.loader;

import java.util.List;

/**
 * Parent classloader for a definitions module. Exposes only the configured package prefixes from the
 * publisher's own loader; every other class must come from the module JAR or its sibling JARs.
 * Sharing the definitions library keeps {@code DefinitionBase} a single type across the publisher and the module.
 */
public final class SharedApiClassLoader extends ClassLoader {

    private final ClassLoader publisherLoader;
    private final List<String> sharedPrefixes;

    /**
     * @param publisherLoader loader that owns the shared classes
     * @param sharedPrefixes  package prefixes (e.g. {@code "com.fasterxml.jackson."}) delegated to {@code publisherLoader}
     */
    public SharedApiClassLoader(ClassLoader publisherLoader, List<String> sharedPrefixes) {
        super(null);
        this.publisherLoader = publisherLoader;
        this.sharedPrefixes = List.copyOf(sharedPrefixes);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (!isShared(name)) {
                    throw new ClassNotFoundException(name + " is not shared with definitions modules");
                }
                c = publisherLoader.loadClass(name);
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    boolean isShared(String name) {
        for (String prefix : sharedPrefixes) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}

package com.pipedef.publisher.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

/**
 * Loads a compiled definitions module (a JAR) and returns a {@link TypeCatalog} of every class it declares.
 * <p>
 * Only the module's own directory is searched for dependencies: every {@code *.jar} next to the module is
 * put on the module classloader, and each {@link ModuleLoaderConfig#getRequiredArtifacts() required artifact}
 * must be among them. Classes in {@link ModuleLoaderConfig#getSharedPackages() shared packages} come from the
 * publisher's classloader through {@link SharedApiClassLoader}.
 * <p>
 * One loader instance loads one module; a second {@link #load(Path)} call is rejected.
 */
public final class DefinitionModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionModuleLoader.class);

    private static final String JAR_SUFFIX = ".jar";
    private static final String CLASS_SUFFIX = ".class";

    private final ModuleLoaderConfig config;
    private final AtomicBoolean used = new AtomicBoolean();

    public DefinitionModuleLoader(ModuleLoaderConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Loads the module at {@code modulePath}.
     *
     * @throws ModuleLoadException   when the module is missing or unreadable, a required artifact is missing,
     *                               or a declared class cannot be linked
     * @throws IllegalStateException when this loader has already loaded a module
     */
    public TypeCatalog load(Path modulePath) {
        Objects.requireNonNull(modulePath, "modulePath");
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("DefinitionModuleLoader already loaded a module; create a new loader per run");
        }
        Path module = modulePath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(module)) {
            throw new ModuleLoadException("Definitions module not found: " + module);
        }
        Path directory = module.getParent();
        if (directory == null) {
            throw new ModuleLoadException("Failed to find directory of " + module);
        }

        List<Path> dependencies = listDependencyJars(directory, module);
        for (String required : config.getRequiredArtifacts()) {
            if (dependencies.stream().noneMatch(jar -> jar.getFileName().toString().startsWith(required))) {
                throw new ModuleLoadException("Failed to find dependency " + required + " in " + directory
                        + ". Make sure the directory of the definitions module contains this library.");
            }
        }

        List<String> classNames = readClassNames(module);

        List<URL> urls = new ArrayList<>(dependencies.size() + 1);
        urls.add(toUrl(module));
        for (Path jar : dependencies) {
            urls.add(toUrl(jar));
        }
        ClassLoader parent = new SharedApiClassLoader(config.getPublisherClassLoader(), config.getSharedPackages());
        URLClassLoader loader = new URLClassLoader(urls.toArray(new URL[0]), parent);

        List<Class<?>> types = new ArrayList<>(classNames.size());
        for (String className : classNames) {
            try {
                types.add(Class.forName(className, false, loader));
            } catch (ClassNotFoundException | LinkageError e) {
                closeQuietly(loader);
                throw new ModuleLoadException("Failed to load " + className + " from " + module.getFileName()
                        + ": missing dependency " + e.getMessage(), e);
            }
        }
        log.info("Loaded {} type(s) from {} with {} dependency JAR(s)", types.size(), module, dependencies.size());
        return new TypeCatalog(module.toString(), types, loader);
    }

    private static List<Path> listDependencyJars(Path directory, Path module) {
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + JAR_SUFFIX)) {
            for (Path jar : stream) {
                if (!jar.equals(module) && Files.isRegularFile(jar)) {
                    jars.add(jar);
                }
            }
        } catch (IOException e) {
            throw new ModuleLoadException("Failed to list dependencies in " + directory + ": " + e.getMessage(), e);
        }
        jars.sort(null);
        log.debug("Dependency JARs next to {}: {}", module.getFileName(), jars);
        return jars;
    }

    private static List<String> readClassNames(Path module) {
        List<String> names = new ArrayList<>();
        try (JarFile jar = new JarFile(module.toFile())) {
            Enumeration<JarEntry> entries = jar.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();
                if (entry.isDirectory() || !name.endsWith(CLASS_SUFFIX)
                        || name.startsWith("META-INF/")
                        || name.endsWith("module-info.class")
                        || name.endsWith("package-info.class")) {
                    continue;
                }
                names.add(name.substring(0, name.length() - CLASS_SUFFIX.length()).replace('/', '.'));
            }
        } catch (IOException e) {
            throw new ModuleLoadException("Failed to read definitions module " + module + ": " + e.getMessage(), e);
        }
        return names;
    }

    private static URL toUrl(Path path) {
        try {
            return path.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new ModuleLoadException("Invalid path " + path, e);
        }
    }

    private static void closeQuietly(URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            log.debug("Failed to close module classloader: {}", e.getMessage());
        }
    }
}

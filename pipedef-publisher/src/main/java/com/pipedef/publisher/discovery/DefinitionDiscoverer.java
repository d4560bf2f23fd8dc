package com.pipedef.publisher.discovery;

import com.pipedef.definitions.DefinitionBase;
import com.pipedef.publisher.loader.TypeCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Finds every definition type in a {@link TypeCatalog} and instantiates one of each through its no-arg
 * constructor, which need not be public. Results keep the catalog's order.
 */
public final class DefinitionDiscoverer {

    private static final Logger log = LoggerFactory.getLogger(DefinitionDiscoverer.class);

    private final DefinitionTypePredicate predicate;

    /** Discovers subclasses of {@link DefinitionBase}. */
    public DefinitionDiscoverer() {
        this(DefinitionTypePredicate.forContract(DefinitionBase.class));
    }

    public DefinitionDiscoverer(DefinitionTypePredicate predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    public String getContractTypeName() {
        return predicate.getContractTypeName();
    }

    /**
     * @throws DefinitionInstantiationException when a definition type cannot be instantiated
     */
    public List<DefinitionDescriptor> discover(TypeCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog");
        List<DefinitionDescriptor> definitions = new ArrayList<>();
        for (Class<?> type : catalog.getTypes()) {
            if (!predicate.test(type)) {
                continue;
            }
            Object instance = instantiate(type);
            DefinitionDescriptor descriptor = describe(instance);
            log.debug("Discovered definition {} ({})", type.getName(), descriptor.getClass().getSimpleName());
            definitions.add(descriptor);
        }
        log.info("Discovered {} definition(s) deriving from {} in {}",
                definitions.size(), predicate.getContractTypeName(), catalog.getSource());
        return definitions;
    }

    static Object instantiate(Class<?> type) {
        Constructor<?> constructor;
        try {
            constructor = type.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new DefinitionInstantiationException(type.getName(),
                    "Failed to instantiate " + type.getName() + ": no no-argument constructor", e);
        }
        // package-private definition classes get a package-private default constructor
        if (!constructor.trySetAccessible()) {
            throw new DefinitionInstantiationException(type.getName(),
                    "Failed to instantiate " + type.getName() + ": no-argument constructor is not accessible", null);
        }
        try {
            return constructor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DefinitionInstantiationException(type.getName(),
                    "Failed to instantiate " + type.getName() + ": constructor threw " + cause, cause);
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new DefinitionInstantiationException(type.getName(),
                    "Failed to instantiate " + type.getName() + ": " + e, e);
        }
    }

    static DefinitionDescriptor describe(Object instance) {
        if (instance instanceof DefinitionBase) {
            return new DirectDefinitionDescriptor((DefinitionBase) instance);
        }
        return new ReflectiveDefinitionDescriptor(instance);
    }
}

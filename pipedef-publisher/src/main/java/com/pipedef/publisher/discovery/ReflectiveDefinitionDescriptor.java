package com.pipedef.publisher.discovery;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Objects;

/**
 * Descriptor for a definition whose contract type was loaded by a different classloader than the publisher's,
 * so it cannot be cast to {@code DefinitionBase}. Methods are looked up by name and invoked reflectively;
 * exceptions thrown by the definition are rethrown unwrapped.
 */
public final class ReflectiveDefinitionDescriptor implements DefinitionDescriptor {

    static final String GET_TARGET_PATH = "getTargetPath";
    static final String VALIDATE = "validate";
    static final String PUBLISH = "publish";

    private final Object definition;
    private final Method getTargetPath;
    private final Method validate;
    private final Method publish;

    public ReflectiveDefinitionDescriptor(Object definition) {
        this.definition = Objects.requireNonNull(definition, "definition");
        Class<?> type = definition.getClass();
        this.getTargetPath = findMethod(type, GET_TARGET_PATH);
        this.validate = findMethod(type, VALIDATE);
        this.publish = findMethod(type, PUBLISH);
    }

    @Override
    public String getName() {
        return definition.getClass().getSimpleName();
    }

    @Override
    public String getQualifiedName() {
        return definition.getClass().getName();
    }

    @Override
    public String getTargetPath() {
        Object path = invoke(getTargetPath, GET_TARGET_PATH);
        if (path != null && !(path instanceof String)) {
            throw new DefinitionInvocationException(GET_TARGET_PATH + " of " + getQualifiedName()
                    + " returned " + path.getClass().getName() + " instead of a String");
        }
        return (String) path;
    }

    @Override
    public void validate() {
        invoke(validate, VALIDATE);
    }

    @Override
    public void publish() throws IOException {
        try {
            invokeChecked(publish, PUBLISH);
        } catch (IOException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DefinitionInvocationException(PUBLISH + " of " + getQualifiedName() + " failed: " + e.getMessage(), e);
        }
    }

    private Object invoke(Method method, String name) {
        try {
            return invokeChecked(method, name);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new DefinitionInvocationException(name + " of " + getQualifiedName() + " failed: " + e.getMessage(), e);
        }
    }

    private Object invokeChecked(Method method, String name) throws Exception {
        if (method == null) {
            throw new DefinitionInvocationException("Failed to get pipeline definition metadata for "
                    + getQualifiedName() + ": no public method " + name + "()");
        }
        try {
            return method.invoke(definition);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new DefinitionInvocationException(name + " of " + getQualifiedName() + " failed", e);
        } catch (IllegalAccessException e) {
            throw new DefinitionInvocationException("Cannot access " + name + "() of " + getQualifiedName(), e);
        }
    }

    /** Public no-arg method named {@code name}, or null when the type has none. */
    private static Method findMethod(Class<?> type, String name) {
        for (Method method : type.getMethods()) {
            if (method.getName().equals(name) && method.getParameterCount() == 0) {
                method.trySetAccessible();
                return method;
            }
        }
        return null;
    }
}

package com.pipedef.publisher.discovery;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides whether a type is a definition: a concrete class that has the contract type among its ancestors,
 * at any depth, through superclasses or interfaces.
 * <p>
 * Ancestors are matched by fully-qualified name, not by {@code Class} identity: the contract type seen by a
 * module may have been loaded by another classloader than the publisher's copy.
 */
public final class DefinitionTypePredicate implements Predicate<Class<?>> {

    private final String contractTypeName;

    public DefinitionTypePredicate(String contractTypeName) {
        this.contractTypeName = Objects.requireNonNull(contractTypeName, "contractTypeName");
    }

    public static DefinitionTypePredicate forContract(Class<?> contractType) {
        return new DefinitionTypePredicate(contractType.getName());
    }

    public String getContractTypeName() {
        return contractTypeName;
    }

    @Override
    public boolean test(Class<?> type) {
        return isConcrete(type) && hasContractAncestor(type);
    }

    static boolean isConcrete(Class<?> type) {
        if (type == null || type.isInterface() || type.isAnnotation() || type.isEnum()
                || type.isArray() || type.isPrimitive()) {
            return false;
        }
        if (type.isAnonymousClass() || type.isLocalClass() || type.isSynthetic()) {
            return false;
        }
        return !Modifier.isAbstract(type.getModifiers());
    }

    private boolean hasContractAncestor(Class<?> type) {
        Deque<Class<?>> pending = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        pushSupertypes(type, pending);
        while (!pending.isEmpty()) {
            Class<?> ancestor = pending.pop();
            if (!seen.add(ancestor)) {
                continue;
            }
            if (contractTypeName.equals(ancestor.getName())) {
                return true;
            }
            pushSupertypes(ancestor, pending);
        }
        return false;
    }

    private static void pushSupertypes(Class<?> type, Deque<Class<?>> pending) {
        Class<?> superclass = type.getSuperclass();
        if (superclass != null) {
            pending.push(superclass);
        }
        for (Class<?> iface : type.getInterfaces()) {
            pending.push(iface);
        }
    }
}

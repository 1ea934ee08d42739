package io.github.cyfko.fuzzycast.jpa.utils;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reflection helpers for entity classes.
 */
public final class ReflectionUtils {

    private ReflectionUtils() {
        throw new UnsupportedOperationException("ReflectionUtils is a utility class and cannot be instantiated");
    }

    /**
     * Lists the instance field names of a class in declaration order, superclass fields first.
     * <p>
     * {@link Class#getDeclaredFields()} follows source order on HotSpot and the other mainstream
     * JVMs, which is the order an entity's attributes are searched in.
     * </p>
     *
     * @param type the class to inspect
     * @return the names of all non-static, non-synthetic fields up to {@link Object}
     */
    public static List<String> declaredFieldNames(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }

        List<String> names = new ArrayList<>();
        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                    continue;
                }
                if (!names.contains(field.getName())) {
                    names.add(field.getName());
                }
            }
        }
        return names;
    }
}

package de.caluga.dataapi;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * field lookup for commands and settings, results are cached per class
 */
public class ReflectionHelper {
    private static final Map<Class<?>, List<Field>> fieldListCache = new ConcurrentHashMap<>();

    private ReflectionHelper() {
    }

    /**
     * all non static fields of the class hierarchy, subclass fields first
     */
    public static List<Field> getAllFields(Class<?> clz) {
        if (clz == null || Map.class.isAssignableFrom(clz)) return new ArrayList<>();

        return fieldListCache.computeIfAbsent(clz, c -> {
            List<Field> ret = new ArrayList<>();
            Class<?> sc = c;

            while (sc != null && !sc.equals(Object.class)) {
                for (Field declaredField : sc.getDeclaredFields()) {
                    if (Modifier.isStatic(declaredField.getModifiers())) continue;
                    if (declaredField.getName().startsWith("$jacoco")) continue;
                    declaredField.setAccessible(true);
                    ret.add(declaredField);
                }

                sc = sc.getSuperclass();
            }

            return ret;
        });
    }
}

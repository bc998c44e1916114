package de.caluga.dataapi.config;

import de.caluga.dataapi.ReflectionHelper;
import de.caluga.dataapi.annotations.Transient;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * base of all settings groups. Fields are exported to / read from properties by their name,
 * fields marked {@link Transient} are skipped.
 */
public abstract class Settings {

    public Properties asProperties() {
        return asProperties(null);
    }

    /**
     * only values differing from the defaults are exported
     */
    public Properties asProperties(String prefix) {
        Properties p = new Properties();

        try {
            if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";
            var defaults = this.getClass().getConstructor().newInstance();

            for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
                if (f.isAnnotationPresent(Transient.class)) {
                    continue;
                }

                Object v = f.get(this);

                if (v != null && !v.equals(f.get(defaults))) {
                    p.put(prefix + f.getName(), v.toString());
                }
            }
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to export settings " + this.getClass().getName(), e);
        }

        return p;
    }

    public void applyProperties(String prefix, SettingResolver resolver) {
        if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";

        for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
            if (f.isAnnotationPresent(Transient.class)) continue;
            Object setting = resolver.resolveSetting(prefix + f.getName());

            if (setting == null) {
                continue;
            }

            String s = setting.toString().trim();

            try {
                if (f.getType().equals(int.class) || f.getType().equals(Integer.class)) {
                    f.set(this, Integer.parseInt(s));
                } else if (f.getType().equals(long.class) || f.getType().equals(Long.class)) {
                    f.set(this, Long.parseLong(s));
                } else if (f.getType().equals(boolean.class) || f.getType().equals(Boolean.class)) {
                    f.set(this, s.equals("true"));
                } else if (f.getType().isEnum()) {
                    @SuppressWarnings({"unchecked", "rawtypes"})
                    Enum value = Enum.valueOf((Class<? extends Enum>) f.getType(), s);
                    f.set(this, value);
                } else if (f.getType().equals(String.class)) {
                    f.set(this, s);
                } else if (List.class.isAssignableFrom(f.getType())) {
                    List<String> ret = new ArrayList<>();
                    List<String> l = new ArrayList<>();
                    Collections.addAll(l, s.replaceAll("[\\[\\]]", "").split(","));

                    for (String n : l) {
                        if (!n.isBlank()) ret.add(n.trim());
                    }

                    f.set(this, ret);
                }
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value '" + s + "' for setting " + prefix + f.getName(), e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copy() {
        try {
            T ret = (T) this.getClass().getConstructor().newInstance();

            for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
                Object v = f.get(this);

                if (v instanceof List) {
                    f.set(ret, new ArrayList<>((List<?>) v));
                } else if (v instanceof Map) {
                    f.set(ret, copyMap((Map<?, ?>) v));
                } else {
                    f.set(ret, v);
                }
            }

            return ret;
        } catch (ReflectiveOperationException e) {
            throw new RuntimeException("Failed to copy settings for " + this.getClass().getName(), e);
        }
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object copyMap(Map<?, ?> m) {
        if (m instanceof EnumMap) {
            EnumMap ret = new EnumMap((EnumMap) m);
            ret.replaceAll((k, v) -> v instanceof Set ? copySet((Set) v) : v);
            return ret;
        }

        return new LinkedHashMap<>(m);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Set copySet(Set s) {
        if (s instanceof EnumSet) return EnumSet.copyOf((EnumSet) s);
        return new LinkedHashSet(s);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null) return false;
        if (getClass() != other.getClass()) return false;

        for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
            try {
                if (!Objects.equals(f.get(this), f.get(other))) return false;
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;

        for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
            try {
                result = 31 * result + Objects.hashCode(f.get(this));
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        return result;
    }
}

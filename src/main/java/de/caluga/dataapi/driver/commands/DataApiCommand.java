package de.caluga.dataapi.driver.commands;

import de.caluga.dataapi.ReflectionHelper;
import de.caluga.dataapi.annotations.CommandOption;
import de.caluga.dataapi.annotations.Transient;
import de.caluga.dataapi.driver.Doc;

import java.lang.reflect.Field;
import java.util.Map;

/**
 * Base of all commands. A command is sent as <code>{commandName: {field: value, ..., options: {...}}}</code>,
 * fields marked {@link CommandOption} end up in <code>options</code>, null fields are left out.
 *
 * @param <T> the command type, for fluent setters
 */
@SuppressWarnings("unchecked")
public abstract class DataApiCommand<T extends DataApiCommand<T>> {
    @Transient
    private String keyspace;
    @Transient
    private String collection;

    public abstract String getCommandName();

    public String getKeyspace() {
        return keyspace;
    }

    /**
     * null for the default keyspace of the client
     */
    public T setKeyspace(String keyspace) {
        this.keyspace = keyspace;
        return (T) this;
    }

    public String getCollection() {
        return collection;
    }

    /**
     * null for keyspace level commands
     */
    public T setCollection(String collection) {
        this.collection = collection;
        return (T) this;
    }

    public Map<String, Object> asMap() {
        Doc payload = new Doc();
        Doc options = new Doc();

        for (Field f : ReflectionHelper.getAllFields(this.getClass())) {
            if (f.isAnnotationPresent(Transient.class)) continue;

            try {
                Object v = f.get(this);
                if (v == null) continue;

                if (v instanceof Enum) {
                    v = v.toString();
                }

                CommandOption opt = f.getAnnotation(CommandOption.class);

                if (opt != null) {
                    options.put(opt.value().isEmpty() ? f.getName() : opt.value(), v);
                } else {
                    payload.put(f.getName(), v);
                }
            } catch (IllegalAccessException e) {
                throw new RuntimeException("Cannot read field " + f.getName() + " of " + getClass().getSimpleName(), e);
            }
        }

        if (!options.isEmpty()) {
            payload.put("options", options);
        }

        return Doc.of(getCommandName(), payload);
    }

    @Override
    public String toString() {
        return getCommandName() + " " + asMap().get(getCommandName());
    }
}

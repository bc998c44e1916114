package de.caluga.dataapi.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * command field that belongs into the nested <code>options</code> object of a command payload
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface CommandOption {
    /**
     * wire name, defaults to the field name
     */
    String value() default "";
}

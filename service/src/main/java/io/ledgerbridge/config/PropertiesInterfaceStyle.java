package io.ledgerbridge.config;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.immutables.value.Value;

/**
 * Style for configuration properties: an interface named FooInterface generates a mutable Foo
 * that spring can bind properties onto.
 */
@Target({ElementType.PACKAGE, ElementType.TYPE})
@Retention(RetentionPolicy.CLASS)
@Value.Style(
    typeAbstract = "*Interface",
    typeModifiable = "*",
    get = {"get*", "is*"},
    set = "set*",
    create = "create")
public @interface PropertiesInterfaceStyle {}

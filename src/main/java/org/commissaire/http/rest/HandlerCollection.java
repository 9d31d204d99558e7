package org.commissaire.http.rest;

/**
 * A named group of handlers contributed to the {@link HandlerRegistry}.
 *
 * Collections declare their members explicitly in {@link #describe}. Function
 * members are registered as {@code <name>.<member>}; methods of a handler type
 * as {@code <name>.<TypeName>.<method>}.
 */
public interface HandlerCollection {

    String name();

    /**
     * Adds this collection's members to {@code table}. Called again on every
     * registry reload; anything thrown drops the whole collection for that pass.
     */
    void describe(HandlerTable table);
}

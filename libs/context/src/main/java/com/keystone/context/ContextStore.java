package com.keystone.context;

import com.keystone.endpoint.Context;
import com.keystone.endpoint.ContextMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Named contexts plus the name of the current one.
 * <p>
 * A saved context is stored as a whole; implementations need not support partial writes.
 */
public interface ContextStore {

    Optional<Context> load(String name);

    /** Stores (or replaces) the context under the given name. */
    void save(String name, Context context);

    /**
     * Deletes a context. The current context name is cleared if it pointed to it.
     *
     * @throws ContextNotFoundException if no context has the name
     */
    void unset(String name);

    /**
     * Renames a context. The current context name follows the rename.
     *
     * @throws ContextNotFoundException      if {@code oldName} does not exist
     * @throws ContextAlreadyExistsException if {@code newName} is taken
     */
    void rename(String oldName, String newName);

    /** All contexts in insertion order, flagging the current one. */
    List<ContextMetadata> list();

    Optional<String> currentContextName();

    void setCurrentContextName(String name);

    default Optional<Context> currentContext() {
        return currentContextName().flatMap(this::load);
    }

    default boolean contains(String name) {
        return load(name).isPresent();
    }
}

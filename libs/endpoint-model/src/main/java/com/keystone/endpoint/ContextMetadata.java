package com.keystone.endpoint;

/**
 * Listing entry for a stored context.
 *
 * @param name     context name
 * @param selected true if this is the current context
 */
public record ContextMetadata(String name, boolean selected) {}

package de.t14d3.kvstore.mapping;

import java.util.Map;

/**
 * Implemented by entities and embeddables that keep record attributes not covered by
 * their declared fields.
 * <p>
 * Hydration puts every undeclared key of a stored record into this map, and snapshots
 * merge it back in without overriding declared fields. The returned map must be mutable
 * and must be the same instance on every call.
 */
public interface ExtraAttributes {

    Map<String, Object> getExtraAttributes();
}

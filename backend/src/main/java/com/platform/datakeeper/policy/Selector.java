package com.platform.datakeeper.policy;

import java.util.Set;

/**
 * Which data units a policy governs.
 * 
 * A unit matches when its type is in {@code dataTypes}, it carries at least one of
 * {@code tags} (an empty tag set matches every unit) and its path lies under one of {@code paths}.
 */
public record Selector(
    Set<String> dataTypes,
    Set<String> tags,
    Set<String> paths
) {
    
    public Selector {
        dataTypes = dataTypes == null ? Set.of() : Set.copyOf(dataTypes);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        paths = paths == null ? Set.of() : Set.copyOf(paths);
    }
}

package com.platform.datakeeper.policy;

import com.platform.datakeeper.data.DataUnit;

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides which policies govern which data units. Stateless and free of I/O.
 */
public final class SelectorMatcher {
    
    private SelectorMatcher() {
    }
    
    /**
     * A unit matches when its type is selected, it carries at least one selected tag
     * (no tags selects every unit) and its path is under one of the selected paths.
     */
    public static boolean matches(Selector selector, DataUnit unit) {
        if (unit.dataType() == null || !selector.dataTypes().contains(unit.dataType().toLowerCase(Locale.ROOT))) {
            return false;
        }
        
        if (!selector.tags().isEmpty()) {
            boolean tagged = false;
            for (String tag : unit.tags()) {
                if (selector.tags().contains(tag)) {
                    tagged = true;
                    break;
                }
            }
            if (!tagged) {
                return false;
            }
        }
        
        for (String root : selector.paths()) {
            if (isUnder(unit.path(), DataUnit.normalize(root))) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * For each policy, in iteration order, the units it governs in their original order.
     * Policies that match nothing map to an empty list.
     */
    public static Map<String, List<DataUnit>> findApplicable(Collection<DataUnit> units, Collection<Policy> policies) {
        Map<String, List<DataUnit>> result = new LinkedHashMap<>();
        for (Policy policy : policies) {
            List<DataUnit> matched = new ArrayList<>();
            for (DataUnit unit : units) {
                if (matches(policy.getSelector(), unit)) {
                    matched.add(unit);
                }
            }
            result.put(policy.getId(), matched);
        }
        return result;
    }
    
    private static boolean isUnder(String path, String root) {
        if (path.equals(root)) {
            return true;
        }
        String prefix = root.endsWith(File.separator) ? root : root + File.separator;
        return path.startsWith(prefix);
    }
}

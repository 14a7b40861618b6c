package com.platform.datakeeper.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Channel selection expressions used by {@code apply_to_channels} and ROI actions.
 * 
 * Accepted forms: {@code all}, an inclusive range {@code i..j} or {@code i-j},
 * a comma separated list of indices and ranges ({@code 1,3,8..10}), or
 * {@code metadata.<key>} naming a unit attribute that holds one of the former.
 */
public final class ChannelSelection {
    
    public static final String ALL = "all";
    
    private static final String METADATA_PREFIX = "metadata.";
    private static final Pattern RANGE = Pattern.compile("^(\\d+)\\s*(?:\\.\\.|-)\\s*(\\d+)$");
    private static final Pattern INDEX = Pattern.compile("^\\d+$");
    
    private ChannelSelection() {
    }
    
    /**
     * Checks the expression shape without resolving it.
     *
     * @throws IllegalArgumentException when malformed
     */
    public static void validate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("channel selection is empty");
        }
        String trimmed = expression.trim();
        if (ALL.equalsIgnoreCase(trimmed)) {
            return;
        }
        if (trimmed.startsWith(METADATA_PREFIX)) {
            if (trimmed.length() == METADATA_PREFIX.length()) {
                throw new IllegalArgumentException("metadata key missing in '" + expression + "'");
            }
            return;
        }
        parseList(trimmed, Integer.MAX_VALUE);
    }
    
    /**
     * Resolves the expression to sorted, distinct channel indices below {@code channelCount}.
     *
     * @throws IllegalArgumentException when malformed, unresolvable or out of range
     */
    public static int[] resolve(String expression, Map<String, ?> attributes, int channelCount) {
        String trimmed = expression == null ? ALL : expression.trim();
        
        if (trimmed.startsWith(METADATA_PREFIX)) {
            String key = trimmed.substring(METADATA_PREFIX.length());
            Object value = attributes.get(key);
            if (value == null) {
                throw new IllegalArgumentException("unit attribute '" + key + "' not present");
            }
            trimmed = value instanceof List<?> list ? joinList(list) : value.toString().trim();
        }
        
        if (ALL.equalsIgnoreCase(trimmed)) {
            int[] all = new int[channelCount];
            for (int i = 0; i < channelCount; i++) {
                all[i] = i;
            }
            return all;
        }
        
        return parseList(trimmed, channelCount);
    }
    
    private static int[] parseList(String text, int channelCount) {
        String stripped = text.replaceAll("^[\\[(]|[\\])]$", "");
        TreeSet<Integer> channels = new TreeSet<>();
        
        for (String token : stripped.split(",")) {
            String part = token.trim();
            Matcher range = RANGE.matcher(part);
            if (range.matches()) {
                int from = Integer.parseInt(range.group(1));
                int to = Integer.parseInt(range.group(2));
                if (from > to) {
                    throw new IllegalArgumentException("descending channel range '" + part + "'");
                }
                for (int i = from; i <= to; i++) {
                    channels.add(checkBound(i, channelCount));
                }
            } else if (INDEX.matcher(part).matches()) {
                channels.add(checkBound(Integer.parseInt(part), channelCount));
            } else {
                throw new IllegalArgumentException("invalid channel selection '" + text + "'");
            }
        }
        
        return channels.stream().mapToInt(Integer::intValue).toArray();
    }
    
    private static int checkBound(int channel, int channelCount) {
        if (channel >= channelCount) {
            throw new IllegalArgumentException(
                "channel " + channel + " out of range (unit has " + channelCount + " channels)");
        }
        return channel;
    }
    
    private static String joinList(List<?> list) {
        List<String> parts = new ArrayList<>(list.size());
        for (Object item : list) {
            parts.add(String.valueOf(item));
        }
        return String.join(",", parts);
    }
}

package com.platform.datakeeper.policy;

import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ResourceNotFoundException;
import com.platform.datakeeper.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Holds the active policy set as an immutable {@link Snapshot}.
 * 
 * A load either replaces the whole snapshot or, on any validation error, leaves the
 * previous one in place. Policy ids survive reloads: a policy keeps the id of the
 * previously loaded or stored policy with the same name.
 */
@Slf4j
@Service
public class PolicyRegistry {
    
    private final PolicyDocumentParser parser;
    private final PolicyRepository policyRepository;
    private final DataKeeperProperties properties;
    private final Clock clock;
    
    private volatile Snapshot snapshot = Snapshot.EMPTY;
    private FileTime lastSeenModified;
    
    public PolicyRegistry(
            PolicyDocumentParser parser,
            PolicyRepository policyRepository,
            DataKeeperProperties properties,
            Clock clock) {
        this.parser = parser;
        this.policyRepository = policyRepository;
        this.properties = properties;
        this.clock = clock;
    }
    
    /**
     * Parses and installs a policy document.
     *
     * @throws ValidationException if anything in the document is malformed; nothing changes then
     */
    public synchronized List<Policy> load(String content, String source) {
        PolicyDocument document = parser.parse(content, source);
        Instant now = clock.instant();
        
        Map<String, Policy> byName = new LinkedHashMap<>();
        for (Policy current : snapshot.policies()) {
            byName.put(current.getName(), current);
        }
        
        List<Policy> loaded = new ArrayList<>(document.policies().size());
        for (Policy parsed : document.policies()) {
            Policy previous = byName.get(parsed.getName());
            if (previous == null) {
                previous = policyRepository.findByName(parsed.getName()).orElse(null);
            }
            loaded.add(parsed.toBuilder()
                .id(previous != null ? previous.getId() : newId(parsed.getName()))
                .createdAt(previous != null && previous.getCreatedAt() != null ? previous.getCreatedAt() : now)
                .updatedAt(now)
                .build());
        }
        
        Set<String> activeIds = new HashSet<>();
        loaded.forEach(p -> activeIds.add(p.getId()));
        List<String> retired = policyRepository.findAllIds().stream()
            .filter(id -> !activeIds.contains(id))
            .toList();
        
        policyRepository.replaceAll(loaded, retired);
        snapshot = new Snapshot(List.copyOf(loaded), document.settings(), now, source);
        
        log.info("Loaded {} policies from {} ({} enabled, {} retired)", 
            loaded.size(), source, loaded.stream().filter(Policy::isEnabled).count(), retired.size());
        return snapshot.policies();
    }
    
    /**
     * Loads the configured policy file.
     */
    public List<Policy> loadConfigured() {
        Path path = policyPath();
        synchronized (this) {
            lastSeenModified = modifiedTime(path);
            return load(read(path), path.toString());
        }
    }
    
    /**
     * Reloads the configured file if its modification time changed since the last look.
     * A document that fails validation is reported once and the current snapshot stays.
     *
     * @return true if a new snapshot was installed
     */
    public synchronized boolean reloadIfChanged() {
        Path path = policyPath();
        if (!Files.exists(path)) {
            return false;
        }
        FileTime modified = modifiedTime(path);
        if (modified.equals(lastSeenModified)) {
            return false;
        }
        lastSeenModified = modified;
        
        log.info("Policy file {} changed, reloading", path);
        try {
            load(read(path), path.toString());
            return true;
        } catch (ValidationException e) {
            log.error("Policy reload rejected, keeping previous policies: {} (field: {})", 
                e.getMessage(), e.getField());
            return false;
        }
    }
    
    public Policy get(String id) {
        Policy policy = snapshot.byId().get(id);
        if (policy == null) {
            throw ResourceNotFoundException.policy(id);
        }
        return policy;
    }
    
    /**
     * Enabled policies of the current snapshot, in declaration order.
     */
    public List<Policy> allEnabled() {
        return snapshot.policies().stream()
            .filter(Policy::isEnabled)
            .toList();
    }
    
    public Snapshot snapshot() {
        return snapshot;
    }
    
    /**
     * Removes a policy from the active set and from storage, together with its jobs.
     */
    public synchronized void delete(String id) {
        Policy policy = get(id);
        policyRepository.deleteById(id);
        
        List<Policy> remaining = snapshot.policies().stream()
            .filter(p -> !p.getId().equals(id))
            .toList();
        snapshot = new Snapshot(remaining, snapshot.settings(), snapshot.loadedAt(), snapshot.source());
        log.info("[AUDIT] Policy '{}' ({}) deleted with its jobs", policy.getName(), id);
    }
    
    private Path policyPath() {
        return Path.of(properties.getPolicyPath()).toAbsolutePath().normalize();
    }
    
    private static String read(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ValidationException(ErrorCode.CONFIGURATION_ERROR, "policy_path", path.toString(),
                "cannot read policy file: " + e.getMessage());
        }
    }
    
    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }
    
    private static String newId(String name) {
        String slug = name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        if (slug.length() > 40) {
            slug = slug.substring(0, 40);
        }
        return slug + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
    
    /**
     * Immutable view of the loaded policies; one tick reads exactly one snapshot.
     */
    public record Snapshot(
        List<Policy> policies,
        PolicyDocument.Settings settings,
        Instant loadedAt,
        String source
    ) {
        static final Snapshot EMPTY = new Snapshot(List.of(), PolicyDocument.Settings.EMPTY, null, null);
        
        public Map<String, Policy> byId() {
            Map<String, Policy> index = new LinkedHashMap<>();
            for (Policy policy : policies) {
                index.put(policy.getId(), policy);
            }
            return index;
        }
    }
}

package com.civicgate.capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds every operation descriptor and the set of enabled groups; only operations of
 * enabled groups are visible and callable.
 * <p>
 * Group changes are serialized on a dedicated lock and publish a fresh immutable enabled set,
 * so readers never see a half-applied change. Readers only take the registry monitor, which
 * group changes never hold, so a slow change listener does not stall lookups. The always-on
 * group is enabled from the start and a disable request for it is skipped. The change
 * listener is invoked at most once per mutating call, only when the enabled set actually
 * changed, in the order the changes were applied; a listener failure is logged and does not
 * reach the caller.
 */
public final class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final GroupCatalog catalog;
    private final Map<String, OperationDescriptor> descriptors = new LinkedHashMap<>();
    private final Object changeLock = new Object();
    private volatile Set<String> enabledGroups;
    private volatile CapabilityChangeListener listener;

    public CapabilityRegistry(GroupCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        this.catalog = catalog;
        this.enabledGroups = Set.of(catalog.alwaysOn());
    }

    public GroupCatalog catalog() {
        return catalog;
    }

    /**
     * Sets the single change listener, replacing any previous one.
     */
    public void setChangeListener(CapabilityChangeListener listener) {
        this.listener = listener;
    }

    /**
     * Registers an operation.
     *
     * @throws ConfigurationException       if its group is not in the catalog
     * @throws DuplicateOperationException if the name is already taken
     */
    public synchronized void register(OperationDescriptor descriptor) {
        if (!catalog.contains(descriptor.group())) {
            throw new ConfigurationException("Operation " + descriptor.name()
                    + " names unknown group: " + descriptor.group());
        }
        if (descriptors.putIfAbsent(descriptor.name(), descriptor) != null) {
            throw new DuplicateOperationException(descriptor.name());
        }
    }

    /**
     * Enables the given groups. Unknown ids fail the whole call before anything changes.
     */
    public GroupChange enableGroups(Collection<String> ids) {
        catalog.requireKnown(ids);
        synchronized (changeLock) {
            Set<String> next = new LinkedHashSet<>(enabledGroups);
            GroupChange change = applyEnable(next, ids);
            notifyListener(publish(next, change.changedAnything()));
            return change;
        }
    }

    /**
     * Disables the given groups; the always-on group is skipped. Unknown ids fail the whole
     * call before anything changes.
     */
    public GroupChange disableGroups(Collection<String> ids) {
        catalog.requireKnown(ids);
        synchronized (changeLock) {
            Set<String> next = new LinkedHashSet<>(enabledGroups);
            GroupChange change = applyDisable(next, ids);
            notifyListener(publish(next, change.changedAnything()));
            return change;
        }
    }

    /**
     * Applies an enable list and then a disable list as one change: both lists are checked
     * first and the listener fires at most once.
     */
    public GroupUpdate updateGroups(Collection<String> enable, Collection<String> disable) {
        List<String> all = new ArrayList<>(enable);
        all.addAll(disable);
        catalog.requireKnown(all);

        synchronized (changeLock) {
            Set<String> before = enabledGroups;
            Set<String> next = new LinkedHashSet<>(before);
            GroupChange enabled = enable.isEmpty() ? GroupChange.none() : applyEnable(next, enable);
            GroupChange disabled = disable.isEmpty() ? GroupChange.none() : applyDisable(next, disable);
            notifyListener(publish(next, !next.equals(before)));
            return new GroupUpdate(enabled, disabled, catalog.inCatalogOrder(next));
        }
    }

    /**
     * Enables every group of the catalog.
     */
    public GroupChange enableAll() {
        return enableGroups(catalog.ids());
    }

    /**
     * Returns the visible descriptors in registration order.
     */
    public synchronized List<OperationDescriptor> enabledDescriptors() {
        Set<String> enabled = enabledGroups;
        return descriptors.values().stream()
                .filter(d -> enabled.contains(d.group()))
                .toList();
    }

    public synchronized Optional<OperationDescriptor> find(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    /**
     * Returns true if the operation exists and its group is enabled.
     */
    public synchronized boolean isEnabled(String name) {
        OperationDescriptor descriptor = descriptors.get(name);
        return descriptor != null && enabledGroups.contains(descriptor.group());
    }

    public boolean isGroupEnabled(String group) {
        return enabledGroups.contains(group);
    }

    /**
     * Returns the enabled groups in catalog order.
     */
    public List<String> enabledGroups() {
        return catalog.inCatalogOrder(enabledGroups);
    }

    public synchronized CapabilitySummary summary() {
        Set<String> enabled = enabledGroups;
        Map<String, List<CapabilitySummary.OperationSummary>> byGroup = new LinkedHashMap<>();
        catalog.ids().forEach(id -> byGroup.put(id, new ArrayList<>()));
        int visible = 0;
        for (OperationDescriptor d : descriptors.values()) {
            byGroup.get(d.group()).add(
                    new CapabilitySummary.OperationSummary(d.name(), d.category(), d.risk().value()));
            if (enabled.contains(d.group())) {
                visible++;
            }
        }

        Map<String, CapabilitySummary.GroupSummary> groups = new LinkedHashMap<>();
        byGroup.forEach((id, ops) -> {
            if (!ops.isEmpty()) {
                groups.put(id, new CapabilitySummary.GroupSummary(enabled.contains(id), List.copyOf(ops)));
            }
        });
        return new CapabilitySummary(groups, descriptors.size(), visible);
    }

    private GroupChange applyEnable(Set<String> next, Collection<String> ids) {
        List<String> changed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        for (String id : ids) {
            if (next.add(id)) {
                changed.add(id);
            } else {
                unchanged.add(id);
            }
        }
        return new GroupChange(changed, unchanged);
    }

    private GroupChange applyDisable(Set<String> next, Collection<String> ids) {
        List<String> changed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        for (String id : ids) {
            if (id.equals(catalog.alwaysOn())) {
                continue;
            }
            if (next.remove(id)) {
                changed.add(id);
            } else {
                unchanged.add(id);
            }
        }
        return new GroupChange(changed, unchanged);
    }

    /**
     * Swaps in the new enabled set and returns it in catalog order, or null when nothing changed.
     */
    private List<String> publish(Set<String> next, boolean changed) {
        if (!changed) {
            return null;
        }
        enabledGroups = Set.copyOf(next);
        List<String> active = catalog.inCatalogOrder(enabledGroups);
        log.info("Enabled tool groups changed: {}", active);
        return active;
    }

    private void notifyListener(List<String> active) {
        CapabilityChangeListener current = listener;
        if (active == null || current == null) {
            return;
        }
        try {
            current.capabilitiesChanged(active);
        } catch (RuntimeException e) {
            log.warn("Capability change listener failed", e);
        }
    }
}

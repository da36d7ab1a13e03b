package com.satyammall.inventoryservice.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the inventory, keyed by exact (case-sensitive) item name.
 * If the store returns the same name twice, the first entry wins.
 */
public final class InventorySnapshot {

    private static final InventorySnapshot EMPTY = new InventorySnapshot(Collections.emptyList());

    private final Map<String, InventoryItem> itemsByName;

    private InventorySnapshot(List<InventoryItem> items) {
        Map<String, InventoryItem> byName = new LinkedHashMap<>();
        for (InventoryItem item : items) {
            if (item != null && item.getName() != null) {
                byName.putIfAbsent(item.getName(), item);
            }
        }
        this.itemsByName = Collections.unmodifiableMap(byName);
    }

    public static InventorySnapshot of(List<InventoryItem> items) {
        return new InventorySnapshot(items == null ? Collections.emptyList() : items);
    }

    public static InventorySnapshot empty() {
        return EMPTY;
    }

    public Optional<InventoryItem> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(itemsByName.get(name));
    }

    public List<InventoryItem> getItems() {
        return new ArrayList<>(itemsByName.values());
    }

    public int size() {
        return itemsByName.size();
    }
}

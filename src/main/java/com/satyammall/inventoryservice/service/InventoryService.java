package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.model.InventoryItem;
import com.satyammall.inventoryservice.model.InventorySnapshot;
import com.satyammall.inventoryservice.repository.InventoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Holds the last inventory snapshot read from the store. The snapshot is dropped whenever a
 * batch records at least one movement so the next validation sees fresh quantities.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryService {

    private final InventoryRepository inventoryRepository;

    private volatile InventorySnapshot cached;

    public InventorySnapshot getSnapshot() {
        InventorySnapshot snapshot = cached;
        if (snapshot == null) {
            List<InventoryItem> items = inventoryRepository.findAll();
            snapshot = InventorySnapshot.of(items);
            cached = snapshot;
            log.debug("Loaded inventory snapshot with {} items", snapshot.size());
        }
        return snapshot;
    }

    public List<InventoryItem> listItems() {
        return getSnapshot().getItems();
    }

    public void invalidate() {
        cached = null;
    }
}

package com.satyammall.inventoryservice.repository.impl;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.satyammall.inventoryservice.exception.InventoryStoreException;
import com.satyammall.inventoryservice.model.InventoryItem;
import com.satyammall.inventoryservice.repository.InventoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

@Slf4j
@RequiredArgsConstructor
public class FirestoreInventoryRepository implements InventoryRepository {

    private final Firestore firestore;
    private final String collection;

    @Override
    public List<InventoryItem> findAll() {
        try {
            List<QueryDocumentSnapshot> documents = firestore.collection(collection).get().get().getDocuments();
            return documents.stream()
                    .map(this::toItem)
                    .collect(Collectors.toList());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InventoryStoreException("Interrupted while reading the inventory.", e);
        } catch (ExecutionException e) {
            log.error("Error fetching inventory from collection {}", collection, e);
            throw new InventoryStoreException("Could not read the inventory.", e);
        }
    }

    private InventoryItem toItem(QueryDocumentSnapshot doc) {
        return InventoryItem.builder()
                .name(doc.getString("name"))
                .quantity(FirestoreValues.toDecimal(doc.get("quantity")))
                .unit(doc.getString("unit"))
                .build();
    }
}

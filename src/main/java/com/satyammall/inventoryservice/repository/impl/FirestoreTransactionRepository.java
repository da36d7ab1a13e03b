package com.satyammall.inventoryservice.repository.impl;

import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.satyammall.inventoryservice.exception.InventoryStoreException;
import com.satyammall.inventoryservice.model.OperationKind;
import com.satyammall.inventoryservice.model.Transaction;
import com.satyammall.inventoryservice.model.TransactionRequest;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;

import static com.satyammall.inventoryservice.repository.impl.FirestoreValues.orEmpty;

@Slf4j
@RequiredArgsConstructor
public class FirestoreTransactionRepository implements TransactionRepository {

    private final Firestore firestore;
    private final String collection;
    private final String inventoryCollection;
    private final Clock clock;

    @Override
    public List<Transaction> findAll() {
        try {
            List<QueryDocumentSnapshot> documents = firestore.collection(collection).get().get().getDocuments();
            List<Transaction> transactions = new ArrayList<>(documents.size());
            for (QueryDocumentSnapshot doc : documents) {
                try {
                    transactions.add(toTransaction(doc));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping transaction document {}: {}", doc.getId(), e.getMessage());
                }
            }
            return transactions;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InventoryStoreException("Interrupted while reading transactions.", e);
        } catch (ExecutionException e) {
            log.error("Error fetching transactions from collection {}", collection, e);
            throw new InventoryStoreException("Could not read the transaction log.", e);
        }
    }

    /**
     * Appends the record and moves the item's stock in one Firestore transaction. An issue that
     * would take stock below zero, or names an item the inventory does not hold, writes nothing.
     * A receive of an unknown item adds it to the inventory.
     */
    @Override
    public boolean submit(TransactionRequest request) {
        String id = "txn_" + UUID.randomUUID();
        Map<String, Object> data = new HashMap<>();
        data.put("id", id);
        data.put("date", Timestamp.of(Date.from(clock.instant())));
        data.put("type", request.getType().getDisplayName());
        data.put("itemName", request.getItemName());
        data.put("quantity", request.getQuantity().doubleValue());
        data.put("unit", orEmpty(request.getUnit()));
        data.put("location", orEmpty(request.getLocation()));
        data.put("personName", orEmpty(request.getPersonName()));
        data.put("notes", orEmpty(request.getNotes()));
        data.put("fileUrl", orEmpty(request.getFileUrl()));

        CollectionReference inventory = firestore.collection(inventoryCollection);
        DocumentReference record = firestore.collection(collection).document(id);
        try {
            return firestore.runTransaction(txn -> {
                List<QueryDocumentSnapshot> matches = txn.get(inventory
                                .whereEqualTo("name", request.getItemName())
                                .limit(1))
                        .get()
                        .getDocuments();
                DocumentSnapshot stock = matches.isEmpty() ? null : matches.get(0);
                BigDecimal current = stock == null ? BigDecimal.ZERO : FirestoreValues.toDecimal(stock.get("quantity"));

                BigDecimal updated;
                if (request.getType() == OperationKind.ISSUE) {
                    updated = current.subtract(request.getQuantity());
                    if (stock == null || updated.signum() < 0) {
                        log.warn("Refusing issue of {} {}: only {} in stock", request.getQuantity(),
                                request.getItemName(), current);
                        return false;
                    }
                } else {
                    updated = current.add(request.getQuantity());
                }

                if (stock == null) {
                    Map<String, Object> item = new HashMap<>();
                    item.put("name", request.getItemName());
                    item.put("quantity", updated.doubleValue());
                    item.put("unit", orEmpty(request.getUnit()));
                    txn.set(inventory.document(), item);
                } else {
                    txn.update(stock.getReference(), Map.<String, Object>of("quantity", updated.doubleValue()));
                }
                txn.set(record, data);
                return true;
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while recording {} of {}", request.getType(), request.getItemName());
            return false;
        } catch (ExecutionException e) {
            log.warn("Failed to record {} of {}", request.getType(), request.getItemName(), e);
            return false;
        }
    }

    private Transaction toTransaction(QueryDocumentSnapshot doc) {
        String id = doc.getString("id");
        return Transaction.builder()
                .id(id != null ? id : doc.getId())
                .date(FirestoreValues.toInstant(doc.get("date")))
                .type(OperationKind.fromDisplayName(doc.getString("type")))
                .itemName(doc.getString("itemName"))
                .quantity(FirestoreValues.toDecimal(doc.get("quantity")))
                .unit(doc.getString("unit"))
                .location(doc.getString("location"))
                .personName(doc.getString("personName"))
                .notes(doc.getString("notes"))
                .fileUrl(doc.getString("fileUrl"))
                .build();
    }
}

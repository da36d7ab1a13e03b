package com.satyammall.inventoryservice.repository.impl;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.satyammall.inventoryservice.exception.InventoryStoreException;
import com.satyammall.inventoryservice.model.AppUser;
import com.satyammall.inventoryservice.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

@Slf4j
@RequiredArgsConstructor
public class FirestoreUserRepository implements UserRepository {

    private final Firestore firestore;
    private final String collection;

    @Override
    public Optional<AppUser> findByEmail(String email) {
        try {
            List<QueryDocumentSnapshot> documents = firestore.collection(collection)
                    .whereEqualTo("email", email)
                    .limit(1)
                    .get()
                    .get()
                    .getDocuments();
            return documents.stream().findFirst().map(doc -> AppUser.builder()
                    .email(doc.getString("email"))
                    .name(doc.getString("name"))
                    .role(doc.getString("role"))
                    .passwordHash(doc.getString("passwordHash"))
                    .build());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InventoryStoreException("Interrupted while looking up the user.", e);
        } catch (ExecutionException e) {
            log.error("Error fetching user from collection {}", collection, e);
            throw new InventoryStoreException("Could not read user accounts.", e);
        }
    }
}

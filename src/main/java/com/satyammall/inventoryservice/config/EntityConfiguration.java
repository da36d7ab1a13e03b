package com.satyammall.inventoryservice.config;

import com.google.cloud.firestore.Firestore;
import com.google.cloud.storage.Bucket;
import com.satyammall.inventoryservice.repository.AttachmentStore;
import com.satyammall.inventoryservice.repository.InventoryRepository;
import com.satyammall.inventoryservice.repository.TransactionRepository;
import com.satyammall.inventoryservice.repository.UserRepository;
import com.satyammall.inventoryservice.repository.impl.FirebaseStorageAttachmentStore;
import com.satyammall.inventoryservice.repository.impl.FirestoreInventoryRepository;
import com.satyammall.inventoryservice.repository.impl.FirestoreTransactionRepository;
import com.satyammall.inventoryservice.repository.impl.FirestoreUserRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EntityConfiguration {

    @Bean
    InventoryRepository inventoryRepository(Firestore firestore,
                                            @Value("${inventory.firestore.inventory-collection:inventory}") String collection) {
        return new FirestoreInventoryRepository(firestore, collection);
    }

    @Bean
    TransactionRepository transactionRepository(Firestore firestore, Clock clock,
                                                @Value("${inventory.firestore.transactions-collection:transactions}") String collection,
                                                @Value("${inventory.firestore.inventory-collection:inventory}") String inventoryCollection) {
        return new FirestoreTransactionRepository(firestore, collection, inventoryCollection, clock);
    }

    @Bean
    UserRepository userRepository(Firestore firestore,
                                  @Value("${inventory.firestore.users-collection:users}") String collection) {
        return new FirestoreUserRepository(firestore, collection);
    }

    @Bean
    AttachmentStore attachmentStore(Bucket attachmentBucket, Clock clock,
                                    @Value("${inventory.attachments.folder:attachments}") String folder) {
        return new FirebaseStorageAttachmentStore(attachmentBucket, folder, clock);
    }
}

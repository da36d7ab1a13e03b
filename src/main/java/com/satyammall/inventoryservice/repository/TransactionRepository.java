package com.satyammall.inventoryservice.repository;

import com.satyammall.inventoryservice.model.Transaction;
import com.satyammall.inventoryservice.model.TransactionRequest;

import java.util.List;

/**
 * The external transaction log: read in full for reports, appended to one line item at a time.
 */
public interface TransactionRepository {

    List<Transaction> findAll();

    /**
     * Records a single movement.
     *
     * @return true when the store acknowledged the write.
     */
    boolean submit(TransactionRequest request);
}

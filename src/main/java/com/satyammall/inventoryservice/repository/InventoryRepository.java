package com.satyammall.inventoryservice.repository;

import com.satyammall.inventoryservice.model.InventoryItem;

import java.util.List;

public interface InventoryRepository {

    List<InventoryItem> findAll();
}

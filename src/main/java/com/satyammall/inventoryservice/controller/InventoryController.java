package com.satyammall.inventoryservice.controller;

import com.satyammall.inventoryservice.model.InventoryItem;
import com.satyammall.inventoryservice.service.InventoryService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/inventory/items")
@RequiredArgsConstructor
@Tag(name = "Inventory", description = "Current stock levels")
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping
    public ResponseEntity<List<InventoryItem>> listItems() {
        return ResponseEntity.ok(inventoryService.listItems());
    }
}

package com.satyammall.inventoryservice.model;

public enum LineItemField {
    ITEM_NAME,
    QUANTITY,
    UNIT
}

package com.satyammall.inventoryservice.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Editable state behind one issue or receive form: the line items, the fields shared by all
 * of them and an optional attachment. Only the submission pipeline rewrites the item list
 * once a batch has finished.
 */
public class SubmissionForm {

    @Getter
    private final OperationKind type;
    private final LineItemArena arena = new LineItemArena();
    private final List<LineItem> items = new ArrayList<>();
    @Getter
    private CommonFields commonFields = CommonFields.blank();
    @Getter
    private Attachment attachment;
    private boolean inFlight;

    public SubmissionForm(OperationKind type) {
        this.type = Objects.requireNonNull(type, "type");
        items.add(arena.allocate());
    }

    public boolean isIssue() {
        return type == OperationKind.ISSUE;
    }

    public List<LineItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public LineItem addItem() {
        LineItem item = arena.allocate();
        items.add(item);
        return item;
    }

    public LineItem addItem(String itemName, String quantity, String unit) {
        LineItem item = arena.allocate(itemName, quantity, unit);
        items.add(item);
        return item;
    }

    /**
     * Replaces every row with copies of the given entries under fresh keys.
     * An empty list leaves a single blank row.
     */
    public void replaceItems(List<LineItem> entries) {
        items.clear();
        for (LineItem entry : entries) {
            items.add(arena.allocate(entry.getItemName(), entry.getQuantity(), entry.getUnit()));
        }
        if (items.isEmpty()) {
            items.add(arena.allocate());
        }
    }

    /**
     * Removes a row. The last remaining row can never be removed.
     */
    public boolean removeItem(int id) {
        if (items.size() <= 1) {
            return false;
        }
        return items.removeIf(item -> item.getId() == id);
    }

    public void updateItem(int id, LineItemField field, String value) {
        LineItem item = items.stream()
                .filter(i -> i.getId() == id)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No line item with id " + id));
        switch (field) {
            case ITEM_NAME -> item.setItemName(value);
            case QUANTITY -> item.setQuantity(value);
            case UNIT -> {
                if (isIssue()) {
                    throw new IllegalStateException("Unit is taken from the inventory for issue operations.");
                }
                item.setUnit(value);
            }
        }
    }

    /**
     * Copies the inventory unit onto every issue row whose item name matches the snapshot.
     * Receive rows keep whatever unit was typed.
     */
    public void syncUnits(InventorySnapshot snapshot) {
        if (!isIssue()) {
            return;
        }
        for (LineItem item : items) {
            if (item.getItemName() == null || item.getItemName().isEmpty()) {
                continue;
            }
            snapshot.find(item.getItemName())
                    .filter(inv -> !Objects.equals(inv.getUnit(), item.getUnit()))
                    .ifPresent(inv -> item.setUnit(inv.getUnit()));
        }
    }

    public void setCommonFields(CommonFields commonFields) {
        this.commonFields = commonFields == null ? CommonFields.blank() : commonFields;
    }

    public void attach(Attachment attachment) {
        this.attachment = attachment;
    }

    public void clearAttachment() {
        this.attachment = null;
    }

    public boolean isInFlight() {
        return inFlight;
    }

    public void beginBatch() {
        if (inFlight) {
            throw new IllegalStateException("A submission is already in progress for this form.");
        }
        inFlight = true;
    }

    public void endBatch() {
        inFlight = false;
    }

    /**
     * Back to one blank row, blank common fields and no attachment.
     */
    public void resetAfterSuccess() {
        items.clear();
        items.add(arena.allocate());
        commonFields = CommonFields.blank();
        attachment = null;
    }

    /**
     * Keeps exactly the given row instances, in their current order.
     */
    public void retainFailed(List<LineItem> failed) {
        Map<LineItem, Boolean> keep = new IdentityHashMap<>();
        failed.forEach(item -> keep.put(item, Boolean.TRUE));
        items.removeIf(item -> !keep.containsKey(item));
    }
}

package com.satyammall.inventoryservice.service;

import com.satyammall.inventoryservice.exception.InsufficientStockException;
import com.satyammall.inventoryservice.exception.InvalidQuantityException;
import com.satyammall.inventoryservice.exception.MissingFieldException;
import com.satyammall.inventoryservice.exception.UnknownItemException;
import com.satyammall.inventoryservice.model.InventoryItem;
import com.satyammall.inventoryservice.model.InventorySnapshot;
import com.satyammall.inventoryservice.model.LineItem;
import com.satyammall.inventoryservice.model.OperationKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a whole batch against the inventory before anything is sent. The first bad line
 * aborts the batch.
 */
@Component
public class StockValidator {

    /**
     * @throws MissingFieldException      a line has no name, quantity or unit.
     * @throws InvalidQuantityException   a quantity is not a positive decimal.
     * @throws UnknownItemException       an issued item is not in the snapshot.
     * @throws InsufficientStockException an issue asks for more than is in stock, counting
     *                                    earlier lines of the same item in this batch.
     */
    public void validate(OperationKind type, List<LineItem> items, InventorySnapshot snapshot) {
        Map<String, BigDecimal> requestedSoFar = new HashMap<>();

        for (LineItem item : items) {
            if (isEmpty(item.getItemName()) || isEmpty(item.getQuantity()) || isEmpty(item.getUnit())) {
                throw new MissingFieldException(item.getItemName());
            }
            BigDecimal quantity = parseQuantity(item.getQuantity());
            if (quantity == null || quantity.signum() <= 0) {
                throw new InvalidQuantityException(item.getItemName());
            }

            if (type != OperationKind.ISSUE) {
                continue;
            }

            InventoryItem stock = snapshot.find(item.getItemName())
                    .orElseThrow(() -> new UnknownItemException(item.getItemName()));
            BigDecimal available = stock.getQuantity() == null ? BigDecimal.ZERO : stock.getQuantity();
            BigDecimal requested = requestedSoFar.merge(item.getItemName(), quantity, BigDecimal::add);
            if (available.compareTo(requested) < 0) {
                throw new InsufficientStockException(item.getItemName(), available, stock.getUnit());
            }
        }
    }

    /**
     * @return the parsed quantity, or null when the text is not a decimal number or is too
     * large for the store's double field.
     */
    public static BigDecimal parseQuantity(String text) {
        if (text == null) {
            return null;
        }
        try {
            BigDecimal quantity = new BigDecimal(text.trim());
            return Double.isFinite(quantity.doubleValue()) ? quantity : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}

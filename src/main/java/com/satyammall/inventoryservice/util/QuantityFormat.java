package com.satyammall.inventoryservice.util;

import java.math.BigDecimal;

public final class QuantityFormat {

    private QuantityFormat() {
    }

    /**
     * Plain decimal without trailing zeros, e.g. {@code 5}, {@code 2.5}.
     */
    public static String format(BigDecimal quantity) {
        if (quantity == null) {
            return "0";
        }
        if (quantity.signum() == 0) {
            return "0";
        }
        return quantity.stripTrailingZeros().toPlainString();
    }
}

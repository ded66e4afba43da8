package com.codegym.backend.services.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

public final class CurrencyFormatter {

    private static final String VND_SUFFIX = " VND";

    private CurrencyFormatter() {
    }

    /**
     * Formats an amount as Vietnamese dong with comma thousand separators and
     * no fraction digits, e.g. {@code 1,200,000 VND}.
     */
    public static String formatVnd(BigDecimal amount) {
        BigDecimal safe = amount != null ? amount : BigDecimal.ZERO;
        DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.US));
        return format.format(safe.setScale(0, RoundingMode.HALF_UP)) + VND_SUFFIX;
    }
}

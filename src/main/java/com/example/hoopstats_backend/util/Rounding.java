package com.example.hoopstats_backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {
    private Rounding() {
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}

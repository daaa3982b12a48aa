package dumb.narsese.util;

import java.math.BigDecimal;

public enum Floats {
    ;

    /**
     * Positional rendering that always keeps a fractional part: {@code 1.0}, {@code 0.75}, {@code 0.0001}.
     */
    public static String plain(double x) {
        var s = BigDecimal.valueOf(x).stripTrailingZeros().toPlainString();
        return s.indexOf('.') < 0 ? s + ".0" : s;
    }

    /**
     * Shortest positional rendering, dropping a zero fraction: {@code 1}, {@code 0.9}.
     */
    public static String shortest(double x) {
        return BigDecimal.valueOf(x).stripTrailingZeros().toPlainString();
    }

    public static boolean isUnit(double x) {
        return x >= 0 && x <= 1;
    }
}

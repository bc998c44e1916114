package de.caluga.dataapi.driver.serdes;

import de.caluga.dataapi.driver.NumCoercionException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps document paths (dotted, <code>*</code> matches any single segment) to a {@link NumRep}.
 * An exact segment match is preferred over the wildcard. Paths without a match use {@link NumRep#NUMBER}.
 * <pre>
 *     NumericCoercionPolicy.of(Map.of("price", NumRep.BIG_DECIMAL, "stats.*.count", NumRep.BIG_INTEGER));
 * </pre>
 */
public class NumericCoercionPolicy {
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final Node root = new Node();

    public static NumericCoercionPolicy of(Map<String, NumRep> cfg) {
        NumericCoercionPolicy ret = new NumericCoercionPolicy();

        for (Map.Entry<String, NumRep> e : cfg.entrySet()) {
            ret.add(e.getKey(), e.getValue());
        }

        return ret;
    }

    public NumericCoercionPolicy add(String path, NumRep rep) {
        Node current = root;

        for (String key : path.split("\\.")) {
            current = current.children.computeIfAbsent(key, k -> new Node());
        }

        current.rep = rep;
        return this;
    }

    public NumRep repFor(List<String> path) {
        NumRep rep = null;
        Node tree = root;

        for (int i = 0; tree != null && i <= path.size(); i++) {
            if (i == path.size()) {
                return tree.rep != null ? tree.rep : NumRep.NUMBER;
            }

            Node exact = tree.children.get(path.get(i));

            if (exact != null) {
                tree = exact;
            } else {
                tree = tree.children.get("*");

                if (tree != null && tree.rep != null) {
                    rep = tree.rep;
                }
            }
        }

        return rep != null ? rep : NumRep.NUMBER;
    }

    /**
     * @param value as read at full precision (BigInteger or BigDecimal, plain numbers work as well)
     */
    public Object coerce(Number value, List<String> path) {
        BigDecimal dec = toBigDecimal(value);
        String from = value instanceof BigDecimal || value instanceof BigInteger ? "bignumber" : "number";
        NumRep rep = repFor(path);

        switch (rep) {
            case BIG_INTEGER:
                if (!isInteger(dec)) throw new NumCoercionException(path, value, from, rep);
                return dec.toBigIntegerExact();
            case BIG_DECIMAL:
                return dec;
            case STRING:
                return dec.toString();
            case NUMBER_OR_STRING:
                Number n = asPlainNumber(dec);
                return n == null ? dec.toString() : n;
            case NUMBER:
            default:
                Number num = asPlainNumber(dec);
                if (num == null) throw new NumCoercionException(path, value, from, rep);
                return num;
        }
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) return (BigDecimal) value;
        if (value instanceof BigInteger) return new BigDecimal((BigInteger) value);
        if (value instanceof Double || value instanceof Float) return BigDecimal.valueOf(value.doubleValue());
        return BigDecimal.valueOf(value.longValue());
    }

    private static boolean isInteger(BigDecimal d) {
        return d.signum() == 0 || d.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Integer, Long or Double if exact, otherwise null
     */
    private static Number asPlainNumber(BigDecimal dec) {
        if (isInteger(dec) && dec.compareTo(LONG_MIN) >= 0 && dec.compareTo(LONG_MAX) <= 0) {
            long l = dec.longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return (int) l;
            return l;
        }

        double d = dec.doubleValue();
        if (Double.isInfinite(d)) return null;
        if (BigDecimal.valueOf(d).compareTo(dec) != 0 && new BigDecimal(d).compareTo(dec) != 0) return null;
        return d;
    }

    private static final class Node {
        private final Map<String, Node> children = new HashMap<>();
        private NumRep rep;
    }
}

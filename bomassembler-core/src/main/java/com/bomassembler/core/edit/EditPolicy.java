package com.bomassembler.core.edit;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Policy deciding how a configured value meets the value already present.
 *
 * <p>Each constant implements the same three shapes of update, so field handlers never branch on
 * the policy themselves:
 * <ul>
 *   <li>{@link #scalar(Object, Object)} - single values</li>
 *   <li>{@link #list(List, List)} - whole lists</li>
 *   <li>{@link #keyed(List, Object, Predicate)} - one entry in a list keyed by kind</li>
 * </ul>
 */
public enum EditPolicy {

    /** Fill gaps only: never touch a value that is already set. */
    MISSING {
        @Override
        public <T> T scalar(T current, T value) {
            return isUnset(current) ? value : current;
        }

        @Override
        public <T> List<T> list(List<T> current, List<T> values) {
            return current == null || current.isEmpty() ? values : current;
        }

        @Override
        public <T> List<T> keyed(List<T> current, T value, Predicate<T> sameKey) {
            if (current != null && current.stream().anyMatch(sameKey)) {
                return current;
            }
            return concat(current, List.of(value));
        }
    },

    /**
     * Add without discarding. Keyed entries are not deduplicated: a second entry of the same
     * kind is added next to the existing one.
     */
    APPEND {
        @Override
        public <T> T scalar(T current, T value) {
            return value;
        }

        @Override
        public <T> List<T> list(List<T> current, List<T> values) {
            return concat(current, values);
        }

        @Override
        public <T> List<T> keyed(List<T> current, T value, Predicate<T> sameKey) {
            return concat(current, List.of(value));
        }
    },

    /** Replace outright. Keyed updates strip every entry of the kind before adding one. */
    OVERWRITE {
        @Override
        public <T> T scalar(T current, T value) {
            return value;
        }

        @Override
        public <T> List<T> list(List<T> current, List<T> values) {
            return values;
        }

        @Override
        public <T> List<T> keyed(List<T> current, T value, Predicate<T> sameKey) {
            List<T> kept = current == null
                ? List.of()
                : current.stream().filter(sameKey.negate()).toList();
            return concat(kept, List.of(value));
        }
    };

    /**
     * Resolves a single value.
     *
     * @param current value present now, may be null
     * @param value configured value
     * @param <T> value type
     * @return the value to store
     */
    public abstract <T> T scalar(T current, T value);

    /**
     * Resolves a whole list.
     *
     * @param current list present now, may be null
     * @param values configured entries
     * @param <T> entry type
     * @return the list to store
     */
    public abstract <T> List<T> list(List<T> current, List<T> values);

    /**
     * Resolves one entry of a list in which entries carry a kind (e.g. external references).
     *
     * @param current list present now, may be null
     * @param value configured entry
     * @param sameKey matches entries of the same kind as {@code value}
     * @param <T> entry type
     * @return the list to store
     */
    public abstract <T> List<T> keyed(List<T> current, T value, Predicate<T> sameKey);

    static boolean isUnset(Object value) {
        if (value == null) {
            return true;
        }
        return value instanceof CharSequence text && text.length() == 0;
    }

    static <T> List<T> concat(List<T> first, List<T> second) {
        List<T> result = new ArrayList<>();
        if (first != null) {
            result.addAll(first);
        }
        result.addAll(second);
        return result;
    }
}

package org.nullablefields.model.enums;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;

public enum FieldKind {

    TEXT {
        @Override
        public boolean isEmpty(Object value) {
            return value == null || isBlankText(value);
        }
    },
    COLLECTION {
        @Override
        public boolean isEmpty(Object value) {
            return value == null || isEmptyContainer(value);
        }
    },
    /**
     * Numbers, booleans, dates, enums and binary ({@code byte[]}) values. Only an absent value counts as empty.
     */
    SCALAR {
        @Override
        public boolean isEmpty(Object value) {
            return value == null;
        }
    },
    /**
     * JSON-encoded attribute, judged on its decoded value.
     */
    STRUCTURED {
        @Override
        public boolean isEmpty(Object value) {
            return value == null || isEmptyContainer(value) || isBlankText(value);
        }
    };

    public abstract boolean isEmpty(Object value);

    public static FieldKind ofValue(Object value) {
        if (value instanceof CharSequence) {
            return TEXT;
        }
        if (isContainer(value)) {
            return COLLECTION;
        }
        return SCALAR;
    }

    public static FieldKind ofType(Class<?> type) {
        if (CharSequence.class.isAssignableFrom(type)) {
            return TEXT;
        }
        if (Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type) || (type.isArray() && type != byte[].class)) {
            return COLLECTION;
        }
        return SCALAR;
    }

    private static boolean isBlankText(Object value) {
        return value instanceof CharSequence text && text.toString().trim().isEmpty();
    }

    private static boolean isContainer(Object value) {
        return value instanceof Collection<?> || value instanceof Map<?, ?>
                || (value != null && value.getClass().isArray() && !(value instanceof byte[]));
    }

    private static boolean isEmptyContainer(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return value.getClass().isArray() && Array.getLength(value) == 0;
    }
}

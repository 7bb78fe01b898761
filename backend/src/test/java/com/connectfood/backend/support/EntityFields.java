package com.connectfood.backend.support;

import java.lang.reflect.Field;

/**
 * Writes generated or audited fields (ids, timestamps) on entities built outside a persistence context.
 */
public final class EntityFields {

    private EntityFields() {
    }

    public static <T> T setField(T target, String fieldName, Object value) {
        Class<?> type = target.getClass();
        while (type != null) {
            try {
                Field field = type.getDeclaredField(fieldName);
                field.setAccessible(true);
                field.set(target, value);
                return target;
            } catch (NoSuchFieldException ex) {
                type = type.getSuperclass();
            } catch (IllegalAccessException ex) {
                throw new IllegalStateException(ex);
            }
        }
        throw new IllegalArgumentException("No field " + fieldName + " on " + target.getClass().getName());
    }
}

package com.ryuqq.composer.dsl;

import com.ryuqq.composer.core.contract.Requirement;
import com.ryuqq.composer.core.model.Params;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 입력 값을 record의 정식 생성자로 바인딩.
 *
 * <p>{@code Optional<T>} 컴포넌트는 선택 입력, 나머지는 필수 입력입니다.
 * 바인딩 전에 {@link #mismatch(Params)}로 타입 일치를 확인합니다.</p>
 *
 * @param <R> 입력 record 타입
 * @author Composer Team
 * @since 1.0.0
 */
final class RecordBinder<R extends Record> {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
        boolean.class, Boolean.class,
        byte.class, Byte.class,
        short.class, Short.class,
        char.class, Character.class,
        int.class, Integer.class,
        long.class, Long.class,
        float.class, Float.class,
        double.class, Double.class
    );

    private final Class<R> inputType;
    private final RecordComponent[] components;
    private final Constructor<R> constructor;

    RecordBinder(Class<R> inputType) {
        if (inputType == null) {
            throw new IllegalArgumentException("inputType cannot be null");
        }
        this.inputType = inputType;
        this.components = inputType.getRecordComponents();
        Class<?>[] types = new Class<?>[components.length];
        for (int i = 0; i < components.length; i++) {
            types[i] = components[i].getType();
        }
        try {
            this.constructor = inputType.getDeclaredConstructor(types);
            this.constructor.setAccessible(true);
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("No canonical constructor found for " + inputType.getName(), e);
        }
    }

    /**
     * record 컴포넌트에서 입력 선언 도출 (선언 순서).
     *
     * @return 입력 키 → 필수 여부
     */
    Map<String, Requirement> params() {
        Map<String, Requirement> params = new LinkedHashMap<>();
        for (RecordComponent component : components) {
            params.put(component.getName(),
                component.getType() == Optional.class ? Requirement.OPTIONAL : Requirement.REQUIRED);
        }
        return params;
    }

    boolean hasComponents() {
        return components.length > 0;
    }

    /**
     * 첫 번째 타입 불일치 메시지.
     *
     * @param params 바인딩할 입력
     * @return 불일치 메시지 (모두 일치하면 null)
     */
    String mismatch(Params params) {
        for (RecordComponent component : components) {
            String key = component.getName();
            Object value = params.get(key);
            if (component.getType() == Optional.class) {
                if (value != null && !optionalElementType(component).isInstance(value)) {
                    return describe(key, optionalElementType(component), value);
                }
                continue;
            }
            Class<?> expected = WRAPPERS.getOrDefault(component.getType(), component.getType());
            if (value == null ? component.getType().isPrimitive() : !expected.isInstance(value)) {
                return describe(key, component.getType(), value);
            }
        }
        return null;
    }

    /**
     * record 생성.
     *
     * @param params 타입이 확인된 입력
     * @return 바인딩된 record
     */
    R bind(Params params) {
        Object[] arguments = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            Object value = params.get(components[i].getName());
            arguments[i] = components[i].getType() == Optional.class ? Optional.ofNullable(value) : value;
        }
        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Cannot instantiate " + inputType.getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate " + inputType.getName(), e);
        }
    }

    private static Class<?> optionalElementType(RecordComponent component) {
        Type generic = component.getGenericType();
        if (generic instanceof ParameterizedType parameterized) {
            Type argument = parameterized.getActualTypeArguments()[0];
            if (argument instanceof Class<?> type) {
                return type;
            }
            if (argument instanceof ParameterizedType nested && nested.getRawType() instanceof Class<?> raw) {
                return raw;
            }
        }
        return Object.class;
    }

    private static String describe(String key, Class<?> expected, Object value) {
        String actual = value == null ? "null" : value.getClass().getSimpleName();
        return "param " + key + " expected " + expected.getSimpleName() + " but got " + actual;
    }
}

package com.anzhi.simplerpc.codec;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 参数/返回值槽位的分配规则。
 * <ul>
 *     <li>值类型（基本类型及其包装类、String、枚举、数组等）不能原地填充，槽位取零值，解码时直接替换</li>
 *     <li>List/Set/Map 预先分配为空实例，方法体可以直接往里填</li>
 *     <li>其他类型通过无参构造器创建，解码时原地填充</li>
 * </ul>
 */
public final class Slots {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            boolean.class, Boolean.class,
            byte.class, Byte.class,
            char.class, Character.class,
            short.class, Short.class,
            int.class, Integer.class,
            long.class, Long.class,
            float.class, Float.class,
            double.class, Double.class,
            void.class, Void.class);

    private static final Map<Class<?>, Object> ZERO_VALUES = Map.of(
            Boolean.class, Boolean.FALSE,
            Byte.class, (byte) 0,
            Character.class, '\0',
            Short.class, (short) 0,
            Integer.class, 0,
            Long.class, 0L,
            Float.class, 0f,
            Double.class, 0d,
            String.class, "");

    private Slots() {
    }

    /**
     * 基本类型转换为包装类，其他类型原样返回。
     */
    public static <T> Class<T> wrap(Class<T> type) {
        @SuppressWarnings("unchecked")
        Class<T> wrapped = (Class<T>) WRAPPERS.getOrDefault(type, type);
        return wrapped;
    }

    public static boolean isValueShaped(Class<?> type) {
        Class<?> t = wrap(type);
        return ZERO_VALUES.containsKey(t)
                || t.isEnum()
                || t.isArray()
                || Number.class.isAssignableFrom(t)
                || CharSequence.class.isAssignableFrom(t)
                || Temporal.class.isAssignableFrom(t)
                || t == Object.class;
    }

    /**
     * 为给定类型分配一个新的槽位；无法分配时返回 null，由解码器直接生成新值。
     *
     * @throws IllegalStateException 构造器抛出异常
     */
    public static <T> T newInstance(Class<T> type) {
        Class<T> t = wrap(type);
        Object zero = ZERO_VALUES.get(t);
        if (zero != null) {
            return t.cast(zero);
        }
        if (t.isArray()) {
            return t.cast(Array.newInstance(t.getComponentType(), 0));
        }
        if (isValueShaped(t)) {
            return null;
        }
        if (t.isInterface() || Modifier.isAbstract(t.getModifiers())) {
            if (t == List.class || t == Collection.class) {
                return t.cast(new ArrayList<>());
            }
            if (t == Set.class) {
                return t.cast(new HashSet<>());
            }
            if (t == Map.class) {
                return t.cast(new HashMap<>());
            }
            return null;
        }
        // 只用 public 类型的 public 无参构造器
        if (!Modifier.isPublic(t.getModifiers())) {
            return null;
        }
        try {
            return t.getConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            return null;
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("cannot allocate slot of type " + t.getName(), e);
        }
    }
}

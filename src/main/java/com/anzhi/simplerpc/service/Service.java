package com.anzhi.simplerpc.service;

import com.anzhi.simplerpc.codec.Slots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 一个具名的服务：方法名到 {@link MethodEntry} 的映射，构造完成后只有调用计数会变化。
 * <p>
 * 两种构造方式：
 * <ul>
 *     <li>{@link #builder(String)} 显式注册每个方法的参数类型、返回值类型和方法体；</li>
 *     <li>{@link #of(Object)} 在启动时通过反射把对象上符合条件的方法登记成同样的方法表。</li>
 * </ul>
 * 分发请求时只查方法表，不再做反射检查。
 */
public final class Service {
    private static final Logger logger = LoggerFactory.getLogger(Service.class);

    private final String name;
    private final Map<String, MethodEntry<?, ?>> methods;

    private Service(String name, Map<String, MethodEntry<?, ?>> methods) {
        this.name = name;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 以接收者的类名作为服务名。
     *
     * @throws IllegalArgumentException 接收者的类型不是 public 的具名类
     */
    public static Service of(Object receiver) {
        Class<?> type = receiver.getClass();
        String name = type.getSimpleName();
        if (name.isEmpty() || !Modifier.isPublic(type.getModifiers())) {
            logger.error("rpc server: {} is not a valid service name", type.getName());
            throw new IllegalArgumentException("rpc server: " + type.getName() + " is not a valid service name");
        }
        return of(name, receiver);
    }

    /**
     * 反射登记符合条件的方法：
     * <ul>
     *     <li>public 实例方法，不是 Object 上声明的方法</li>
     *     <li>恰好两个参数，类型都是 public 的或内置类型</li>
     *     <li>返回 void（原地填充 reply），或者返回 reply 参数的类型</li>
     * </ul>
     * 不符合条件的方法直接跳过，一个对象上可以混合 RPC 方法和普通方法。
     */
    public static Service of(String name, Object receiver) {
        Class<?> type = receiver.getClass();
        if (!Modifier.isPublic(type.getModifiers())) {
            logger.error("rpc server: {} is not an exported type", type.getName());
            throw new IllegalArgumentException("rpc server: " + type.getName() + " is not an exported type");
        }
        Builder builder = builder(name);
        for (Method method : type.getMethods()) {
            if (!isEligible(method)) {
                continue;
            }
            builder.reflect(method, receiver);
        }
        return builder.build();
    }

    /**
     * 增加调用计数并执行方法，返回最终的 reply；方法抛出的异常原样向上传递。
     */
    public Object call(MethodEntry<?, ?> entry, Object arg, Object reply) throws Exception {
        return entry.invoke(arg, reply);
    }

    public MethodEntry<?, ?> getMethod(String methodName) {
        return methods.get(methodName);
    }

    public Set<String> getMethodNames() {
        return methods.keySet();
    }

    public String getName() { return name; }

    @Override
    public String toString() {
        return "Service{" + name + ", methods=" + methods.values() + '}';
    }

    private static boolean isEligible(Method method) {
        if (method.getDeclaringClass() == Object.class
                || Modifier.isStatic(method.getModifiers())
                || method.isBridge()
                || method.isSynthetic()) {
            return false;
        }
        if (method.getParameterCount() != 2) {
            return false;
        }
        Class<?>[] params = method.getParameterTypes();
        Class<?> returnType = method.getReturnType();
        if (returnType != void.class && Slots.wrap(returnType) != Slots.wrap(params[1])) {
            return false;
        }
        return isExportedOrBuiltin(params[0]) && isExportedOrBuiltin(params[1]);
    }

    private static boolean isExportedOrBuiltin(Class<?> type) {
        if (type.isPrimitive()) {
            return true;
        }
        if (type.isArray()) {
            return isExportedOrBuiltin(type.getComponentType());
        }
        return Modifier.isPublic(type.getModifiers());
    }

    public static final class Builder {
        private final String name;
        private final Map<String, MethodEntry<?, ?>> methods = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("rpc server: service name must not be empty");
            }
            this.name = name;
        }

        public <A, R> Builder method(String methodName, Class<A> argType, Class<R> replyType,
                                     MethodHandler<A, R> handler) {
            if (methods.containsKey(methodName)) {
                throw new IllegalArgumentException("rpc server: method already defined: " + name + "." + methodName);
            }
            methods.put(methodName, new MethodEntry<>(methodName, argType, replyType, handler));
            logger.info("rpc server: register {}.{}", name, methodName);
            return this;
        }

        private void reflect(Method method, Object receiver) {
            // 重载方法只登记第一个
            if (methods.containsKey(method.getName())) {
                logger.warn("rpc server: skip overloaded method {}.{}", name, method.getName());
                return;
            }
            Class<?>[] params = method.getParameterTypes();
            reflect(method, receiver, params[0], params[1]);
        }

        private <A, R> void reflect(Method method, Object receiver, Class<A> argType, Class<R> replyType) {
            Class<R> wrappedReply = Slots.wrap(replyType);
            boolean inPlace = method.getReturnType() == void.class;
            method(method.getName(), argType, replyType, (arg, reply) -> {
                try {
                    Object result = method.invoke(receiver, arg, reply);
                    return inPlace ? reply : wrappedReply.cast(result);
                } catch (InvocationTargetException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof Exception) {
                        throw (Exception) cause;
                    }
                    if (cause instanceof Error) {
                        throw (Error) cause;
                    }
                    throw e;
                }
            });
        }

        public Service build() {
            return new Service(name, methods);
        }
    }
}

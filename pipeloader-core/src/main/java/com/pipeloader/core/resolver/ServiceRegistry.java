package com.pipeloader.core.resolver;

import com.pipeloader.api.exception.InvalidArgumentException;
import com.pipeloader.core.exception.DependencyResolutionException;
import com.pipeloader.core.spi.DependencyResolver;
import com.pipeloader.core.spi.ResolutionScope;
import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 默认依赖解析器：简易服务注册表 + 构造器注入
 * <p>
 * 两类服务：
 * <ul>
 * <li>单例：注册时给定实例，所有作用域共享</li>
 * <li>作用域服务：每个作用域首次需要时由工厂创建，作用域关闭时一并关闭</li>
 * </ul>
 * 构造器选择：公共构造器按参数个数从多到少尝试，每个参数依次由
 * 未使用的显式参数、单例、作用域服务满足；第一个全部可满足且用完所有显式参数的构造器胜出。
 */
@Slf4j
public class ServiceRegistry implements DependencyResolver {

    private final Map<Class<?>, Object> singletons = new ConcurrentHashMap<>();
    private final Map<Class<?>, Supplier<?>> scopedFactories = new ConcurrentHashMap<>();

    public <T> ServiceRegistry registerSingleton(Class<T> type, T instance) {
        InvalidArgumentException.requireNonNull("type", type);
        InvalidArgumentException.requireNonNull("instance", instance);
        singletons.put(type, instance);
        log.debug("Registered singleton service: {}", type.getName());
        return this;
    }

    public <T> ServiceRegistry registerScoped(Class<T> type, Supplier<? extends T> factory) {
        InvalidArgumentException.requireNonNull("type", type);
        InvalidArgumentException.requireNonNull("factory", factory);
        scopedFactories.put(type, factory);
        log.debug("Registered scoped service: {}", type.getName());
        return this;
    }

    public <T> Optional<T> getSingleton(Class<T> type) {
        return Optional.ofNullable(findSingleton(type)).map(type::cast);
    }

    public boolean isRegistered(Class<?> type) {
        return findSingleton(type) != null || findScopedFactoryKey(type) != null;
    }

    @Override
    public ResolutionScope openScope() {
        return new Scope();
    }

    private Object findSingleton(Class<?> type) {
        Object exact = singletons.get(type);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<Class<?>, Object> entry : singletons.entrySet()) {
            if (type.isAssignableFrom(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    private Class<?> findScopedFactoryKey(Class<?> type) {
        if (scopedFactories.containsKey(type)) {
            return type;
        }
        for (Class<?> key : scopedFactories.keySet()) {
            if (type.isAssignableFrom(key)) {
                return key;
            }
        }
        return null;
    }

    /**
     * 请求级作用域（单线程使用）
     */
    private final class Scope implements ResolutionScope {

        private final Map<Class<?>, Object> scopedInstances = new LinkedHashMap<>();
        private boolean closed;

        @Override
        public Object createInstance(Class<?> type, Object... explicitArgs) {
            if (closed) {
                throw new IllegalStateException("Resolution scope already closed");
            }
            InvalidArgumentException.requireNonNull("type", type);
            if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
                throw new DependencyResolutionException(type, "Cannot instantiate abstract type " + type.getName());
            }
            Object[] extras = explicitArgs != null ? explicitArgs : new Object[0];

            List<Constructor<?>> candidates = new ArrayList<>(Arrays.asList(type.getConstructors()));
            candidates.sort(Comparator.comparingInt((Constructor<?> c) -> c.getParameterCount()).reversed());

            for (Constructor<?> constructor : candidates) {
                Object[] args = tryResolveArguments(constructor, extras);
                if (args != null) {
                    return invoke(type, constructor, args);
                }
            }
            throw new DependencyResolutionException(type, String.format(
                    "A suitable constructor for type %s could not be located. Ensure the type is concrete, "
                            + "all its parameters are registered services and it accepts %d explicit argument(s)",
                    type.getName(), extras.length));
        }

        private Object[] tryResolveArguments(Constructor<?> constructor, Object[] extras) {
            Class<?>[] parameterTypes = constructor.getParameterTypes();
            Object[] args = new Object[parameterTypes.length];
            boolean[] used = new boolean[extras.length];

            for (int i = 0; i < parameterTypes.length; i++) {
                Class<?> parameterType = parameterTypes[i];
                int explicitIndex = matchExplicit(parameterType, extras, used);
                if (explicitIndex >= 0) {
                    used[explicitIndex] = true;
                    args[i] = extras[explicitIndex];
                    continue;
                }
                Object service = resolveService(parameterType);
                if (service == null) {
                    return null;
                }
                args[i] = service;
            }
            for (boolean u : used) {
                if (!u) {
                    return null;
                }
            }
            return args;
        }

        private int matchExplicit(Class<?> parameterType, Object[] extras, boolean[] used) {
            for (int j = 0; j < extras.length; j++) {
                if (!used[j] && extras[j] != null && parameterType.isInstance(extras[j])) {
                    return j;
                }
            }
            return -1;
        }

        private Object resolveService(Class<?> parameterType) {
            Object singleton = findSingleton(parameterType);
            if (singleton != null) {
                return singleton;
            }
            Class<?> key = findScopedFactoryKey(parameterType);
            if (key == null) {
                return null;
            }
            return scopedInstances.computeIfAbsent(key, k -> {
                Object created = scopedFactories.get(k).get();
                if (created == null) {
                    throw new DependencyResolutionException(k, "Scoped factory returned null for " + k.getName());
                }
                return created;
            });
        }

        private Object invoke(Class<?> type, Constructor<?> constructor, Object[] args) {
            try {
                return constructor.newInstance(args);
            } catch (InvocationTargetException e) {
                throw new DependencyResolutionException(type,
                        "Constructor of " + type.getName() + " threw an exception", e.getTargetException());
            } catch (InstantiationException | IllegalAccessException e) {
                throw new DependencyResolutionException(type, "Cannot invoke constructor of " + type.getName(), e);
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            for (Object instance : scopedInstances.values()) {
                if (instance instanceof AutoCloseable) {
                    try {
                        ((AutoCloseable) instance).close();
                    } catch (Exception e) {
                        log.warn("Failed to close scoped service {}: {}", instance.getClass().getName(), e.getMessage());
                    }
                }
            }
            scopedInstances.clear();
        }
    }
}

package com.pipeloader.core.classloader;

import com.pipeloader.core.exception.ClassLoaderException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;

/**
 * 插件类加载器（隔离单元的私有符号表）
 * 特性：
 * 1. 白名单强制委派：共享包只认宿主的副本
 * 2. Child-First：其余类优先从插件自身及其声明的依赖中加载
 * 3. 资源加载 Child-First（防止读到宿主的 plugin.yml）
 * 4. 关闭后拒绝继续加载
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    static {
        ClassLoader.registerAsParallelCapable();
    }

    private final String unitId;
    private final SharedPackages sharedPackages;
    private volatile boolean closed = false;

    public PluginClassLoader(String unitId, URL[] urls, ClassLoader hostClassLoader, SharedPackages sharedPackages) {
        super(unitId, urls, hostClassLoader);
        this.unitId = unitId;
        this.sharedPackages = sharedPackages;
        log.debug("[{}] ClassLoader created with {} URLs", unitId, urls.length);
    }

    /**
     * 追加依赖 JAR（仅在单元打开阶段调用）
     */
    void addDependency(URL url) {
        addURL(url);
        log.debug("[{}] Added dependency: {}", unitId, url);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (closed) {
            throw new ClassLoaderException(unitId, name,
                    String.format("ClassLoader for unit [%s] has been closed, cannot load class: %s", unitId, name));
        }

        synchronized (getClassLoadingLock(name)) {
            Class<?> c = findLoadedClass(name);
            if (c == null) {
                if (sharedPackages.isShared(name)) {
                    // 共享类型：只从宿主加载，即使插件 JAR 里带了同名副本
                    c = getParent().loadClass(name);
                } else {
                    c = loadChildFirst(name);
                }
            }
            if (resolve) {
                resolveClass(c);
            }
            return c;
        }
    }

    private Class<?> loadChildFirst(String name) throws ClassNotFoundException {
        try {
            return findClass(name);
        } catch (ClassNotFoundException notInUnit) {
            // 插件自身没有，兜底到宿主（JDK 之外的宿主公共库）
            return getParent().loadClass(name);
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) {
            log.warn("[{}] Attempting to get resource from closed ClassLoader: {}", unitId, name);
            return null;
        }
        URL url = findResource(name);
        if (url != null) {
            return url;
        }
        return getParent().getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        if (closed) {
            return Collections.emptyEnumeration();
        }
        // 自己的在前，宿主的在后
        List<URL> urls = new ArrayList<>();
        Enumeration<URL> local = findResources(name);
        while (local.hasMoreElements()) {
            urls.add(local.nextElement());
        }
        Enumeration<URL> fromHost = getParent().getResources(name);
        while (fromHost.hasMoreElements()) {
            URL url = fromHost.nextElement();
            if (!urls.contains(url)) {
                urls.add(url);
            }
        }
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            log.debug("[{}] ClassLoader already closed", unitId);
            return;
        }
        closed = true;
        try {
            // 释放 JAR 文件句柄
            super.close();
            log.info("[{}] ClassLoader closed", unitId);
        } catch (IOException e) {
            log.error("[{}] Error closing ClassLoader", unitId, e);
            throw e;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public String getUnitId() {
        return unitId;
    }

    public SharedPackages getSharedPackages() {
        return sharedPackages;
    }

    @Override
    public String toString() {
        return String.format("PluginClassLoader[unitId=%s, closed=%s, urls=%d]",
                unitId, closed, getURLs().length);
    }
}

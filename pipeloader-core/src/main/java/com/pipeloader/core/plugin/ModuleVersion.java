package com.pipeloader.core.plugin;

import com.pipeloader.api.exception.InvalidArgumentException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 模块版本：2 到 4 段非负整数，如 {@code 1.0}、{@code 9.9.9}、{@code 1.2.3.4}
 * <p>
 * {@link #toString()} 返回规范文本（去掉前导零），用于目录名、缓存键和复合键。
 */
public final class ModuleVersion {

    private static final int MIN_COMPONENTS = 2;
    private static final int MAX_COMPONENTS = 4;

    private final int[] components;
    private final String text;

    private ModuleVersion(int[] components) {
        this.components = components;
        this.text = Arrays.stream(components).mapToObj(String::valueOf).collect(Collectors.joining("."));
    }

    public static ModuleVersion parse(String version) {
        InvalidArgumentException.requireNonBlank("version", version);
        String[] parts = version.trim().split("\\.", -1);
        if (parts.length < MIN_COMPONENTS || parts.length > MAX_COMPONENTS) {
            throw new InvalidArgumentException("version", version,
                    "Version must have 2 to 4 numeric components: " + version);
        }
        int[] components = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                components[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new InvalidArgumentException("version", "Invalid version component '" + parts[i] + "' in " + version, e);
            }
            if (components[i] < 0) {
                throw new InvalidArgumentException("version", version, "Version components cannot be negative: " + version);
            }
        }
        return new ModuleVersion(components);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleVersion)) return false;
        return Arrays.equals(components, ((ModuleVersion) o).components);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return text;
    }
}

package com.pipeloader.core.plugin;

import com.pipeloader.api.HierarchicalLoggingContext;
import com.pipeloader.api.Plugin;
import com.pipeloader.api.exception.InvalidArgumentException;
import com.pipeloader.core.resolver.ServiceRegistry;
import com.pipeloader.fixture.AudioPlugin;
import com.pipeloader.fixture.ConstructionCounter;
import com.pipeloader.fixture.PluginJarBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginManagerRegistry 测试")
class PluginManagerRegistryTest {

    @TempDir
    Path tempDir;

    private ConstructionCounter counter;
    private PluginManagerRegistry registry;

    @BeforeEach
    void setUp() {
        counter = new ConstructionCounter();
        registry = new PluginManagerRegistry(
                new ServiceRegistry().registerSingleton(ConstructionCounter.class, counter),
                PluginManagerConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    @DisplayName("同一根目录的不同写法共用一个管理器")
    void equivalentPathsShouldShareManager() {
        PluginManager first = registry.getManager(tempDir.toString());
        PluginManager second = registry.getManager(tempDir.resolve(".").resolve("sub").resolve("..").toString());

        assertSame(first, second);
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("不同根目录各自一个管理器")
    void differentPathsShouldGetDifferentManagers() {
        PluginManager a = registry.getManager(tempDir.resolve("a").toString());
        PluginManager b = registry.getManager(tempDir.resolve("b").toString());

        assertNotSame(a, b);
        assertEquals(2, registry.size());
    }

    @Test
    @DisplayName("空白路径被拒绝")
    void blankPathShouldBeRejected() {
        assertThrows(InvalidArgumentException.class, () -> registry.getManager(""));
    }

    @Test
    @DisplayName("关闭注册表会释放所有管理器的缓存实例")
    void closeShouldDisposeAllManagers() throws IOException {
        PluginJarBuilder.create()
                .withClasses(AudioPlugin.class)
                .writeModule(tempDir, "audioPlugin", "1.0");
        PluginManager manager = registry.getManager(tempDir.toString());
        Plugin plugin = manager.getPluginInstance("audioPlugin", "1.0", AudioPlugin.class.getName(), false,
                HierarchicalLoggingContext.newRoot("registry-test"));
        assertNotNull(plugin);

        registry.close();

        assertEquals(1, counter.getDisposals());
        assertEquals(0, manager.getCachedPluginCount());
        assertEquals(0, registry.size());
    }
}

package com.pipeloader.core.plugin;

import com.pipeloader.api.exception.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModuleVersion 测试")
class ModuleVersionTest {

    @ParameterizedTest
    @ValueSource(strings = {"1.0", "9.9.9", "1.2.3.4", "0.0"})
    @DisplayName("合法版本原样保留规范文本")
    void validVersionsShouldParse(String text) {
        assertEquals(text, ModuleVersion.parse(text).toString());
    }

    @Test
    @DisplayName("前导零与首尾空白被规范化")
    void versionShouldBeCanonicalized() {
        ModuleVersion version = ModuleVersion.parse(" 01.002 ");

        assertEquals("1.2", version.toString());
        assertEquals(ModuleVersion.parse("1.2"), version);
        assertEquals(ModuleVersion.parse("1.2").hashCode(), version.hashCode());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "1.2.3.4.5", "one.two", "1..2", "1.-2", "v1.0", "1.0-SNAPSHOT", " "})
    @DisplayName("非法版本被拒绝")
    void invalidVersionsShouldBeRejected(String text) {
        InvalidArgumentException e = assertThrows(InvalidArgumentException.class, () -> ModuleVersion.parse(text));
        assertEquals("version", e.getParamName());
    }

    @Test
    @DisplayName("null 被拒绝")
    void nullShouldBeRejected() {
        assertThrows(InvalidArgumentException.class, () -> ModuleVersion.parse(null));
    }

    @Test
    @DisplayName("段数不同的版本不相等")
    void componentCountShouldMatter() {
        assertNotEquals(ModuleVersion.parse("1.0"), ModuleVersion.parse("1.0.0"));
        assertEquals(ModuleVersion.parse("1.0"), ModuleVersion.parse("1.00"));
    }
}

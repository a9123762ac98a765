package com.hao.redisdict.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命名空间键编解码测试
 */
class KeyCodecTest {

    private final KeyCodec codec = new KeyCodec("main");

    @Test
    @DisplayName("拼接与还原互逆，业务键中的冒号原样保留")
    void testFormatAndParse() {
        assertEquals("main:a", codec.format("a"));
        assertEquals("a", codec.parse("main:a"));
        assertEquals("user:1:name", codec.parse(codec.format("user:1:name")));
        assertEquals("", codec.parse(codec.format("")));
    }

    @Test
    @DisplayName("还原其他命名空间的键时拒绝")
    void testParseForeignKey() {
        assertThrows(IllegalArgumentException.class, () -> codec.parse("other:a"));
    }

    @Test
    @DisplayName("扫描模式与索引键")
    void testPatterns() {
        assertEquals("main:*", codec.scanPattern(null));
        assertEquals("main:foo*", codec.scanPattern("foo"));
        assertEquals("main:f?o*", codec.scanPattern("f?o"), "通配符原样透传");
        assertEquals("redis-dict-insertion-order-main", codec.insertionOrderKey());
    }

    @Test
    @DisplayName("链式键拼接")
    void testChain() {
        assertEquals("a:b:c", KeyCodec.chain(List.of("a", "b", "c")));
        assertEquals("single", KeyCodec.chain(List.of("single")));
    }

    @Test
    @DisplayName("命名空间不能为空")
    void testEmptyNamespace() {
        assertThrows(IllegalArgumentException.class, () -> new KeyCodec(""));
    }
}

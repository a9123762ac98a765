package com.hao.redisdict.codec;

import com.hao.redisdict.common.enums.BuiltinTypeEnum;
import com.hao.redisdict.common.exception.MissingCapabilityException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 类型注册表测试
 *
 * 测试目的：
 * 1. 验证类型到标签的解析（精确类型、接口类型、未注册类型）。
 * 2. 验证自定义类型扩展的两种写法与能力缺失时的报错。
 * 3. 验证编码、解码两张映射相互独立。
 */
@Slf4j
class TypeRegistryTest {

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = TypeRegistry.withBuiltins();
    }

    @Test
    @DisplayName("标签解析：精确类型、接口实现与未注册类型")
    void testTagResolution() {
        assertEquals("String", registry.tagOf("x"));
        assertEquals("Integer", registry.tagOf(1));
        assertEquals("null", registry.tagOf(null));
        assertEquals("List", registry.tagOf(new ArrayList<>()));
        assertEquals("List", registry.tagOf(new LinkedList<>()));
        assertEquals("Map", registry.tagOf(new TreeMap<>()));
        assertEquals("bytes", registry.tagOf(new byte[]{1}));
        assertEquals("Point", registry.tagOf(new Point(1, 2)), "未注册类型使用简单类名");
    }

    @Test
    @DisplayName("内置类型全部按枚举定义注册，接口类型按可赋值匹配")
    void testBuiltinsFollowEnum() {
        for (BuiltinTypeEnum type : BuiltinTypeEnum.values()) {
            assertTrue(registry.hasEncoder(type.getTag()), type.getTag());
            assertTrue(registry.hasDecoder(type.getTag()), type.getTag());
        }
        assertEquals(BuiltinTypeEnum.SET.getTag(), registry.tagOf(new LinkedHashSet<>()));
        assertEquals(BuiltinTypeEnum.MAP.getTag(), registry.tagOf(new HashMap<>()));
        assertEquals(BuiltinTypeEnum.DURATION.getTag(), registry.tagOf(Duration.ofSeconds(1)));
    }

    @Test
    @DisplayName("按方法名扩展：实例 encode + 静态 decode")
    void testExtendByMethodNames() {
        registry.extend(Point.class);

        assertTrue(registry.hasEncoder("Point"));
        assertTrue(registry.hasDecoder("Point"));
        assertEquals("3,4", registry.encoderFor("Point").encode(new Point(3, 4)));
        assertEquals(new Point(3, 4), registry.decoderFor("Point").decode("3,4"));
    }

    @Test
    @DisplayName("按自定义方法名扩展")
    void testExtendWithCustomMethodNames() {
        registry.extend(Money.class, null, null, "dump", "load");

        assertEquals("12CNY", registry.encoderFor("Money").encode(new Money(12)));
        assertEquals(new Money(7), registry.decoderFor("Money").decode("7CNY"));
    }

    @Test
    @DisplayName("显式函数扩展优先于方法派生")
    void testExtendWithExplicitFunctions() {
        registry.extend(Point.class, p -> p.x + "|" + p.y, payload -> {
            String[] parts = payload.split("\\|");
            return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        });

        assertEquals("5|6", registry.encoderFor("Point").encode(new Point(5, 6)));
        assertEquals(new Point(5, 6), registry.decoderFor("Point").decode("5|6"));
    }

    @Test
    @DisplayName("缺少编码方法：抛出能力缺失异常并指明成员")
    void testMissingEncodeMethod() {
        MissingCapabilityException e = assertThrows(MissingCapabilityException.class,
                () -> registry.extend(NoCodec.class));

        assertEquals(NoCodec.class, e.getType());
        assertEquals("encode", e.getMember());
        assertFalse(registry.hasEncoder("NoCodec"));
    }

    @Test
    @DisplayName("同名成员是字段：报错信息说明不是方法")
    void testFieldInsteadOfMethod() {
        MissingCapabilityException e = assertThrows(MissingCapabilityException.class,
                () -> registry.extend(FieldNamedEncode.class));

        assertTrue(e.getMessage().contains("字段"), e.getMessage());
    }

    @Test
    @DisplayName("缺少解码方法：编码函数保留，解码函数不登记")
    void testPartialRegistrationWhenDecoderMissing() {
        MissingCapabilityException e = assertThrows(MissingCapabilityException.class,
                () -> registry.extend(EncodeOnly.class));

        assertEquals("decode", e.getMember());
        assertTrue(registry.hasEncoder("EncodeOnly"), "编码函数先于解码校验登记");
        assertFalse(registry.hasDecoder("EncodeOnly"));
        assertEquals("EncodeOnly", registry.tagOf(new EncodeOnly("a")));
    }

    @Test
    @DisplayName("解码方法返回类型不匹配时拒绝")
    void testDecoderReturnTypeMismatch() {
        MissingCapabilityException e = assertThrows(MissingCapabilityException.class,
                () -> registry.extend(WrongDecode.class));

        assertEquals("decode", e.getMember());
    }

    @Test
    @DisplayName("编码与解码可独立注册，后写覆盖先写")
    void testIndependentRegistration() {
        registry.registerEncoder(Point.class, p -> "P" + p.x);
        assertTrue(registry.hasEncoder("Point"));
        assertFalse(registry.hasDecoder("Point"));

        registry.registerDecoder("Point", payload -> new Point(Integer.parseInt(payload.substring(1)), 0));
        assertEquals(new Point(9, 0), registry.decoderFor("Point").decode("P9"));

        registry.registerDecoder("Point", payload -> new Point(0, 0));
        assertEquals(new Point(0, 0), registry.decoderFor("Point").decode("P9"));
    }

    @Test
    @DisplayName("注册表实例之间互不影响，共享实例为单例")
    void testRegistryIsolation() {
        TypeRegistry other = TypeRegistry.withBuiltins();
        registry.extend(Point.class);

        assertTrue(registry.hasDecoder("Point"));
        assertFalse(other.hasDecoder("Point"));
        assertSame(TypeRegistry.shared(), TypeRegistry.shared());
    }

    @Test
    @DisplayName("未注册标签回退默认编解码")
    void testDefaultsForUnknownTag() {
        assertEquals("42", registry.encoderFor("Unknown").encode(42));
        assertEquals("raw:text", registry.decoderFor("Unknown").decode("raw:text"));
    }

    public static class Point {

        final int x;

        final int y;

        public Point(int x, int y) {
            this.x = x;
            this.y = y;
        }

        public String encode() {
            return x + "," + y;
        }

        public static Point decode(String payload) {
            String[] parts = payload.split(",");
            return new Point(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Point && ((Point) o).x == x && ((Point) o).y == y;
        }

        @Override
        public int hashCode() {
            return 31 * x + y;
        }
    }

    public static class Money {

        final int amount;

        public Money(int amount) {
            this.amount = amount;
        }

        public String dump() {
            return amount + "CNY";
        }

        public static Money load(String payload) {
            return new Money(Integer.parseInt(payload.replace("CNY", "")));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Money && ((Money) o).amount == amount;
        }

        @Override
        public int hashCode() {
            return amount;
        }
    }

    public static class NoCodec {
    }

    public static class FieldNamedEncode {

        public String encode = "not a method";
    }

    public static class EncodeOnly {

        final String name;

        public EncodeOnly(String name) {
            this.name = name;
        }

        public String encode() {
            return name;
        }
    }

    public static class WrongDecode {

        public String encode() {
            return "w";
        }

        public static String decode(String payload) {
            return payload;
        }
    }
}

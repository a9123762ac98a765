package com.hao.redisdict.common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 内置类型标签枚举
 *
 * 类职责：
 * 统一管理预注册类型的标签、对应 Java 类型与说明，标签即信封中冒号前的部分。
 *
 * 设计目的：
 * 1. 标签稳定，不随实现类变化（ArrayList 与 List.of 的结果都落在 List 标签下）。
 * 2. 为编解码注册提供唯一数据源。
 *
 * 核心实现思路：
 * - hierarchy 为 true 的类型按“可赋值”匹配（接口类型），其余按精确类型匹配。
 */
@Getter
@AllArgsConstructor
public enum BuiltinTypeEnum {

    // ============================
    // 1. 标量
    // ============================
    STRING("String", String.class, false, "字符串，载荷原样存储"),
    INTEGER("Integer", Integer.class, false, "32 位整数"),
    LONG("Long", Long.class, false, "64 位整数"),
    SHORT("Short", Short.class, false, "16 位整数"),
    BYTE("Byte", Byte.class, false, "8 位整数"),
    DOUBLE("Double", Double.class, false, "双精度浮点"),
    FLOAT("Float", Float.class, false, "单精度浮点"),
    BOOLEAN("Boolean", Boolean.class, false, "布尔值"),
    CHARACTER("Character", Character.class, false, "单个字符"),
    NULL("null", Void.class, false, "空值，载荷为空串"),

    // ============================
    // 2. 容器（JSON 载荷）
    // ============================
    LIST("List", List.class, true, "列表，JSON 数组"),
    MAP("Map", Map.class, true, "映射，JSON 对象"),
    SET("Set", Set.class, true, "集合，JSON 数组"),

    // ============================
    // 3. 扩展标量
    // ============================
    BIG_DECIMAL("BigDecimal", BigDecimal.class, false, "高精度小数"),
    BIG_INTEGER("BigInteger", BigInteger.class, false, "大整数"),
    BYTES("bytes", byte[].class, false, "字节数组，Base64 载荷"),
    UUID_TYPE("UUID", UUID.class, false, "UUID"),
    INSTANT("Instant", Instant.class, false, "时间点，ISO-8601"),
    LOCAL_DATE("LocalDate", LocalDate.class, false, "日期，ISO-8601"),
    LOCAL_DATE_TIME("LocalDateTime", LocalDateTime.class, false, "日期时间，ISO-8601"),
    DURATION("Duration", Duration.class, false, "时长，ISO-8601");

    private final String tag;
    private final Class<?> javaType;
    private final boolean hierarchy;
    private final String desc;
}

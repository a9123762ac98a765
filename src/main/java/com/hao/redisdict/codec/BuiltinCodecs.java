package com.hao.redisdict.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import com.hao.redisdict.common.enums.BuiltinTypeEnum;
import com.hao.redisdict.common.exception.EncodingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.UUID;

/**
 * 内置类型编解码定义
 *
 * 类职责：
 * 为 {@link BuiltinTypeEnum} 中的每个标签提供一对编解码函数，按枚举声明的 Java 类型与匹配方式写入注册表。
 *
 * 核心实现思路：
 * - 标量使用 toString / valueOf 互逆转换。
 * - 容器类型使用 Jackson 序列化为 JSON，嵌套元素按 JSON 的自然类型还原
 *   （整数为 Integer/Long，小数为 Double，对象为 LinkedHashMap）。
 * - 字节数组使用 Base64。
 *
 * 已知限制：
 * 容器载荷不携带元素类型，读回时元素类型可能与写入时不同。
 * 例如 {@code List.of(1L)} 读回为 {@code [1]}（元素为 Integer），Float 元素读回为 Double，
 * 此时 {@code decode(encode(v)).equals(v)} 不成立。需要保持元素类型时应注册自定义类型。
 */
final class BuiltinCodecs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<ArrayList<Object>> LIST_TYPE = new TypeReference<>() {
    };

    private static final TypeReference<LinkedHashMap<Object, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private static final TypeReference<LinkedHashSet<Object>> SET_TYPE = new TypeReference<>() {
    };

    private static final Encoder<Object> TO_STRING = String::valueOf;

    private static final Encoder<Object> TO_JSON = BuiltinCodecs::toJson;

    private BuiltinCodecs() {
    }

    /**
     * 注册全部内置类型
     *
     * 实现逻辑：
     * 1. 遍历枚举，标签、Java 类型与是否按可赋值匹配均取自枚举定义。
     * 2. 编解码函数按枚举常量选择。
     *
     * @param registry 目标注册表
     */
    static void registerAll(TypeRegistry registry) {
        for (BuiltinTypeEnum type : BuiltinTypeEnum.values()) {
            registry.registerBuiltin(type, encoderOf(type), decoderOf(type));
        }
    }

    private static Encoder<?> encoderOf(BuiltinTypeEnum type) {
        switch (type) {
            case STRING:
                return (Encoder<String>) value -> value;
            case NULL:
                return (Encoder<Object>) value -> "";
            case LIST:
            case MAP:
            case SET:
                return TO_JSON;
            case BYTES:
                return (Encoder<byte[]>) value -> BaseEncoding.base64().encode(value);
            default:
                // 其余标量的 toString 即载荷
                return TO_STRING;
        }
    }

    private static Decoder<?> decoderOf(BuiltinTypeEnum type) {
        switch (type) {
            case STRING:
                return (Decoder<String>) payload -> payload;
            case INTEGER:
                return (Decoder<Integer>) Integer::valueOf;
            case LONG:
                return (Decoder<Long>) Long::valueOf;
            case SHORT:
                return (Decoder<Short>) Short::valueOf;
            case BYTE:
                return (Decoder<Byte>) Byte::valueOf;
            case DOUBLE:
                return (Decoder<Double>) Double::valueOf;
            case FLOAT:
                return (Decoder<Float>) Float::valueOf;
            case BOOLEAN:
                return (Decoder<Boolean>) Boolean::valueOf;
            case CHARACTER:
                return (Decoder<Character>) BuiltinCodecs::toCharacter;
            case NULL:
                return (Decoder<Object>) payload -> null;
            case LIST:
                return (Decoder<ArrayList<Object>>) payload -> fromJson(payload, LIST_TYPE);
            case MAP:
                return (Decoder<LinkedHashMap<Object, Object>>) payload -> fromJson(payload, MAP_TYPE);
            case SET:
                return (Decoder<LinkedHashSet<Object>>) payload -> fromJson(payload, SET_TYPE);
            case BIG_DECIMAL:
                return (Decoder<BigDecimal>) BigDecimal::new;
            case BIG_INTEGER:
                return (Decoder<BigInteger>) BigInteger::new;
            case BYTES:
                return (Decoder<byte[]>) payload -> BaseEncoding.base64().decode(payload);
            case UUID_TYPE:
                return (Decoder<UUID>) UUID::fromString;
            case INSTANT:
                return (Decoder<Instant>) Instant::parse;
            case LOCAL_DATE:
                return (Decoder<LocalDate>) LocalDate::parse;
            case LOCAL_DATE_TIME:
                return (Decoder<LocalDateTime>) LocalDateTime::parse;
            case DURATION:
                return (Decoder<Duration>) Duration::parse;
            default:
                throw new IllegalStateException("内置类型缺少解码函数: " + type.getTag());
        }
    }

    private static Character toCharacter(String payload) {
        if (payload.length() != 1) {
            throw new EncodingException("Character 载荷长度必须为 1: " + payload.length());
        }
        return payload.charAt(0);
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EncodingException("容器值无法序列化为 JSON: " + value.getClass().getName(), e);
        }
    }

    private static <T> T fromJson(String payload, TypeReference<T> type) {
        try {
            return MAPPER.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new EncodingException("JSON 载荷无法还原: " + type.getType(), e);
        }
    }
}

package com.hao.redisdict.common.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 单键读取结果
 * <p>
 * 类职责：
 * 区分“键不存在”与“键存在但值为 null”两种情况，供不抛异常的读取接口使用。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Lookup {

    private static final Lookup MISSING = new Lookup(false, null);

    /** 键是否存在 */
    private final boolean found;

    /** 解码后的值，键不存在时为 null */
    private final Object value;

    public static Lookup found(Object value) {
        return new Lookup(true, value);
    }

    public static Lookup missing() {
        return MISSING;
    }

    /**
     * 命中时返回值，否则返回默认值
     *
     * @param defaultValue 默认值
     * @return 值或默认值
     */
    public Object orElse(Object defaultValue) {
        return found ? value : defaultValue;
    }
}

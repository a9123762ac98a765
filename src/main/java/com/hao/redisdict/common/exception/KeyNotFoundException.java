package com.hao.redisdict.common.exception;

import lombok.Getter;

import java.util.NoSuchElementException;

/**
 * 键不存在异常
 *
 * 类职责：
 * 对应字典语义中的“键错误”：按键读取缺失、严格模式删除缺失、无默认值的 pop、空字典 popItem。
 */
@Getter
public class KeyNotFoundException extends NoSuchElementException {

    /** 缺失的键，popItem 空字典场景为 null */
    private final String key;

    public KeyNotFoundException(String key) {
        super("键不存在: " + key);
        this.key = key;
    }

    private KeyNotFoundException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * 空字典弹出异常
     *
     * @return 不携带键的异常实例
     */
    public static KeyNotFoundException empty() {
        return new KeyNotFoundException(null, "popItem(): 字典为空");
    }
}

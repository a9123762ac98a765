package com.hao.redisdict.common.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Utf8;
import com.hao.redisdict.common.constants.RedisDictConstants;
import com.hao.redisdict.common.exception.ValidationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 写入前输入校验工具
 *
 * 类职责：
 * 在任何网络调用之前校验键与字符串值的字节长度，超过上限立即失败。
 *
 * 设计目的：
 * 1. 失败发生在本地，保证校验失败时不会产生部分写入。
 * 2. 上限按 UTF-8 字节数计算，与存储端的字符串大小口径一致。
 *
 * 核心实现思路：
 * - 只校验字符串类型，其他类型的值编码后由存储端自行约束。
 * - 长度等于上限视为合法，超过 1 字节即拒绝。
 */
@Slf4j
@Getter
public class InputValidator {

    private final long maxStringSize;

    public InputValidator() {
        this(RedisDictConstants.MAX_STRING_SIZE);
    }

    public InputValidator(long maxStringSize) {
        Preconditions.checkArgument(maxStringSize > 0, "maxStringSize 必须大于 0");
        this.maxStringSize = maxStringSize;
    }

    /**
     * 校验一次写入的键与值
     *
     * 实现逻辑：
     * 1. 校验键的字节长度。
     * 2. 值为字符串时校验其字节长度。
     *
     * @param key 业务键
     * @param value 待写入的值
     */
    public void validate(String key, Object value) {
        Preconditions.checkNotNull(key, "key 不能为空");
        checkSize(key, "key");
        if (value instanceof String) {
            checkSize((String) value, "value");
        }
    }

    /**
     * 判断字符串是否在上限以内
     *
     * @param text 字符串
     * @return 是否合法
     */
    public boolean isValid(String text) {
        return Utf8.encodedLength(text) <= maxStringSize;
    }

    private void checkSize(String text, String name) {
        if (!isValid(text)) {
            log.warn("写入参数超过大小上限|Input_size_exceeded,name={},limit={}", name, maxStringSize);
            throw new ValidationException(name + " 超过最大字符串大小限制: " + maxStringSize + " 字节");
        }
    }
}

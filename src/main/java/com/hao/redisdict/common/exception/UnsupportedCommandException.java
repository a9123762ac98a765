package com.hao.redisdict.common.exception;

import lombok.Getter;

/**
 * 存储命令不支持异常
 *
 * 类职责：
 * 存储实现不具备某条命令（如 SCAN）时，多键便捷操作显式报错，而不是静默返回空结果。
 */
@Getter
public class UnsupportedCommandException extends UnsupportedOperationException {

    private final String command;

    public UnsupportedCommandException(String command) {
        super("当前存储实现不支持命令: " + command);
        this.command = command;
    }
}

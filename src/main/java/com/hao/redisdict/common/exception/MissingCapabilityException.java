package com.hao.redisdict.common.exception;

import lombok.Getter;

/**
 * 类型能力缺失异常
 *
 * 类职责：
 * 通过方法名注册自定义类型时，若类型缺少对应的可调用成员则抛出。
 */
@Getter
public class MissingCapabilityException extends RedisDictException {

    private final Class<?> type;

    private final String member;

    public MissingCapabilityException(Class<?> type, String member, String detail) {
        super("类型 " + type.getName() + " 未实现所需的 " + member + " 方法: " + detail);
        this.type = type;
        this.member = member;
    }
}

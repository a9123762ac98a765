package com.hao.redisdict.common.exception;

/**
 * 合并操作数类型不匹配异常
 *
 * 类职责：
 * 字典并集类操作收到非 Map 操作数时抛出。
 */
public class TypeMismatchException extends RedisDictException {

    public TypeMismatchException(String message) {
        super(message);
    }
}

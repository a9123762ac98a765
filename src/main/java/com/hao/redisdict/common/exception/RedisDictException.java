package com.hao.redisdict.common.exception;

/**
 * 字典层基础异常
 *
 * 类职责：
 * 作为字典层自定义异常的公共父类，便于调用方统一捕获。
 *
 * 实现思路：
 * - 继承 RuntimeException，属于非受检异常，调用方无需显式声明。
 */
public class RedisDictException extends RuntimeException {

    public RedisDictException(String message) {
        super(message);
    }

    public RedisDictException(String message, Throwable cause) {
        super(message, cause);
    }
}

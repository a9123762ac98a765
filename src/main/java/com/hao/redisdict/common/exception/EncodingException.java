package com.hao.redisdict.common.exception;

/**
 * 编解码异常
 *
 * 类职责：
 * 值无法编码为信封，或信封格式损坏、载荷无法还原时抛出。
 */
public class EncodingException extends RedisDictException {

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}

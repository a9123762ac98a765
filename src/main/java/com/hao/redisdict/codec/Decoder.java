package com.hao.redisdict.codec;

/**
 * 值解码函数：把信封载荷字符串还原为实例。
 *
 * @param <T> 还原出的类型
 */
@FunctionalInterface
public interface Decoder<T> {

    T decode(String payload);
}

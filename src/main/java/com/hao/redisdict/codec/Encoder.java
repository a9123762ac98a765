package com.hao.redisdict.codec;

/**
 * 值编码函数：把某类型的实例转换为信封载荷字符串。
 *
 * @param <T> 被编码的类型
 */
@FunctionalInterface
public interface Encoder<T> {

    String encode(T value);
}

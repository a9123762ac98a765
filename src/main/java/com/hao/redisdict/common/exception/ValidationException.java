package com.hao.redisdict.common.exception;

/**
 * 输入校验异常
 *
 * 类职责：
 * 键或值超过字符串大小上限时抛出，发生在任何网络调用之前。
 *
 * 实现思路：
 * - 继承 IllegalArgumentException，与“参数非法”的语义保持一致。
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}

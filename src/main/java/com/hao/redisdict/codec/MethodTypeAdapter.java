package com.hao.redisdict.codec;

import com.hao.redisdict.common.exception.EncodingException;
import com.hao.redisdict.common.exception.MissingCapabilityException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;

/**
 * 方法名适配器
 * <p>
 * 类职责：
 * 从类型上按名称声明的一对方法派生 {@link Encoder}/{@link Decoder}，
 * 让“类自带 encode/decode 方法”的写法与显式传函数的写法等价。
 * <p>
 * 核心实现思路：
 * - 注册时一次性完成方法查找与能力校验，之后的每次编解码只是一次方法调用。
 * - 编码方法：public 实例方法、无参数。
 * - 解码方法：public static 方法、唯一的 String 参数、返回值可赋给该类型。
 */
public final class MethodTypeAdapter {

    private MethodTypeAdapter() {
    }

    /**
     * 从实例方法派生编码函数
     *
     * @param type 类型
     * @param methodName 实例方法名
     * @param <T> 类型参数
     * @return 编码函数
     * @throws MissingCapabilityException 方法不存在或不可调用
     */
    public static <T> Encoder<T> encoderOf(Class<T> type, String methodName) {
        Method method = findPublic(type, methodName);
        if (method.getParameterCount() != 0 || Modifier.isStatic(method.getModifiers())) {
            throw new MissingCapabilityException(type, methodName, "需要无参实例方法");
        }
        method.trySetAccessible();
        return value -> String.valueOf(invoke(method, type, value));
    }

    /**
     * 从静态方法派生解码函数
     *
     * @param type 类型
     * @param methodName 静态方法名
     * @param <T> 类型参数
     * @return 解码函数
     * @throws MissingCapabilityException 方法不存在或不可调用
     */
    public static <T> Decoder<T> decoderOf(Class<T> type, String methodName) {
        Method method;
        try {
            method = type.getMethod(methodName, String.class);
        } catch (NoSuchMethodException e) {
            throw new MissingCapabilityException(type, methodName, describeAbsence(type, methodName));
        }
        if (!Modifier.isStatic(method.getModifiers())) {
            throw new MissingCapabilityException(type, methodName, "需要 static 方法");
        }
        if (!type.isAssignableFrom(method.getReturnType())) {
            throw new MissingCapabilityException(type, methodName,
                    "返回类型 " + method.getReturnType().getName() + " 不能赋值给 " + type.getName());
        }
        method.trySetAccessible();
        return payload -> type.cast(invoke(method, type, null, payload));
    }

    private static Method findPublic(Class<?> type, String methodName) {
        try {
            return type.getMethod(methodName);
        } catch (NoSuchMethodException e) {
            throw new MissingCapabilityException(type, methodName, describeAbsence(type, methodName));
        }
    }

    private static String describeAbsence(Class<?> type, String methodName) {
        boolean declared = Arrays.stream(type.getDeclaredMethods())
                .anyMatch(m -> m.getName().equals(methodName));
        if (declared) {
            return "方法存在但签名或可见性不可调用";
        }
        boolean field = Arrays.stream(type.getDeclaredFields())
                .anyMatch(f -> f.getName().equals(methodName));
        return field ? "同名成员是字段而不是方法" : "方法不存在";
    }

    private static Object invoke(Method method, Class<?> type, Object target, Object... args) {
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw new EncodingException("调用 " + type.getName() + "." + method.getName() + " 失败", e.getCause());
        } catch (IllegalAccessException e) {
            throw new EncodingException("无法访问 " + type.getName() + "." + method.getName(), e);
        }
    }
}

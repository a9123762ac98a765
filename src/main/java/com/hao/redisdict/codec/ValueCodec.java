package com.hao.redisdict.codec;

import com.google.common.base.Preconditions;
import com.hao.redisdict.common.constants.RedisDictConstants;
import com.hao.redisdict.common.exception.EncodingException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 值信封编解码
 *
 * 类职责：
 * 在类型化的值与传输字符串 {@code 标签:载荷} 之间转换，依赖 {@link TypeRegistry} 查找编解码函数。
 *
 * 核心实现思路：
 * - 编码：按运行时类型解析标签，取编码函数，拼接 标签 + ":" + 载荷。
 * - 解码：只按第一个冒号切分，载荷本身可以包含冒号。
 * - 未注册标签不报错，退化为默认解码（载荷原样返回字符串）。
 */
@Slf4j
public class ValueCodec {

    @Getter
    private final TypeRegistry registry;

    public ValueCodec(TypeRegistry registry) {
        this.registry = Preconditions.checkNotNull(registry, "registry 不能为空");
    }

    /**
     * 编码为信封
     *
     * @param value 任意值
     * @return 标签:载荷
     */
    public String encode(Object value) {
        String tag = registry.tagOf(value);
        String payload = registry.encoderFor(tag).encode(value);
        return tag + RedisDictConstants.ENVELOPE_SEPARATOR + payload;
    }

    /**
     * 解码信封
     *
     * 实现逻辑：
     * 1. 按第一个冒号切分出标签与载荷。
     * 2. 按标签查找解码函数，未注册时使用默认解码。
     *
     * @param envelope 标签:载荷
     * @return 还原后的值
     */
    public Object decode(String envelope) {
        Preconditions.checkNotNull(envelope, "envelope 不能为空");
        int index = envelope.indexOf(RedisDictConstants.ENVELOPE_SEPARATOR);
        if (index < 0) {
            throw new EncodingException("信封缺少类型标签: " + abbreviate(envelope));
        }
        String tag = envelope.substring(0, index);
        String payload = envelope.substring(index + 1);
        if (!registry.hasDecoder(tag)) {
            log.debug("未注册的类型标签，使用默认解码|Unregistered_tag_default_decode,tag={}", tag);
        }
        return registry.decoderFor(tag).decode(payload);
    }

    private static String abbreviate(String text) {
        return text.length() <= 64 ? text : text.substring(0, 64) + "...";
    }
}

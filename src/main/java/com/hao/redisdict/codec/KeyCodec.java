package com.hao.redisdict.codec;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.hao.redisdict.common.constants.RedisDictConstants;
import lombok.Getter;

/**
 * 命名空间键编解码
 *
 * 类职责：
 * 负责 {@code 命名空间:业务键} 的拼接、还原，以及 SCAN 匹配模式与有序变体索引键的生成。
 *
 * 设计目的：
 * 1. 所有键都带命名空间前缀，多个字典共享同一存储时互不干扰。
 * 2. 还原只剥离固定长度前缀，业务键中的冒号不做转义。
 */
public class KeyCodec {

    private static final Joiner CHAIN_JOINER = Joiner.on(RedisDictConstants.KEY_SEPARATOR);

    @Getter
    private final String namespace;

    private final String prefix;

    public KeyCodec(String namespace) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(namespace), "namespace 不能为空");
        this.namespace = namespace;
        this.prefix = namespace + RedisDictConstants.KEY_SEPARATOR;
    }

    /**
     * 业务键 -> 存储键。示例：format("a") -> "main:a"。
     */
    public String format(String key) {
        return prefix + key;
    }

    /**
     * 存储键 -> 业务键。只能用于本命名空间下的键。
     */
    public String parse(String formattedKey) {
        Preconditions.checkArgument(formattedKey.startsWith(prefix),
                "键不属于命名空间 %s: %s", namespace, formattedKey);
        return formattedKey.substring(prefix.length());
    }

    /**
     * SCAN 匹配模式。示例：scanPattern("foo") -> "main:foo*"。
     * <p>
     * 搜索词中的通配符（* ? [ ]）原样透传，按存储端 glob 语义生效。
     */
    public String scanPattern(String searchTerm) {
        return prefix + Strings.nullToEmpty(searchTerm) + RedisDictConstants.SCAN_WILDCARD;
    }

    /**
     * 有序变体使用的插入顺序索引键
     */
    public String insertionOrderKey() {
        return RedisDictConstants.INSERTION_ORDER_KEY_PREFIX + namespace;
    }

    /**
     * 链式键拼接。示例：chain(["a", "b"]) -> "a:b"。
     */
    public static String chain(Iterable<String> parts) {
        Preconditions.checkNotNull(parts, "parts 不能为空");
        return CHAIN_JOINER.join(parts);
    }
}

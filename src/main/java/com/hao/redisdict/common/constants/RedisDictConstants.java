package com.hao.redisdict.common.constants;

/**
 * 字典默认参数常量定义
 *
 * 类职责：
 * 集中管理命名空间、批量扫描、大小上限等默认值，避免魔法数字散落在各处。
 *
 * 为什么需要该类：
 * 配置类、编解码层与门面类都依赖同一组默认值，统一定义可以保证口径一致。
 */
public final class RedisDictConstants {

    private RedisDictConstants() {
    }

    /** 默认命名空间 */
    public static final String DEFAULT_NAMESPACE = "main";

    /** 命名空间与业务键之间的分隔符 */
    public static final String KEY_SEPARATOR = ":";

    /** 类型标签与载荷之间的分隔符（只按第一个出现的位置切分） */
    public static final String ENVELOPE_SEPARATOR = ":";

    /** SCAN 通配后缀 */
    public static final String SCAN_WILDCARD = "*";

    /** 普通遍历时 SCAN 的 COUNT 提示值 */
    public static final int DEFAULT_BATCH_SIZE_HINT = 200;

    /** 字符串键/值的最大字节数：500MB（500 * 2^20） */
    public static final long MAX_STRING_SIZE = 500L * 1024 * 1024;

    /** 自定义类型默认编码方法名（实例方法） */
    public static final String DEFAULT_ENCODE_METHOD = "encode";

    /** 自定义类型默认解码方法名（静态方法） */
    public static final String DEFAULT_DECODE_METHOD = "decode";

    /** 有序变体使用的插入顺序索引键前缀，完整键为 前缀 + 命名空间 */
    public static final String INSERTION_ORDER_KEY_PREFIX = "redis-dict-insertion-order-";

    /** 过期秒数下限，避免向存储发送 0 或负数 TTL */
    public static final long MIN_EXPIRE_SECONDS = 1L;
}

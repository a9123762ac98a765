package com.hao.redisdict.config;

import com.hao.redisdict.common.constants.RedisDictConstants;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * 字典配置项
 *
 * 类职责：
 * 绑定 application.yml 中 redis-dict 前缀下的配置，作为 RedisDict 的构造参数。
 * <pre>
 * redis-dict:
 *   namespace: main
 *   expire: 60            # 不带单位时按秒解析
 *   preserve-expiration: false
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "redis-dict")
public class RedisDictProperties {

    /** 命名空间，所有键以 namespace: 为前缀 */
    private String namespace = RedisDictConstants.DEFAULT_NAMESPACE;

    /** 默认过期时长，不配置表示不过期 */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration expire;

    /** 更新已存在的键时是否保留其剩余 TTL */
    private boolean preserveExpiration = false;

    /** 删除不存在的键时是否抛出异常 */
    private boolean raiseOnMissingDelete = false;

    /** SCAN 每轮 COUNT 提示，同时作为清空时批量 DEL 的分片大小 */
    private int batchSizeHint = RedisDictConstants.DEFAULT_BATCH_SIZE_HINT;

    /** 自定义类型的编码实例方法名 */
    private String encodeMethodName = RedisDictConstants.DEFAULT_ENCODE_METHOD;

    /** 自定义类型的解码静态方法名 */
    private String decodeMethodName = RedisDictConstants.DEFAULT_DECODE_METHOD;

    /** 是否使用进程级共享的类型注册表 */
    private boolean sharedRegistry = false;

    /**
     * 以指定命名空间创建默认配置
     */
    public static RedisDictProperties of(String namespace) {
        RedisDictProperties properties = new RedisDictProperties();
        properties.setNamespace(namespace);
        return properties;
    }
}

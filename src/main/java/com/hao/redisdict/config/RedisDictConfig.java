package com.hao.redisdict.config;

import com.hao.redisdict.codec.TypeRegistry;
import com.hao.redisdict.dict.RedisDict;
import com.hao.redisdict.integration.redis.RedisStoreClient;
import com.hao.redisdict.integration.redis.StoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 字典装配配置类
 * <p>
 * 类职责：
 * 把 redis-dict 配置、类型注册表与存储客户端组装为可注入的 RedisDict。
 *
 * 核心实现思路：
 * - 类型注册表默认每个容器一份；sharedRegistry=true 时使用进程级共享实例。
 * - 业务方自行声明同类型 Bean 时以业务方为准。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisDictProperties.class)
public class RedisDictConfig {

    @Bean
    @ConditionalOnMissingBean
    public TypeRegistry typeRegistry(RedisDictProperties properties) {
        return properties.isSharedRegistry() ? TypeRegistry.shared() : TypeRegistry.withBuiltins();
    }

    @Bean
    @ConditionalOnMissingBean
    public StoreClient storeClient(StringRedisTemplate stringRedisTemplate) {
        return new RedisStoreClient(stringRedisTemplate);
    }

    /**
     * 按配置创建默认命名空间的字典
     *
     * @param storeClient 存储客户端
     * @param typeRegistry 类型注册表
     * @param properties 字典配置
     * @return 字典实例
     */
    @Bean
    @ConditionalOnMissingBean
    public RedisDict redisDict(StoreClient storeClient, TypeRegistry typeRegistry, RedisDictProperties properties) {
        log.info("字典装配|Redis_dict_wiring,namespace={},sharedRegistry={}",
                properties.getNamespace(), properties.isSharedRegistry());
        return new RedisDict(storeClient, typeRegistry, properties);
    }
}

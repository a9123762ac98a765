package com.hao.redisdict.config;

import io.lettuce.core.api.StatefulConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 连接配置类
 * <p>
 * 类职责：
 * 构建 Lettuce 连接工厂与 StringRedisTemplate，供字典的存储客户端使用。
 *
 * 设计目的：
 * 1. 统一 Redis 连接与连接池配置，避免多处重复。
 * 2. 同一份配置同时支持单机与集群两种部署。
 *
 * 核心实现思路：
 * - 读取 RedisProperties：配置了 cluster.nodes 时走集群，否则走单机 host/port/database。
 * - 连接池参数来自 spring.data.redis.lettuce.pool。
 * - 关闭原生连接共享，管道句柄独占池中的连接，不会与直连命令交错。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    /**
     * 创建并配置 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 按是否配置集群节点选择集群或单机配置。
     * 2. 组装连接池与命令超时，构建池化客户端配置。
     * 3. 关闭连接共享，生命周期交由容器管理。
     *
     * @return 连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        RedisProperties.Pool pool = redisProperties.getLettuce().getPool();
        if (pool != null) {
            poolConfig.setMaxTotal(pool.getMaxActive());
            poolConfig.setMaxIdle(pool.getMaxIdle());
            poolConfig.setMinIdle(pool.getMinIdle());
            poolConfig.setMaxWait(pool.getMaxWait());
        }

        // 默认命令超时 5 秒
        Duration timeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : Duration.ofSeconds(5);
        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .commandTimeout(timeout)
                .poolConfig(poolConfig)
                .build();

        LettuceConnectionFactory connectionFactory;
        RedisProperties.Cluster cluster = redisProperties.getCluster();
        if (cluster != null && !CollectionUtils.isEmpty(cluster.getNodes())) {
            RedisClusterConfiguration config = new RedisClusterConfiguration(cluster.getNodes());
            if (cluster.getMaxRedirects() != null) {
                config.setMaxRedirects(cluster.getMaxRedirects());
            }
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(redisProperties.getPassword());
            }
            connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
            log.info("Redis集群连接工厂创建完成|Redis_cluster_factory_created,nodes={},poolMax={}",
                    cluster.getNodes(), poolConfig.getMaxTotal());
        } else {
            RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(
                    redisProperties.getHost(), redisProperties.getPort());
            config.setDatabase(redisProperties.getDatabase());
            if (StringUtils.hasText(redisProperties.getUsername())) {
                config.setUsername(redisProperties.getUsername());
            }
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(RedisPassword.of(redisProperties.getPassword()));
            }
            connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
            log.info("Redis单机连接工厂创建完成|Redis_standalone_factory_created,host={},port={},database={},poolMax={}",
                    redisProperties.getHost(), redisProperties.getPort(), redisProperties.getDatabase(),
                    poolConfig.getMaxTotal());
        }

        connectionFactory.setValidateConnection(true);
        // 核心代码：关闭连接共享
        connectionFactory.setShareNativeConnection(false);
        return connectionFactory;
    }

    /**
     * 配置 StringRedisTemplate，键和值都按 UTF-8 字符串序列化，与信封格式一致
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.afterPropertiesSet();
        log.info("StringRedisTemplate初始化完成|StringRedisTemplate_init_done");
        return template;
    }
}

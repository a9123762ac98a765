package com.hao.redisdict.integration.redis;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.util.CloseableIterator;

import java.util.Objects;
import java.util.Properties;

/**
 * StoreClient 接口实现
 *
 * 类职责：
 * 基于 StringRedisTemplate 执行字典层的命令词汇，提供游标扫描与管道句柄。
 *
 * 设计目的：
 * 1. 统一 Redis 调用方式，字典层只构造命令，不感知模板与连接。
 * 2. 回复统一归一化为 String / Long / List，便于上层解码。
 *
 * 核心实现思路：
 * - 直连命令通过模板回调执行，暴露原生连接以便对 SET ... GET 指定输出类型。
 * - SCAN 直接使用模板游标，COUNT 仅作为每轮往返的批量提示。
 * - 管道句柄独占一条连接，提交后释放。
 */
@Slf4j
public class RedisStoreClient implements StoreClient {

    private final StringRedisTemplate redisTemplate;

    public RedisStoreClient(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Preconditions.checkNotNull(redisTemplate, "redisTemplate 不能为空");
    }

    /** 直连执行一条命令。示例：GETDEL main:a。 */
    @Override
    public Object dispatch(StoreCommand command) {
        // 实现思路：
        // 1. 在模板回调中把命令翻译为连接调用。
        // 2. 归一化回复类型。
        Object reply = redisTemplate.execute(
                (RedisCallback<Object>) connection -> RedisCommandExecutor.apply(connection, command), true);
        log.debug("命令执行完成|Command_executed,command={},key={}", command.getName(), command.key());
        return RedisCommandExecutor.normalize(reply, command.getReplyType());
    }

    /** 通用 -> SCAN：迭代遍历键。示例：SCAN 0 MATCH main:* COUNT 200。 */
    @Override
    public CloseableIterator<String> scan(String pattern, Integer countHint) {
        Preconditions.checkArgument(pattern != null && !pattern.isEmpty(), "pattern 不能为空");
        ScanOptions.ScanOptionsBuilder builder = ScanOptions.scanOptions().match(pattern);
        if (countHint != null) {
            builder.count(countHint);
        }
        return redisTemplate.scan(builder.build());
    }

    @Override
    public StorePipeline openPipeline() {
        RedisConnectionFactory factory = Objects.requireNonNull(redisTemplate.getConnectionFactory(),
                "StringRedisTemplate 未配置连接工厂");
        return new RedisStorePipeline(factory.getConnection());
    }

    /** 服务端 -> INFO：服务信息与统计。 */
    @Override
    public Properties info() {
        Properties properties = redisTemplate.execute(
                (RedisCallback<Properties>) connection -> connection.serverCommands().info());
        return properties != null ? properties : new Properties();
    }
}

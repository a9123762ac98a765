package com.hao.redisdict.integration.redis;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisKeyCommands;
import org.springframework.data.redis.connection.RedisServerCommands;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.AdditionalMatchers.aryEq;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * 基于 StringRedisTemplate 的存储客户端测试
 *
 * 测试目的：
 * 1. 验证命令到 Spring Data Redis 类型化调用的映射与回复归一化。
 * 2. 验证 SCAN 参数、管道句柄的打开、提交与连接释放。
 *
 * 设计思路：
 * - 使用 Mockito 模拟模板与连接，不依赖真实 Redis。
 * - 模板回调直接在模拟连接上执行。
 */
@Slf4j
class RedisStoreClientTest {

    private StringRedisTemplate redisTemplate;

    private RedisConnection connection;

    private RedisStringCommands stringCommands;

    private RedisKeyCommands keyCommands;

    private RedisStoreClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        connection = mock(RedisConnection.class);
        stringCommands = mock(RedisStringCommands.class);
        keyCommands = mock(RedisKeyCommands.class);
        when(connection.stringCommands()).thenReturn(stringCommands);
        when(connection.keyCommands()).thenReturn(keyCommands);
        when(redisTemplate.execute(any(RedisCallback.class), eq(true)))
                .thenAnswer(invocation -> ((RedisCallback<Object>) invocation.getArgument(0)).doInRedis(connection));
        client = new RedisStoreClient(redisTemplate);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("GET：字节回复转换为字符串")
    void testGet() {
        when(stringCommands.get(aryEq(bytes("t:a")))).thenReturn(bytes("Integer:1"));

        Object reply = client.dispatch(StoreCommand.of(ReplyType.BULK, "GET", "t:a"));

        assertEquals("Integer:1", reply);
    }

    @Test
    @DisplayName("SET EX：映射为带过期的 upsert")
    void testSetWithExpire() {
        when(stringCommands.set(any(byte[].class), any(byte[].class), any(Expiration.class), any(SetOption.class)))
                .thenReturn(true);

        Object reply = client.dispatch(StoreCommand.of(ReplyType.STATUS, "SET", "t:a", "String:x", "EX", "60"));

        ArgumentCaptor<Expiration> expiration = ArgumentCaptor.forClass(Expiration.class);
        verify(stringCommands).set(aryEq(bytes("t:a")), aryEq(bytes("String:x")), expiration.capture(),
                eq(SetOption.upsert()));
        assertEquals(60L, expiration.getValue().getExpirationTimeInSeconds());
        assertEquals("OK", reply);
    }

    @Test
    @DisplayName("SET KEEPTTL：映射为保留 TTL 的写入")
    void testSetKeepTtl() {
        when(stringCommands.set(any(byte[].class), any(byte[].class), any(Expiration.class), any(SetOption.class)))
                .thenReturn(true);

        client.dispatch(StoreCommand.of(ReplyType.STATUS, "SET", "t:a", "String:x", "KEEPTTL"));

        ArgumentCaptor<Expiration> expiration = ArgumentCaptor.forClass(Expiration.class);
        verify(stringCommands).set(any(byte[].class), any(byte[].class), expiration.capture(), eq(SetOption.upsert()));
        assertTrue(expiration.getValue().isKeepTtl());
    }

    @Test
    @DisplayName("SET NX GET：走原生命令并返回旧值")
    void testSetIfAbsentGet() {
        when(connection.execute(anyString(), any(byte[][].class))).thenReturn(bytes("String:winner"));

        Object reply = client.dispatch(StoreCommand.of(ReplyType.BULK, "SET", "t:a", "String:x", "NX", "GET", "EX", "5"));

        assertEquals("String:winner", reply);
        verify(connection).execute(eq("SET"), any(byte[][].class));
        verifyNoInteractions(stringCommands);
    }

    @Test
    @DisplayName("GETDEL / EXISTS / TTL / DEL / MGET 回复归一化")
    void testKeyCommands() {
        when(stringCommands.getDel(any(byte[].class))).thenReturn(null);
        when(keyCommands.exists(any(byte[].class))).thenReturn(true);
        when(keyCommands.ttl(any(byte[].class))).thenReturn(42L);
        when(keyCommands.del(any(byte[][].class))).thenReturn(2L);
        when(stringCommands.mGet(any(byte[][].class))).thenReturn(Arrays.asList(bytes("String:a"), null));

        assertNull(client.dispatch(StoreCommand.of(ReplyType.BULK, "GETDEL", "t:a")));
        assertEquals(1L, client.dispatch(StoreCommand.of(ReplyType.INTEGER, "EXISTS", "t:a")));
        assertEquals(42L, client.dispatch(StoreCommand.of(ReplyType.INTEGER, "TTL", "t:a")));
        assertEquals(2L, client.dispatch(StoreCommand.of(ReplyType.INTEGER, "DEL", "t:a", "t:b")));
        assertEquals(Arrays.asList("String:a", null),
                client.dispatch(StoreCommand.of(ReplyType.MULTI_BULK, "MGET", "t:a", "t:b")));
    }

    @Test
    @DisplayName("SCAN：匹配模式与 COUNT 提示")
    @SuppressWarnings("unchecked")
    void testScan() {
        Cursor<String> cursor = mock(Cursor.class);
        when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(cursor);

        assertSame(cursor, client.scan("t:foo*", 200));

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redisTemplate).scan(options.capture());
        assertEquals("t:foo*", options.getValue().getPattern());
        assertEquals(200L, options.getValue().getCount());
    }

    @Test
    @DisplayName("管道：打开、入队、提交并释放连接")
    void testPipeline() {
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(factory);
        when(factory.getConnection()).thenReturn(connection);
        when(connection.closePipeline()).thenReturn(List.of(true, 1L));

        StorePipeline pipeline = client.openPipeline();
        assertNull(pipeline.dispatch(StoreCommand.of(ReplyType.STATUS, "SET", "t:a", "String:x")));
        assertNull(pipeline.dispatch(StoreCommand.of(ReplyType.INTEGER, "DEL", "t:b")));
        assertEquals(2, pipeline.size());

        List<Object> replies = pipeline.flush();

        assertEquals(List.of("OK", 1L), replies);
        verify(connection).openPipeline();
        verify(connection).close();
        assertThrows(IllegalStateException.class,
                () -> pipeline.dispatch(StoreCommand.of(ReplyType.BULK, "GET", "t:a")));
    }

    @Test
    @DisplayName("管道提交失败时仍释放连接")
    void testPipelineReleasesConnectionOnFailure() {
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(factory);
        when(factory.getConnection()).thenReturn(connection);
        when(connection.closePipeline()).thenThrow(new IllegalStateException("连接断开"));

        StorePipeline pipeline = client.openPipeline();
        pipeline.dispatch(StoreCommand.of(ReplyType.STATUS, "SET", "t:a", "String:x"));

        assertThrows(IllegalStateException.class, pipeline::flush);
        verify(connection).close();
    }

    @Test
    @DisplayName("INFO 透传服务端信息")
    @SuppressWarnings("unchecked")
    void testInfo() {
        RedisServerCommands serverCommands = mock(RedisServerCommands.class);
        Properties properties = new Properties();
        properties.setProperty("redis_version", "7.2.4");
        when(connection.serverCommands()).thenReturn(serverCommands);
        when(serverCommands.info()).thenReturn(properties);
        when(redisTemplate.execute(any(RedisCallback.class)))
                .thenAnswer(invocation -> ((RedisCallback<Object>) invocation.getArgument(0)).doInRedis(connection));

        assertEquals("7.2.4", client.info().getProperty("redis_version"));
    }
}

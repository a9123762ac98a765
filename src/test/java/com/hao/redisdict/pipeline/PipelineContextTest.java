package com.hao.redisdict.pipeline;

import com.hao.redisdict.integration.redis.ReplyType;
import com.hao.redisdict.integration.redis.StoreCommand;
import com.hao.redisdict.support.InMemoryStoreClient;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 管道状态机测试
 *
 * 测试目的：
 * 1. 验证嵌套作用域只打开一次句柄、只提交一次。
 * 2. 验证作用域体抛出异常时已入队命令仍会提交，并恢复直连。
 * 3. 验证重复关闭无副作用。
 */
@Slf4j
class PipelineContextTest {

    private InMemoryStoreClient store;

    private PipelineContext context;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        context = new PipelineContext(store, "t");
    }

    private static StoreCommand set(String key, String value) {
        return StoreCommand.of(ReplyType.STATUS, "SET", key, value);
    }

    @Test
    @DisplayName("空闲状态下命令直连执行")
    void testIdleDispatchesDirectly() {
        assertFalse(context.isActive());
        assertSame(store, context.sink());

        context.sink().dispatch(set("t:a", "String:1"));

        assertEquals("String:1", store.raw("t:a"));
        assertEquals(1, store.getRoundTrips());
    }

    @Test
    @DisplayName("嵌套作用域：最外层退出时一次往返提交")
    void testNestedScopesFlushOnce() {
        try (PipelineScope ignored = context.enter()) {
            context.sink().dispatch(set("t:a", "String:1"));
            try (PipelineScope nested = context.enter()) {
                assertEquals(2, context.getDepth());
                context.sink().dispatch(set("t:b", "String:2"));
            }
            assertEquals(1, context.getDepth());
            assertNull(store.raw("t:a"), "提交前存储中不可见");
            context.sink().dispatch(set("t:c", "String:3"));
        }

        assertEquals(0, context.getDepth());
        assertEquals(1, store.getPipelinesOpened());
        assertEquals(1, store.getRoundTrips());
        assertEquals("String:1", store.raw("t:a"));
        assertEquals("String:2", store.raw("t:b"));
        assertEquals("String:3", store.raw("t:c"));
        assertSame(store, context.sink());
    }

    @Test
    @DisplayName("最外层作用域返回批次回复，内层为空")
    void testScopeReplies() {
        PipelineScope outer = context.enter();
        PipelineScope inner = context.enter();
        context.sink().dispatch(set("t:a", "String:1"));
        context.sink().dispatch(StoreCommand.of(ReplyType.INTEGER, "DEL", "t:missing"));

        inner.close();
        outer.close();

        assertTrue(inner.getReplies().isEmpty());
        assertEquals(List.of("OK", 0L), outer.getReplies());
    }

    @Test
    @DisplayName("作用域体抛出异常：已入队命令仍然提交")
    void testFlushOnError() {
        assertThrows(IllegalStateException.class, () -> {
            try (PipelineScope ignored = context.enter()) {
                context.sink().dispatch(set("t:a", "String:1"));
                throw new IllegalStateException("业务异常");
            }
        });

        assertEquals("String:1", store.raw("t:a"));
        assertFalse(context.isActive());
        assertSame(store, context.sink());
    }

    @Test
    @DisplayName("重复关闭作用域无副作用")
    void testDoubleClose() {
        PipelineScope outer = context.enter();
        PipelineScope inner = context.enter();

        inner.close();
        inner.close();
        assertEquals(1, context.getDepth());

        outer.close();
        outer.close();
        assertEquals(0, context.getDepth());
        assertEquals(1, store.getRoundTrips());
    }

    @Test
    @DisplayName("空批次提交也结束作用域")
    void testEmptyBatch() {
        try (PipelineScope ignored = context.enter()) {
            assertTrue(context.isActive());
        }
        assertFalse(context.isActive());
        assertEquals(1, store.getPipelinesOpened());
    }
}

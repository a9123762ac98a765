package com.hao.redisdict.pipeline;

import com.google.common.base.Preconditions;
import com.hao.redisdict.integration.redis.CommandSink;
import com.hao.redisdict.integration.redis.StoreClient;
import com.hao.redisdict.integration.redis.StorePipeline;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;

/**
 * 管道状态机
 *
 * 类职责：
 * 维护可重入的批处理状态：深度计数器 + 最外层独占的管道句柄，并决定当前写命令的接收端。
 *
 * 设计目的：
 * 1. 无论嵌套多少层，只在最外层进入时打开句柄，只在最外层退出时提交一次。
 * 2. 作用域体抛出异常时，已入队的命令仍会在退出时发送（批处理只为减少往返，不提供回滚）。
 *
 * 核心实现思路：
 * - Idle(depth=0)：写命令直接发往存储客户端。
 * - Batching(depth>=1)：写命令进入管道句柄。
 * - 深度归零时先切回直连，再提交句柄，提交失败也不会停留在批处理状态。
 *
 * 并发说明：
 * 状态属于单个字典实例，不做线程同步；批处理期间不要在多个线程共享同一字典实例。
 */
@Slf4j
public class PipelineContext {

    private final StoreClient store;

    private final String owner;

    @Getter
    private int depth;

    private StorePipeline batch;

    public PipelineContext(StoreClient store, String owner) {
        this.store = Preconditions.checkNotNull(store, "store 不能为空");
        this.owner = owner;
    }

    /**
     * 进入一层批处理作用域
     *
     * @return 作用域，关闭即退出一层
     */
    public PipelineScope enter() {
        if (depth == 0) {
            batch = store.openPipeline();
            log.debug("管道开启|Pipeline_open,owner={}", owner);
        }
        depth++;
        return new PipelineScope(this);
    }

    /**
     * 当前写命令的接收端
     */
    public CommandSink sink() {
        return batch != null ? batch : store;
    }

    public boolean isActive() {
        return depth > 0;
    }

    List<Object> exit() {
        Preconditions.checkState(depth > 0, "管道作用域未进入");
        depth--;
        if (depth > 0) {
            return Collections.emptyList();
        }
        StorePipeline flushing = batch;
        batch = null;
        int queued = flushing.size();
        List<Object> replies = flushing.flush();
        log.debug("管道批量提交完成|Pipeline_flushed,owner={},commands={}", owner, queued);
        return replies;
    }
}

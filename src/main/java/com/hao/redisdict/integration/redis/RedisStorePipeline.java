package com.hao.redisdict.integration.redis;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于 RedisConnection 管道模式的批处理句柄
 *
 * 实现逻辑：
 * 1. 构造时独占一条连接并打开管道。
 * 2. 每条命令只入队，回复为 null。
 * 3. 提交时关闭管道取回全部回复，无论成功与否都释放连接。
 */
@Slf4j
public class RedisStorePipeline implements StorePipeline {

    private final RedisConnection connection;

    private final List<StoreCommand> queued = new ArrayList<>();

    private boolean flushed;

    RedisStorePipeline(RedisConnection connection) {
        this.connection = Preconditions.checkNotNull(connection, "connection 不能为空");
        connection.openPipeline();
    }

    @Override
    public Object dispatch(StoreCommand command) {
        Preconditions.checkState(!flushed, "管道已提交，不能继续入队");
        RedisCommandExecutor.apply(connection, command);
        queued.add(command);
        return null;
    }

    @Override
    public int size() {
        return queued.size();
    }

    @Override
    public List<Object> flush() {
        Preconditions.checkState(!flushed, "管道已提交");
        flushed = true;
        try {
            List<Object> raw = connection.closePipeline();
            if (raw == null || raw.isEmpty()) {
                return Collections.emptyList();
            }
            List<Object> replies = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                ReplyType type = i < queued.size() ? queued.get(i).getReplyType() : ReplyType.BULK;
                replies.add(RedisCommandExecutor.normalize(raw.get(i), type));
            }
            log.debug("管道提交完成|Pipeline_closed,commands={},replies={}", queued.size(), replies.size());
            return replies;
        } finally {
            connection.close();
        }
    }
}

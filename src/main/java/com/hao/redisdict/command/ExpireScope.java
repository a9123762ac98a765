package com.hao.redisdict.command;

import java.time.Duration;

/**
 * 过期时长覆盖作用域，配合 try-with-resources 使用：
 * <pre>
 * try (ExpireScope ignored = dict.expireAt(Duration.ofMinutes(5))) {
 *     dict.set("token", "abc");
 * }
 * </pre>
 * 重复关闭无副作用。
 */
public class ExpireScope implements AutoCloseable {

    private final ExpirationPolicy policy;

    private final Duration previous;

    private boolean closed;

    ExpireScope(ExpirationPolicy policy, Duration previous) {
        this.policy = policy;
        this.previous = previous;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        policy.restore(previous);
    }
}

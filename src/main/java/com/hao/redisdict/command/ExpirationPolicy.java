package com.hao.redisdict.command;

import com.hao.redisdict.common.constants.RedisDictConstants;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 过期策略配置
 *
 * 类职责：
 * 持有字典的默认过期时长与“更新时保留 TTL”开关，并支持作用域内临时覆盖过期时长。
 *
 * 核心实现思路：
 * - 覆盖通过 {@link ExpireScope} 实现，关闭作用域时恢复进入前的值，异常退出同样恢复。
 * - 发送给存储的秒数下限为 1，避免 0 或负数 TTL 在存储端语义含糊。
 */
@Slf4j
public class ExpirationPolicy {

    @Getter
    private Duration expire;

    @Getter
    private final boolean preserveExpiration;

    public ExpirationPolicy(Duration expire, boolean preserveExpiration) {
        this.expire = expire;
        this.preserveExpiration = preserveExpiration;
    }

    /**
     * 临时覆盖过期时长
     *
     * @param temporary 作用域内使用的过期时长，null 表示不过期
     * @return 作用域，关闭时恢复
     */
    public ExpireScope override(Duration temporary) {
        Duration previous = this.expire;
        this.expire = temporary;
        log.debug("过期时长临时覆盖|Expire_override_enter,previous={},current={}", previous, temporary);
        return new ExpireScope(this, previous);
    }

    void restore(Duration previous) {
        log.debug("过期时长恢复|Expire_override_exit,restored={}", previous);
        this.expire = previous;
    }

    /**
     * 当前生效的过期秒数
     *
     * @return 秒数（至少为 1），未配置过期时为 null
     */
    public Long expireSeconds() {
        if (expire == null) {
            return null;
        }
        return Math.max(RedisDictConstants.MIN_EXPIRE_SECONDS, expire.getSeconds());
    }
}

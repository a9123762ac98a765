package com.hao.redisdict.integration.redis;

/**
 * 命令接收端
 * <p>
 * 直连存储时立即执行并返回回复；管道模式下只入队，返回 null，回复在提交时统一返回。
 */
public interface CommandSink {

    /**
     * 发送一条命令
     *
     * @param command 命令
     * @return 回复：BULK 为 String 或 null，INTEGER 为 Long，STATUS 为 String，MULTI_BULK 为 List；管道模式下为 null
     */
    Object dispatch(StoreCommand command);
}

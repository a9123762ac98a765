package com.hao.redisdict.integration.redis;

import java.util.List;

/**
 * 管道批处理句柄
 * <p>
 * 类职责：
 * 在打开期间缓存所有命令，{@link #flush()} 时一次网络往返发送，并释放底层连接。
 * 一个句柄只能提交一次。
 */
public interface StorePipeline extends CommandSink {

    /**
     * 已入队的命令数
     */
    int size();

    /**
     * 发送全部已入队命令并关闭句柄
     *
     * @return 按入队顺序排列的回复
     */
    List<Object> flush();
}

package com.hao.redisdict.integration.redis;

import com.hao.redisdict.common.exception.UnsupportedCommandException;
import org.springframework.data.util.CloseableIterator;

import java.util.Properties;

/**
 * 存储客户端接口
 *
 * 类职责：
 * 定义字典层依赖的外部存储能力：单条命令直连执行、按模式游标扫描、打开管道、查询服务信息。
 *
 * 设计目的：
 * 1. 屏蔽底层客户端差异，字典层只依赖固定的命令词汇。
 * 2. 不支持 SCAN 的实现保留默认方法，多键操作会收到显式的不支持异常。
 *
 * 核心实现思路：
 * - 直连执行即 {@link CommandSink#dispatch(StoreCommand)}。
 * - 扫描返回可关闭的惰性迭代器，由调用方在提前结束时关闭。
 */
public interface StoreClient extends CommandSink {

    /**
     * 通用 -> SCAN：按模式迭代键。示例：SCAN 0 MATCH main:foo* COUNT 200。
     *
     * @param pattern 匹配模式（glob）
     * @param countHint COUNT 提示，null 表示不带 COUNT
     * @return 存储键的惰性迭代器
     */
    default CloseableIterator<String> scan(String pattern, Integer countHint) {
        throw new UnsupportedCommandException("SCAN");
    }

    /**
     * 打开一个新的管道句柄
     */
    StorePipeline openPipeline();

    /**
     * 服务端信息与统计。示例：INFO。
     */
    Properties info();
}

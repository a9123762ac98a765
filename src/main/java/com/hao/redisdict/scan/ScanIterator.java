package com.hao.redisdict.scan;

import com.google.common.base.Preconditions;
import com.hao.redisdict.codec.KeyCodec;
import com.hao.redisdict.integration.redis.StoreClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.util.CloseableIterator;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * 游标扫描迭代器
 *
 * 类职责：
 * 以惰性方式枚举命名空间（可附加子前缀）下的业务键，底层由存储端 SCAN 游标驱动。
 *
 * 设计目的：
 * 1. 首次调用 hasNext 才打开游标，构造本身不产生网络请求。
 * 2. 游标耗尽或调用方 close 时释放底层资源。
 *
 * 使用约束：
 * 中途停止遍历时必须调用 close，否则游标占用的存储连接不会归还。
 *
 * 核心实现思路：
 * - 匹配模式由 {@link KeyCodec#scanPattern(String)} 生成，返回前剥离命名空间前缀。
 * - 扫描期间发生的并发写入可能出现也可能不出现，语义与存储端 SCAN 一致（同一键可能重复返回）。
 */
@Slf4j
public class ScanIterator implements Iterator<String>, AutoCloseable {

    private final StoreClient store;

    private final KeyCodec keyCodec;

    private final String pattern;

    private final Integer countHint;

    private CloseableIterator<String> cursor;

    private boolean closed;

    public ScanIterator(StoreClient store, KeyCodec keyCodec, String searchTerm, Integer countHint) {
        this.store = Preconditions.checkNotNull(store, "store 不能为空");
        this.keyCodec = Preconditions.checkNotNull(keyCodec, "keyCodec 不能为空");
        this.pattern = keyCodec.scanPattern(searchTerm);
        this.countHint = countHint;
    }

    @Override
    public boolean hasNext() {
        if (closed) {
            return false;
        }
        if (cursor == null) {
            cursor = store.scan(pattern, countHint);
            log.debug("扫描游标开启|Scan_cursor_open,pattern={},count={}", pattern, countHint);
        }
        if (cursor.hasNext()) {
            return true;
        }
        close();
        return false;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("扫描已结束: " + pattern);
        }
        return keyCodec.parse(cursor.next());
    }

    /**
     * 取第一个匹配键后关闭游标
     *
     * @return 业务键，无匹配时为 null
     */
    public String first() {
        try {
            return hasNext() ? next() : null;
        } finally {
            close();
        }
    }

    /**
     * 遍历计数后关闭游标
     */
    public int count() {
        int count = 0;
        try {
            while (hasNext()) {
                next();
                count++;
            }
        } finally {
            close();
        }
        return count;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (cursor != null) {
            cursor.close();
        }
    }
}

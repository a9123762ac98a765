package com.hao.redisdict.dict;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.hao.redisdict.codec.Decoder;
import com.hao.redisdict.codec.Encoder;
import com.hao.redisdict.codec.KeyCodec;
import com.hao.redisdict.codec.TypeRegistry;
import com.hao.redisdict.codec.ValueCodec;
import com.hao.redisdict.command.CommandBuilder;
import com.hao.redisdict.command.ExpirationPolicy;
import com.hao.redisdict.command.ExpireScope;
import com.hao.redisdict.common.exception.KeyNotFoundException;
import com.hao.redisdict.common.exception.TypeMismatchException;
import com.hao.redisdict.common.model.Lookup;
import com.hao.redisdict.common.util.InputValidator;
import com.hao.redisdict.config.RedisDictProperties;
import com.hao.redisdict.integration.redis.StoreClient;
import com.hao.redisdict.pipeline.PipelineContext;
import com.hao.redisdict.pipeline.PipelineScope;
import com.hao.redisdict.scan.ScanIterator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Redis 字典
 *
 * 类职责：
 * 把一个命名空间下的 Redis 字符串键呈现为可变的类型化字典：按键读写、遍历、批量更新、默认值与过期。
 *
 * 设计目的：
 * 1. 值以 {@code 类型标签:载荷} 信封存储，读回时还原原始类型。
 * 2. 条件写入与取出借助存储端原子命令完成，多个进程并发操作同一键时结果收敛。
 * 3. 批量写入可放入管道作用域，最外层作用域退出时一次往返提交。
 *
 * 为什么需要该类：
 * 业务代码希望像操作 Map 一样使用 Redis，又不想在每个调用点处理键前缀、序列化与 TTL 细节。
 *
 * 核心实现思路：
 * - 读操作（get/exists/scan/setDefault/pop/mget）直接发往存储客户端，管道内也读不到尚未提交的写入。
 * - 遍历先把键扫描成快照再返回，游标在方法内关闭；需要惰性遍历时使用 {@link #keyIterator()} 并自行关闭。
 * - 写操作（set/delete/clear/multiDel/update）发往当前接收端，管道开启时进入批次。
 * - 多键操作依赖 SCAN，存储不支持时抛出不支持异常。
 *
 * 并发说明：
 * 实例不是线程安全的，管道作用域开启期间不要跨线程共享。
 */
@Slf4j
public class RedisDict implements Iterable<String> {

    private final StoreClient store;

    private final KeyCodec keyCodec;

    private final ValueCodec valueCodec;

    private final ExpirationPolicy expirationPolicy;

    private final CommandBuilder commandBuilder;

    private final PipelineContext pipelineContext;

    private final InputValidator inputValidator;

    @Getter
    private final boolean raiseOnMissingDelete;

    @Getter
    private final int batchSizeHint;

    private final String encodeMethodName;

    private final String decodeMethodName;

    /**
     * 使用默认配置与独立注册表创建字典
     *
     * @param store 存储客户端
     * @param namespace 命名空间
     */
    public RedisDict(StoreClient store, String namespace) {
        this(store, TypeRegistry.withBuiltins(), RedisDictProperties.of(namespace));
    }

    /**
     * 使用给定注册表与配置创建字典
     */
    public RedisDict(StoreClient store, TypeRegistry registry, RedisDictProperties properties) {
        this(store, registry, properties, new InputValidator());
    }

    /**
     * 完整构造
     *
     * @param store 存储客户端
     * @param registry 类型注册表
     * @param properties 字典配置，batchSizeHint 必须大于 0
     * @param inputValidator 写入前的本地校验器
     */
    public RedisDict(StoreClient store, TypeRegistry registry, RedisDictProperties properties,
                     InputValidator inputValidator) {
        Preconditions.checkNotNull(properties, "properties 不能为空");
        Preconditions.checkArgument(properties.getBatchSizeHint() > 0, "batchSizeHint 必须大于 0");
        this.store = Preconditions.checkNotNull(store, "store 不能为空");
        this.keyCodec = new KeyCodec(properties.getNamespace());
        this.valueCodec = new ValueCodec(registry);
        this.expirationPolicy = new ExpirationPolicy(properties.getExpire(), properties.isPreserveExpiration());
        this.commandBuilder = new CommandBuilder(expirationPolicy);
        this.pipelineContext = new PipelineContext(store, properties.getNamespace());
        this.inputValidator = Preconditions.checkNotNull(inputValidator, "inputValidator 不能为空");
        this.raiseOnMissingDelete = properties.isRaiseOnMissingDelete();
        this.batchSizeHint = properties.getBatchSizeHint();
        this.encodeMethodName = properties.getEncodeMethodName();
        this.decodeMethodName = properties.getDecodeMethodName();
        log.info("字典实例创建完成|Redis_dict_created,namespace={},expire={},preserveExpiration={}",
                properties.getNamespace(), properties.getExpire(), properties.isPreserveExpiration());
    }

    // 区域：单键读写

    /**
     * 读取键，不因缺失抛异常
     *
     * @param key 业务键
     * @return 读取结果，区分缺失与 null 值
     */
    public Lookup lookup(String key) {
        Object reply = store.dispatch(commandBuilder.get(keyCodec.format(key)));
        if (reply == null) {
            return Lookup.missing();
        }
        return Lookup.found(valueCodec.decode((String) reply));
    }

    /**
     * 读取键
     *
     * @param key 业务键
     * @return 解码后的值
     * @throws KeyNotFoundException 键不存在
     */
    public Object get(String key) {
        Lookup lookup = lookup(key);
        if (!lookup.isFound()) {
            throw new KeyNotFoundException(key);
        }
        return lookup.getValue();
    }

    /**
     * 读取键，缺失时返回默认值
     */
    public Object get(String key, Object defaultValue) {
        return lookup(key).orElse(defaultValue);
    }

    /**
     * 写入键
     *
     * 实现逻辑：
     * 1. 本地校验键与字符串值的大小，失败时不产生任何网络请求。
     * 2. 开启 TTL 保留时先探测键是否存在，决定 KEEPTTL 还是 EX。
     * 3. 命令发往当前接收端（管道开启时入队）。
     *
     * @param key 业务键
     * @param value 任意可编码的值
     */
    public void set(String key, Object value) {
        inputValidator.validate(key, value);
        String formattedKey = keyCodec.format(key);
        String envelope = valueCodec.encode(value);
        // 核心代码：只有开启保留时才需要额外的 EXISTS 往返
        boolean keyExists = commandBuilder.requiresExistenceCheck() && exists(formattedKey);
        pipelineContext.sink().dispatch(commandBuilder.set(formattedKey, envelope, keyExists));
    }

    /**
     * 删除键
     *
     * 严格模式下键不存在抛异常；管道内回复未知，不做检查。
     *
     * @param key 业务键
     */
    public void delete(String key) {
        String formattedKey = keyCodec.format(key);
        Object reply = pipelineContext.sink().dispatch(commandBuilder.del(Collections.singletonList(formattedKey)));
        if (raiseOnMissingDelete && !pipelineContext.isActive() && Long.valueOf(0L).equals(reply)) {
            throw new KeyNotFoundException(key);
        }
    }

    /**
     * 键是否存在（EXISTS，一次往返）
     */
    public boolean contains(String key) {
        return exists(keyCodec.format(key));
    }

    /**
     * 原子取出并删除
     *
     * @throws KeyNotFoundException 键不存在
     */
    public Object pop(String key) {
        Lookup lookup = take(key);
        if (!lookup.isFound()) {
            throw new KeyNotFoundException(key);
        }
        return lookup.getValue();
    }

    /**
     * 原子取出并删除，缺失时返回默认值
     */
    public Object pop(String key, Object defaultValue) {
        return take(key).orElse(defaultValue);
    }

    /**
     * 任取一个键值对并删除
     *
     * 实现逻辑：
     * 1. 扫描取第一个键，没有键则抛异常。
     * 2. GETDEL 取出；键在扫描与取出之间被并发删除时重新扫描。
     *
     * @return 键值对
     * @throws KeyNotFoundException 字典为空
     */
    public Map.Entry<String, Object> popItem() {
        // 实现思路：扫描与取出不是原子的，取出落空说明键已被其他客户端删除，重新选择
        while (true) {
            String key = scanIterator(null, batchSizeHint).first();
            if (key == null) {
                throw KeyNotFoundException.empty();
            }
            Lookup lookup = take(key);
            if (lookup.isFound()) {
                return Maps.immutableEntry(key, lookup.getValue());
            }
            log.warn("弹出时键已被并发删除，重试|Pop_item_key_vanished_retry,namespace={},key={}",
                    keyCodec.getNamespace(), key);
        }
    }

    /**
     * 不存在则写入默认值，返回最终生效的值
     *
     * 实现逻辑：
     * 1. 单条 SET NX GET 完成判断与写入。
     * 2. 回复为空说明默认值已写入，返回默认值；否则返回已存在的值（并发场景下即胜出方的值）。
     *
     * @param key 业务键
     * @param defaultValue 默认值
     * @return 最终生效的值
     */
    public Object setDefault(String key, Object defaultValue) {
        inputValidator.validate(key, defaultValue);
        String formattedKey = keyCodec.format(key);
        Object reply = store.dispatch(commandBuilder.setIfAbsentGet(formattedKey, valueCodec.encode(defaultValue)));
        if (reply == null) {
            return defaultValue;
        }
        return valueCodec.decode((String) reply);
    }

    /**
     * 剩余过期秒数
     *
     * @return 秒数，键不存在或未设置过期时为空
     */
    public Optional<Long> getTtl(String key) {
        Object reply = store.dispatch(commandBuilder.ttl(keyCodec.format(key)));
        if (reply instanceof Long && (Long) reply >= 0) {
            return Optional.of((Long) reply);
        }
        return Optional.empty();
    }

    // 区域结束

    // 区域：遍历

    /**
     * 遍历全部键
     *
     * 实现逻辑：
     * 1. 完整扫描一次命名空间，得到键快照，扫描结束即关闭游标。
     * 2. 返回快照的只读迭代器，for-each 中途 break 或抛异常都不会占用连接。
     *
     * @return 键快照迭代器
     */
    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableList(scanKeys(null)).iterator();
    }

    /**
     * 惰性遍历全部键
     *
     * 游标占用一条存储连接，直到扫描结束或调用 close，应在 try-with-resources 中使用：
     * <pre>
     * try (ScanIterator keys = dict.keyIterator()) {
     *     ...
     * }
     * </pre>
     *
     * @return 未打开游标的扫描迭代器
     */
    public ScanIterator keyIterator() {
        return scanIterator(null, batchSizeHint);
    }

    /**
     * 键总数（全量扫描，不缓存）
     */
    public int size() {
        return scanIterator(null, null).count();
    }

    /**
     * 是否为空，只取第一个键
     */
    public boolean isEmpty() {
        return scanIterator(null, batchSizeHint).first() == null;
    }

    /**
     * 全部键，顺序为存储扫描顺序
     */
    public List<String> keys() {
        return scanKeys(null);
    }

    /**
     * 全部键的逆序
     */
    public List<String> reversedKeys() {
        return Lists.reverse(keys());
    }

    /**
     * 第一个以 searchTerm 开头的键
     */
    public Optional<String> key(String searchTerm) {
        return Optional.ofNullable(scanIterator(searchTerm, batchSizeHint).first());
    }

    /**
     * 全部值，与 {@link #keys()} 同序
     */
    public List<Object> values() {
        return new ArrayList<>(toMap().values());
    }

    /**
     * 全部键值对
     */
    public List<Map.Entry<String, Object>> items() {
        return new ArrayList<>(toMap().entrySet());
    }

    /**
     * 全部键值导出为普通 Map（扫描与读取之间被删除的键不出现在结果中）
     */
    public Map<String, Object> toMap() {
        return fetch(keys(), null);
    }

    /**
     * 浅拷贝为本地 Map，之后与存储无关联
     */
    public Map<String, Object> copy() {
        return toMap();
    }

    /**
     * 清空命名空间
     *
     * 实现逻辑：
     * 1. 全量扫描键，按 batchSizeHint 分片。
     * 2. 每片一条 DEL，全部放入一个管道作用域提交。
     */
    public void clear() {
        int deleted = 0;
        try (PipelineScope ignored = pipelineContext.enter();
             ScanIterator keys = scanIterator(null, null)) {
            Iterator<List<String>> batches = Iterators.partition(keys, batchSizeHint);
            while (batches.hasNext()) {
                List<String> batch = batches.next();
                pipelineContext.sink().dispatch(commandBuilder.del(formatAll(batch)));
                deleted += batch.size();
            }
        }
        log.debug("命名空间清空完成|Namespace_cleared,namespace={},keys={}", keyCodec.getNamespace(), deleted);
    }

    // 区域结束

    // 区域：批量写入

    /**
     * 批量写入，放入一个管道作用域
     */
    public void update(Map<String, ?> entries) {
        Preconditions.checkNotNull(entries, "entries 不能为空");
        try (PipelineScope ignored = pipelineContext.enter()) {
            for (Map.Entry<String, ?> entry : entries.entrySet()) {
                set(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * 以同一个值写入多个键
     *
     * @return 当前字典
     */
    public RedisDict fromKeys(Iterable<String> keys, Object value) {
        Preconditions.checkNotNull(keys, "keys 不能为空");
        try (PipelineScope ignored = pipelineContext.enter()) {
            for (String key : keys) {
                set(key, value);
            }
        }
        return this;
    }

    // 区域结束

    // 区域：链式键

    /**
     * 以多段路径组成的键写入，各段以冒号连接
     *
     * @param parts 路径段，不能为空
     * @param value 值
     */
    public void chainSet(List<String> parts, Object value) {
        set(KeyCodec.chain(parts), value);
    }

    /**
     * 读取链式键
     *
     * @throws KeyNotFoundException 键不存在
     */
    public Object chainGet(List<String> parts) {
        return get(KeyCodec.chain(parts));
    }

    /**
     * 删除链式键，语义同 {@link #delete(String)}
     */
    public void chainDel(List<String> parts) {
        delete(KeyCodec.chain(parts));
    }

    // 区域结束

    // 区域：前缀多键操作

    /**
     * 前缀匹配的全部值
     */
    public List<Object> multiGet(String prefix) {
        return new ArrayList<>(fetch(scanKeys(prefix), null).values());
    }

    /**
     * 以链式键为前缀的全部值
     */
    public List<Object> multiChainGet(List<String> parts) {
        return multiGet(KeyCodec.chain(parts));
    }

    /**
     * 前缀匹配的键值对，键为去掉前缀后的剩余部分。示例：前缀 foo 下的 foobar -> bar。
     */
    public Map<String, Object> multiDict(String prefix) {
        return fetch(scanKeys(prefix), prefix);
    }

    /**
     * 删除前缀匹配的全部键
     *
     * @return 删除数量；管道内为入队的键数量
     */
    public long multiDel(String prefix) {
        List<String> keys = scanKeys(prefix);
        if (keys.isEmpty()) {
            return 0L;
        }
        Object reply = pipelineContext.sink().dispatch(commandBuilder.del(formatAll(keys)));
        return reply instanceof Long ? (Long) reply : keys.size();
    }

    // 区域结束

    // 区域：合并与比较

    /**
     * 当前内容与另一个 Map 合并，后者覆盖前者
     *
     * @throws TypeMismatchException other 不是 Map
     */
    public Map<String, Object> union(Object other) {
        Map<String, Object> merged = toMap();
        merged.putAll(asStringMap(other, "|"));
        return merged;
    }

    /**
     * 另一个 Map 与当前内容合并，当前内容覆盖前者
     */
    public Map<String, Object> reverseUnion(Object other) {
        Map<String, Object> merged = asStringMap(other, "|");
        merged.putAll(toMap());
        return merged;
    }

    /**
     * 原地合并：把另一个 Map 的内容写入当前字典
     *
     * @return 当前字典
     */
    public RedisDict updateFrom(Object other) {
        update(asStringMap(other, "|="));
        return this;
    }

    /**
     * 内容是否与给定 Map 相同（导出全部键值后比较）
     */
    public boolean contentEquals(Map<?, ?> other) {
        return other != null && toMap().equals(other);
    }

    // 区域结束

    // 区域：作用域、类型扩展与服务信息

    /**
     * 作用域内临时使用另一个过期时长
     */
    public ExpireScope expireAt(Duration expire) {
        return expirationPolicy.override(expire);
    }

    /**
     * 进入管道作用域，最外层关闭时一次提交
     */
    public PipelineScope pipeline() {
        return pipelineContext.enter();
    }

    /**
     * 在管道作用域内执行一段写操作
     *
     * @return 批次回复，嵌套在外层作用域内时为空列表
     */
    public List<Object> pipelined(Runnable body) {
        Preconditions.checkNotNull(body, "body 不能为空");
        PipelineScope scope = pipelineContext.enter();
        try (scope) {
            body.run();
        }
        return scope.getReplies();
    }

    /**
     * 扩展自定义类型，编解码函数按配置的方法名从类型上派生
     *
     * @param type 自定义类型
     * @param <T> 类型参数
     */
    public <T> void extendType(Class<T> type) {
        extendType(type, null, null);
    }

    /**
     * 扩展自定义类型，缺少的函数按配置的方法名从类型上派生
     */
    public <T> void extendType(Class<T> type, Encoder<? super T> encoder, Decoder<? extends T> decoder) {
        valueCodec.getRegistry().extend(type, encoder, decoder, encodeMethodName, decodeMethodName);
    }

    /**
     * 存储服务端信息（INFO）
     */
    public Properties info() {
        return store.info();
    }

    /**
     * 命名空间
     */
    public String getNamespace() {
        return keyCodec.getNamespace();
    }

    /**
     * 当前生效的过期时长，作用域覆盖期间返回覆盖值
     */
    public Duration getExpire() {
        return expirationPolicy.getExpire();
    }

    /**
     * 覆盖写入时是否保留原有 TTL
     */
    public boolean isPreserveExpiration() {
        return expirationPolicy.isPreserveExpiration();
    }

    /**
     * 本字典使用的类型注册表
     */
    public TypeRegistry getTypeRegistry() {
        return valueCodec.getRegistry();
    }

    /**
     * 有序变体使用的插入顺序索引键
     */
    public String getInsertionOrderKey() {
        return keyCodec.insertionOrderKey();
    }

    @Override
    public String toString() {
        return "RedisDict(namespace=" + keyCodec.getNamespace()
                + ", expire=" + expirationPolicy.getExpire()
                + ", preserveExpiration=" + expirationPolicy.isPreserveExpiration() + ")";
    }

    // 区域结束

    private boolean exists(String formattedKey) {
        Object reply = store.dispatch(commandBuilder.exists(formattedKey));
        return reply instanceof Long && (Long) reply > 0;
    }

    private Lookup take(String key) {
        Object reply = store.dispatch(commandBuilder.getDel(keyCodec.format(key)));
        if (reply == null) {
            return Lookup.missing();
        }
        return Lookup.found(valueCodec.decode((String) reply));
    }

    private ScanIterator scanIterator(String searchTerm, Integer countHint) {
        return new ScanIterator(store, keyCodec, searchTerm, countHint);
    }

    private List<String> scanKeys(String prefix) {
        List<String> keys = new ArrayList<>();
        try (ScanIterator iterator = scanIterator(prefix, batchSizeHint)) {
            Iterators.addAll(keys, iterator);
        }
        return keys;
    }

    /**
     * 按 batchSizeHint 分片 MGET，跳过读取时已消失的键
     *
     * @param keys 业务键
     * @param stripPrefix 结果键需要去掉的前缀，null 表示保留原键
     */
    private Map<String, Object> fetch(List<String> keys, String stripPrefix) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (List<String> batch : Lists.partition(keys, batchSizeHint)) {
            Object reply = store.dispatch(commandBuilder.mget(formatAll(batch)));
            List<?> envelopes = reply instanceof List ? (List<?>) reply : Collections.emptyList();
            for (int i = 0; i < batch.size() && i < envelopes.size(); i++) {
                Object envelope = envelopes.get(i);
                if (envelope == null) {
                    continue;
                }
                String key = batch.get(i);
                String resultKey = stripPrefix != null && key.startsWith(stripPrefix)
                        ? key.substring(stripPrefix.length()) : key;
                result.put(resultKey, valueCodec.decode((String) envelope));
            }
        }
        return result;
    }

    private List<String> formatAll(List<String> keys) {
        List<String> formatted = new ArrayList<>(keys.size());
        for (String key : keys) {
            formatted.add(keyCodec.format(key));
        }
        return formatted;
    }

    private static Map<String, Object> asStringMap(Object other, String operator) {
        if (!(other instanceof Map)) {
            String otherType = other == null ? "null" : other.getClass().getSimpleName();
            throw new TypeMismatchException("unsupported operand type(s) for " + operator
                    + ": 'RedisDict' and '" + otherType + "'");
        }
        Map<String, Object> converted = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) other).entrySet()) {
            if (!(entry.getKey() instanceof String)) {
                throw new TypeMismatchException("字典键必须为字符串: " + entry.getKey());
            }
            converted.put((String) entry.getKey(), entry.getValue());
        }
        return converted;
    }
}

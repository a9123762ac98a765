package com.hao.redisdict.codec;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.hao.redisdict.common.constants.RedisDictConstants;
import com.hao.redisdict.common.enums.BuiltinTypeEnum;
import lombok.extern.slf4j.Slf4j;

import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 类型标签注册表
 *
 * 类职责：
 * 维护“标签 -> 编码函数”与“标签 -> 解码函数”两张相互独立的映射，以及“Java 类型 -> 标签”的解析表。
 *
 * 设计目的：
 * 1. 注册表是显式对象，由每个字典实例持有，注册范围可控，测试之间互不污染。
 * 2. 类型到标签的解析在注册时确定并按具体类型缓存，编码时不做反射。
 * 3. 仅在调用方主动选择时使用进程级共享实例 {@link #shared()}。
 *
 * 核心实现思路：
 * - 精确类型表优先；未命中时按注册顺序匹配可赋值的接口类型（List/Map/Set 等）。
 * - 未注册类型使用简单类名作为标签、String.valueOf 作为编码，保证写入不失败。
 * - 同一标签后写覆盖先写，不做唯一性校验。
 *
 * 并发说明：
 * 映射使用并发容器，但注册与查找之间不做协调，运行期注册应视为全局且非原子的操作。
 */
@Slf4j
public class TypeRegistry {

    private static final TypeRegistry SHARED = withBuiltins();

    private static final Encoder<Object> DEFAULT_ENCODER = String::valueOf;

    private static final Decoder<Object> DEFAULT_DECODER = payload -> payload;

    private final Map<String, Encoder<Object>> encoders = new ConcurrentHashMap<>();

    private final Map<String, Decoder<?>> decoders = new ConcurrentHashMap<>();

    private final Map<Class<?>, String> exactTags = new ConcurrentHashMap<>();

    private final List<Map.Entry<Class<?>, String>> hierarchyTags = new CopyOnWriteArrayList<>();

    private final Map<Class<?>, String> resolvedTags = new ConcurrentHashMap<>();

    /**
     * 创建预注册内置类型的注册表
     *
     * @return 新注册表
     */
    public static TypeRegistry withBuiltins() {
        TypeRegistry registry = new TypeRegistry();
        BuiltinCodecs.registerAll(registry);
        return registry;
    }

    /**
     * 进程级共享注册表，仅作为可选便利
     *
     * @return 共享实例
     */
    public static TypeRegistry shared() {
        return SHARED;
    }

    // 区域：注册

    /**
     * 注册一个完整的类型：类型绑定 + 编码 + 解码
     *
     * @param tag 标签
     * @param type Java 类型
     * @param encoder 编码函数
     * @param decoder 解码函数
     * @param <T> 类型参数
     */
    public <T> void register(String tag, Class<T> type, Encoder<? super T> encoder, Decoder<? extends T> decoder) {
        bind(type, tag, false);
        putEncoder(tag, encoder);
        registerDecoder(tag, decoder);
    }

    /**
     * 注册内置类型，标签、Java 类型与匹配方式取自枚举定义
     */
    void registerBuiltin(BuiltinTypeEnum type, Encoder<?> encoder, Decoder<?> decoder) {
        bind(type.getJavaType(), type.getTag(), type.isHierarchy());
        putEncoder(type.getTag(), encoder);
        registerDecoder(type.getTag(), decoder);
    }

    /**
     * 仅注册编码函数，标签取类型的简单类名
     *
     * @param type Java 类型
     * @param encoder 编码函数
     * @param <T> 类型参数
     */
    public <T> void registerEncoder(Class<T> type, Encoder<? super T> encoder) {
        String tag = tagName(type);
        bind(type, tag, false);
        putEncoder(tag, encoder);
    }

    /**
     * 仅注册解码函数
     *
     * @param tag 标签
     * @param decoder 解码函数
     */
    public void registerDecoder(String tag, Decoder<?> decoder) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(tag), "tag 不能为空");
        Preconditions.checkNotNull(decoder, "decoder 不能为空");
        decoders.put(tag, decoder);
    }

    /**
     * 扩展自定义类型，使用默认方法名 encode/decode
     *
     * @param type 自定义类型
     * @param <T> 类型参数
     */
    public <T> void extend(Class<T> type) {
        extend(type, null, null, null, null);
    }

    /**
     * 扩展自定义类型，显式给出编解码函数
     */
    public <T> void extend(Class<T> type, Encoder<? super T> encoder, Decoder<? extends T> decoder) {
        extend(type, encoder, decoder, null, null);
    }

    /**
     * 扩展自定义类型
     *
     * 实现逻辑：
     * 1. 两个函数都给出时直接注册。
     * 2. 缺少编码函数时，从名为 encodeMethodName 的实例方法派生；缺少解码函数时，从名为 decodeMethodName 的静态方法派生。
     * 3. 编码函数先登记，再解析解码函数。解码能力校验失败时已登记的编码函数保留，不回滚。
     *
     * @param type 自定义类型，简单类名作为标签
     * @param encoder 编码函数，可为 null
     * @param decoder 解码函数，可为 null
     * @param encodeMethodName 编码方法名，null 时为 encode
     * @param decodeMethodName 解码方法名，null 时为 decode
     * @param <T> 类型参数
     */
    public <T> void extend(Class<T> type, Encoder<? super T> encoder, Decoder<? extends T> decoder,
                           String encodeMethodName, String decodeMethodName) {
        Preconditions.checkNotNull(type, "type 不能为空");
        String tag = tagName(type);

        Encoder<? super T> resolvedEncoder = encoder != null ? encoder
                : MethodTypeAdapter.encoderOf(type, orDefault(encodeMethodName, RedisDictConstants.DEFAULT_ENCODE_METHOD));
        bind(type, tag, false);
        putEncoder(tag, resolvedEncoder);

        Decoder<? extends T> resolvedDecoder = decoder != null ? decoder
                : MethodTypeAdapter.decoderOf(type, orDefault(decodeMethodName, RedisDictConstants.DEFAULT_DECODE_METHOD));
        registerDecoder(tag, resolvedDecoder);

        log.info("自定义类型注册完成|Custom_type_registered,type={},tag={}", type.getName(), tag);
    }

    // 区域结束

    // 区域：查找

    /**
     * 解析值对应的标签
     *
     * @param value 任意值，可为 null
     * @return 标签
     */
    public String tagOf(Object value) {
        if (value == null) {
            return BuiltinTypeEnum.NULL.getTag();
        }
        return resolvedTags.computeIfAbsent(value.getClass(), this::resolveTag);
    }

    /**
     * 取编码函数，未注册时返回默认编码（String.valueOf）
     */
    public Encoder<Object> encoderFor(String tag) {
        return encoders.getOrDefault(tag, DEFAULT_ENCODER);
    }

    /**
     * 取解码函数，未注册时返回默认解码（载荷原样返回）
     */
    public Decoder<?> decoderFor(String tag) {
        return decoders.getOrDefault(tag, DEFAULT_DECODER);
    }

    /**
     * 标签是否已注册编码函数
     */
    public boolean hasEncoder(String tag) {
        return encoders.containsKey(tag);
    }

    /**
     * 标签是否已注册解码函数
     */
    public boolean hasDecoder(String tag) {
        return decoders.containsKey(tag);
    }

    // 区域结束

    static String tagName(Class<?> type) {
        String simpleName = type.getSimpleName();
        return simpleName.isEmpty() ? type.getName() : simpleName;
    }

    private String resolveTag(Class<?> type) {
        String exact = exactTags.get(type);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<Class<?>, String> entry : hierarchyTags) {
            if (entry.getKey().isAssignableFrom(type)) {
                return entry.getValue();
            }
        }
        return tagName(type);
    }

    private void bind(Class<?> type, String tag, boolean hierarchy) {
        Preconditions.checkNotNull(type, "type 不能为空");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(tag), "tag 不能为空");
        if (hierarchy) {
            hierarchyTags.removeIf(entry -> entry.getKey().equals(type));
            hierarchyTags.add(new AbstractMap.SimpleImmutableEntry<>(type, tag));
        } else {
            exactTags.put(type, tag);
        }
        // 绑定变化后缓存失效，下一次编码重新解析
        resolvedTags.clear();
    }

    @SuppressWarnings("unchecked")
    private void putEncoder(String tag, Encoder<?> encoder) {
        Preconditions.checkNotNull(encoder, "encoder 不能为空");
        encoders.put(tag, (Encoder<Object>) encoder);
    }

    private static String orDefault(String value, String defaultValue) {
        return Strings.isNullOrEmpty(value) ? defaultValue : value;
    }
}

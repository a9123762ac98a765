package com.hao.redisdict.command;

import com.google.common.base.Preconditions;
import com.hao.redisdict.integration.redis.ReplyType;
import com.hao.redisdict.integration.redis.StoreCommand;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令构造器
 *
 * 类职责：
 * 根据存储键、值信封与过期策略，产出发往存储的精确命令参数序列。
 *
 * 设计目的：
 * 1. 把 TTL 策略（固定过期、更新保留、作用域覆盖）集中在一处表达。
 * 2. 利用存储端的原子命令（SET NX GET、GETDEL）解决并发竞争，不在客户端做读改写。
 *
 * 为什么需要该类：
 * 保留 TTL 的更新与首次写入需要不同的 SET 形态，条件写入又要求单条命令完成，
 * 分散在门面各方法中容易出现 TTL 被意外重置的问题。
 *
 * 核心实现思路：
 * - 普通写入：开启保留且键已存在 -> SET KEEPTTL；否则 SET [EX 秒]。
 * - 条件写入：SET NX GET，写入只会发生在键不存在时，因此配置了过期就带 EX；
 *   开启保留且没有过期配置时带 KEEPTTL。
 * - 原子取出：GETDEL。
 */
public class CommandBuilder {

    private final ExpirationPolicy policy;

    public CommandBuilder(ExpirationPolicy policy) {
        this.policy = Preconditions.checkNotNull(policy, "policy 不能为空");
    }

    /**
     * 普通写入是否需要先探测键是否存在
     */
    public boolean requiresExistenceCheck() {
        return policy.isPreserveExpiration();
    }

    /**
     * 字符串 -> SET：普通写入。示例：SET main:a Integer:42 EX 60 / SET main:a Integer:42 KEEPTTL。
     *
     * @param formattedKey 存储键
     * @param envelope 值信封
     * @param keyExists 键当前是否存在（仅在开启保留时有意义）
     * @return 命令
     */
    public StoreCommand set(String formattedKey, String envelope, boolean keyExists) {
        List<String> args = new ArrayList<>(List.of(formattedKey, envelope));
        if (policy.isPreserveExpiration() && keyExists) {
            args.add("KEEPTTL");
        } else {
            appendExpire(args);
        }
        return StoreCommand.of(ReplyType.STATUS, "SET", args);
    }

    /**
     * 字符串 -> SET NX GET：不存在才写，并总是返回写入前的值。示例：SET main:a String:x NX GET EX 60。
     *
     * @param formattedKey 存储键
     * @param envelope 默认值信封
     * @return 命令，回复为写入前的信封或 null
     */
    public StoreCommand setIfAbsentGet(String formattedKey, String envelope) {
        List<String> args = new ArrayList<>(List.of(formattedKey, envelope, "NX", "GET"));
        if (policy.isPreserveExpiration() && policy.getExpire() == null) {
            args.add("KEEPTTL");
        } else {
            appendExpire(args);
        }
        return StoreCommand.of(ReplyType.BULK, "SET", args);
    }

    /** 字符串 -> GETDEL：原子读取并删除。示例：GETDEL main:a。 */
    public StoreCommand getDel(String formattedKey) {
        return StoreCommand.of(ReplyType.BULK, "GETDEL", formattedKey);
    }

    /** 字符串 -> GET。示例：GET main:a。 */
    public StoreCommand get(String formattedKey) {
        return StoreCommand.of(ReplyType.BULK, "GET", formattedKey);
    }

    /** 通用 -> EXISTS。示例：EXISTS main:a。 */
    public StoreCommand exists(String formattedKey) {
        return StoreCommand.of(ReplyType.INTEGER, "EXISTS", formattedKey);
    }

    /** 键过期 -> TTL。示例：TTL main:a。 */
    public StoreCommand ttl(String formattedKey) {
        return StoreCommand.of(ReplyType.INTEGER, "TTL", formattedKey);
    }

    /** 字符串 -> MGET。示例：MGET main:a main:b。 */
    public StoreCommand mget(List<String> formattedKeys) {
        Preconditions.checkArgument(!formattedKeys.isEmpty(), "MGET 至少需要一个键");
        return StoreCommand.of(ReplyType.MULTI_BULK, "MGET", formattedKeys);
    }

    /** 通用 -> DEL。示例：DEL main:a main:b。 */
    public StoreCommand del(List<String> formattedKeys) {
        Preconditions.checkArgument(!formattedKeys.isEmpty(), "DEL 至少需要一个键");
        return StoreCommand.of(ReplyType.INTEGER, "DEL", formattedKeys);
    }

    private void appendExpire(List<String> args) {
        Long seconds = policy.expireSeconds();
        if (seconds != null) {
            args.add("EX");
            args.add(String.valueOf(seconds));
        }
    }
}

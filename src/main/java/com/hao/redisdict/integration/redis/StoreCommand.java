package com.hao.redisdict.integration.redis;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * 存储命令
 *
 * 类职责：
 * 描述一条发往存储的命令：命令名、参数序列与期望的回复类型。
 *
 * 设计目的：
 * 命令构造与命令执行解耦。构造侧只产出精确的参数序列，执行侧（直连或管道）决定如何发送。
 */
@Getter
@EqualsAndHashCode
public final class StoreCommand {

    private static final Joiner SPACE_JOINER = Joiner.on(' ');

    private final String name;

    private final List<String> args;

    private final ReplyType replyType;

    private StoreCommand(String name, List<String> args, ReplyType replyType) {
        this.name = name;
        this.args = args;
        this.replyType = replyType;
    }

    public static StoreCommand of(ReplyType replyType, String name, List<String> args) {
        Preconditions.checkNotNull(replyType, "replyType 不能为空");
        Preconditions.checkArgument(name != null && !name.isBlank(), "name 不能为空");
        return new StoreCommand(name, ImmutableList.copyOf(args), replyType);
    }

    public static StoreCommand of(ReplyType replyType, String name, String... args) {
        return of(replyType, name, ImmutableList.copyOf(args));
    }

    /**
     * 第一个参数，约定为键
     */
    public String key() {
        return args.isEmpty() ? null : args.get(0);
    }

    /**
     * 是否包含某个选项（大小写不敏感）
     */
    public boolean hasOption(String option) {
        return args.stream().anyMatch(option::equalsIgnoreCase);
    }

    /**
     * 选项后紧跟的参数值，不存在时返回 null
     */
    public String optionValue(String option) {
        for (int i = 0; i < args.size() - 1; i++) {
            if (option.equalsIgnoreCase(args.get(i))) {
                return args.get(i + 1);
            }
        }
        return null;
    }

    /**
     * 完整参数序列（命令名在前）
     */
    public List<String> toArgv() {
        return ImmutableList.<String>builder().add(name).addAll(args).build();
    }

    @Override
    public String toString() {
        return SPACE_JOINER.join(toArgv());
    }
}

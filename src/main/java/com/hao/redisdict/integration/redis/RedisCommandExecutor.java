package com.hao.redisdict.integration.redis;

import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.output.ByteArrayOutput;
import org.springframework.data.redis.connection.DecoratedRedisConnection;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.connection.lettuce.LettuceConnection;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 命令到连接调用的映射
 *
 * 类职责：
 * 把 {@link StoreCommand} 翻译为 Spring Data Redis 连接上的类型化调用，并把回复归一化为
 * String / Long / List&lt;String&gt;。直连与管道共用同一套映射。
 *
 * 核心实现思路：
 * - 词汇表内的命令走类型化接口，管道模式下同样生效。
 * - SET ... NX GET 没有类型化接口，走原生 execute；先剥开模板的字符串连接包装，Lettuce 连接上显式指定字节数组输出，
 *   保证批量字符串回复按字节还原，而不是按状态回复解析。
 */
final class RedisCommandExecutor {

    private RedisCommandExecutor() {
    }

    /**
     * 在连接上执行命令
     *
     * @param connection 连接（可处于管道模式）
     * @param command 命令
     * @return 原始回复，管道模式下为 null
     */
    static Object apply(RedisConnection connection, StoreCommand command) {
        String name = command.getName().toUpperCase(Locale.ROOT);
        List<String> args = command.getArgs();
        switch (name) {
            case "GET":
                return connection.stringCommands().get(bytes(args.get(0)));
            case "GETDEL":
                return connection.stringCommands().getDel(bytes(args.get(0)));
            case "MGET":
                return connection.stringCommands().mGet(bytesArray(args));
            case "EXISTS":
                return connection.keyCommands().exists(bytes(args.get(0)));
            case "TTL":
                return connection.keyCommands().ttl(bytes(args.get(0)));
            case "DEL":
                return connection.keyCommands().del(bytesArray(args));
            case "SET":
                return command.hasOption("GET") ? setGet(connection, args) : set(connection, command);
            default:
                return connection.execute(name, bytesArray(args));
        }
    }

    /**
     * 归一化回复
     *
     * @param reply 原始回复
     * @param replyType 回复类型
     * @return String / Long / List&lt;String&gt; / null
     */
    static Object normalize(Object reply, ReplyType replyType) {
        if (reply == null) {
            return null;
        }
        if (reply instanceof byte[]) {
            return new String((byte[]) reply, StandardCharsets.UTF_8);
        }
        if (reply instanceof Boolean) {
            boolean flag = (Boolean) reply;
            if (replyType == ReplyType.STATUS) {
                return flag ? "OK" : null;
            }
            return flag ? 1L : 0L;
        }
        if (reply instanceof List) {
            List<?> items = (List<?>) reply;
            List<Object> converted = new ArrayList<>(items.size());
            for (Object item : items) {
                converted.add(normalize(item, ReplyType.BULK));
            }
            return converted;
        }
        if (reply instanceof Number && replyType == ReplyType.INTEGER) {
            return ((Number) reply).longValue();
        }
        return reply;
    }

    private static Object set(RedisConnection connection, StoreCommand command) {
        List<String> args = command.getArgs();
        return connection.stringCommands().set(bytes(args.get(0)), bytes(args.get(1)),
                expirationOf(command), setOptionOf(command));
    }

    private static Object setGet(RedisConnection connection, List<String> args) {
        byte[][] argv = bytesArray(args);
        RedisConnection target = connection instanceof DecoratedRedisConnection
                ? ((DecoratedRedisConnection) connection).getDelegate() : connection;
        if (target instanceof LettuceConnection) {
            return ((LettuceConnection) target).execute("SET", new ByteArrayOutput<>(ByteArrayCodec.INSTANCE), argv);
        }
        return target.execute("SET", argv);
    }

    private static Expiration expirationOf(StoreCommand command) {
        if (command.hasOption("KEEPTTL")) {
            return Expiration.keepTtl();
        }
        String seconds = command.optionValue("EX");
        return seconds != null ? Expiration.seconds(Long.parseLong(seconds)) : Expiration.persistent();
    }

    private static SetOption setOptionOf(StoreCommand command) {
        if (command.hasOption("NX")) {
            return SetOption.ifAbsent();
        }
        if (command.hasOption("XX")) {
            return SetOption.ifPresent();
        }
        return SetOption.upsert();
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    private static byte[][] bytesArray(List<String> args) {
        byte[][] result = new byte[args.size()][];
        for (int i = 0; i < args.size(); i++) {
            result[i] = bytes(args.get(i));
        }
        return result;
    }
}

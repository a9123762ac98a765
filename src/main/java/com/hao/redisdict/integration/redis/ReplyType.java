package com.hao.redisdict.integration.redis;

/**
 * 命令回复类型，决定存储实现如何解析回复。
 */
public enum ReplyType {

    /** 状态回复，如 SET 的 OK */
    STATUS,

    /** 单个批量字符串，可能为 null，如 GET / GETDEL / SET ... GET */
    BULK,

    /** 整数回复，如 DEL / EXISTS / TTL */
    INTEGER,

    /** 批量字符串数组，如 MGET */
    MULTI_BULK
}

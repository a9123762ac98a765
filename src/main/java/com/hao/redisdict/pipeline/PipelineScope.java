package com.hao.redisdict.pipeline;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 一层管道作用域，配合 try-with-resources 使用。
 * <p>
 * 最外层作用域关闭时提交批次，{@link #getReplies()} 返回批次回复；内层作用域关闭后回复为空列表。
 * 重复关闭无副作用。
 */
public class PipelineScope implements AutoCloseable {

    private final PipelineContext context;

    @Getter
    private List<Object> replies = Collections.emptyList();

    private boolean closed;

    PipelineScope(PipelineContext context) {
        this.context = context;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        replies = context.exit();
    }
}

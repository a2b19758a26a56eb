package com.sqlcore.backend.common;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import com.sqlcore.backend.aggregator.AggregateContext;
import com.sqlcore.common.Error;
import com.sqlcore.config.AggregationConfig;

/**
 * 同一布局的聚合上下文池。
 * <p>
 * release 时先 reset，再放回空闲队列；空闲数达到 capacity 后多余的上下文直接丢弃。
 * acquire 优先复用空闲上下文，没有时按原型新建。不加锁，可被多个 worker 并发使用。
 * 已在空闲队列中的上下文不能再次 release，保证每个上下文同一时刻只有一个持有者。
 * </p>
 */
public class AggregateContextPool implements ObjectPool<AggregateContext> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregateContextPool.class);

    private final AggregateContext prototype;
    private final int capacity;
    private final ConcurrentLinkedDeque<AggregateContext> idle = new ConcurrentLinkedDeque<>();
    /** 空闲上下文集合，AggregateContext 未覆写 equals，按引用判重 */
    private final Set<AggregateContext> idleSet = ConcurrentHashMap.newKeySet();
    private final AtomicInteger idleCount = new AtomicInteger();
    private final AtomicInteger created = new AtomicInteger();

    public AggregateContextPool(AggregateContext prototype, int capacity) {
        Preconditions.checkArgument(capacity >= 0, "pool capacity must be >= 0: %s", capacity);
        this.prototype = prototype;
        this.capacity = capacity;
    }

    /** 容量取自配置项 pool-capacity */
    public AggregateContextPool(AggregateContext prototype, AggregationConfig config) {
        this(prototype, config.getPoolCapacity());
    }

    public AggregateContextPool(AggregateContext prototype) {
        this(prototype, prototype.getConfig());
    }

    @Override
    public AggregateContext acquire() {
        AggregateContext ctx = idle.pollFirst();
        if(ctx != null) {
            idleSet.remove(ctx);
            idleCount.decrementAndGet();
            return ctx;
        }
        int n = created.incrementAndGet();
        LOGGER.debug("Pool grows to {} contexts {}", n, prototype.labels());
        return prototype.newPartial();
    }

    @Override
    public void release(AggregateContext ctx) {
        if(!prototype.isCompatible(ctx)) {
            throw Error.IncompatiblePartialException;
        }
        if(!idleSet.add(ctx)) {
            throw Error.ContextAlreadyReleasedException;
        }
        ctx.reset();
        if(idleCount.incrementAndGet() <= capacity) {
            idle.offerFirst(ctx);
        } else {
            idleCount.decrementAndGet();
            idleSet.remove(ctx);
        }
    }

    public int idleSize() {
        return idleCount.get();
    }

    public int createdCount() {
        return created.get();
    }
}

package com.sqlcore.backend.common;

/**
 * 可复用对象来源。acquire 得到的对象在 release 之前由调用方独占。
 */
public interface ObjectPool<T> {
    T acquire();

    void release(T obj);
}

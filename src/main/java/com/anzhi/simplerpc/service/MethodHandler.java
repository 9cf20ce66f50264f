package com.anzhi.simplerpc.service;

/**
 * 一个可远程调用的方法体。
 * <p>
 * reply 是服务端预先分配好的槽位：可变类型（bean、List、Map）可以直接填充后原样返回，
 * 值类型（Integer、String 等）返回新的值即可。抛出的异常会被转换为响应 Header 的 error。
 *
 * @param <A> 参数类型
 * @param <R> 返回值类型
 */
@FunctionalInterface
public interface MethodHandler<A, R> {
    R handle(A arg, R reply) throws Exception;
}

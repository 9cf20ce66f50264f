package com.anzhi.simplerpc.discovery;

import java.util.List;

/**
 * 服务发现：持有候选实例列表，并按负载均衡策略选出一个。
 */
public interface Discovery {

    /**
     * 从注册中心更新实例列表。
     */
    void refresh() throws InterruptedException;

    /**
     * 手动替换实例列表。
     */
    void update(List<String> servers);

    /**
     * @throws com.anzhi.simplerpc.error.RpcException 列表为空或策略不受支持
     */
    String get(SelectMode mode);

    /**
     * 返回实例列表的副本。
     */
    List<String> getAll();
}

package com.anzhi.simplerpc.codec;

import java.io.Serializable;

/**
 * 每条消息的信封，一个 Header 后面紧跟一个 Body。
 */
public class Header implements Serializable {
    private static final long serialVersionUID = 1L;

    // 格式为 "Service.Method"
    private String serviceMethod;
    // 客户端选择的序号，用来关联请求和响应
    private long seq;
    // 客户端置为空，服务端处理出错时写入错误信息
    private String error = "";

    public Header() {
    }

    public Header(String serviceMethod, long seq) {
        this.serviceMethod = serviceMethod;
        this.seq = seq;
    }

    /**
     * 复制一份带错误信息的 Header，原 Header 保持不变。
     * 超时路径和正常路径可能同时构造响应，所以不共享同一个可变实例。
     */
    public Header withError(String error) {
        Header copy = new Header(serviceMethod, seq);
        copy.setError(error);
        return copy;
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    // Getters and Setters...
    public String getServiceMethod() { return serviceMethod; }
    public void setServiceMethod(String serviceMethod) { this.serviceMethod = serviceMethod; }
    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }
    public String getError() { return error; }
    public void setError(String error) { this.error = error == null ? "" : error; }

    @Override
    public String toString() {
        return "Header{" +
                "serviceMethod='" + serviceMethod + '\'' +
                ", seq=" + seq +
                ", error='" + error + '\'' +
                '}';
    }
}

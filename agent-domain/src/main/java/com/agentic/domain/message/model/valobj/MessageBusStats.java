package com.agentic.domain.message.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 消息总线统计快照。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageBusStats {

    /**
     * 已接收发送请求数
     */
    private long messagesSent;

    /**
     * 已投递数
     */
    private long messagesDelivered;

    /**
     * 接收方未注册而丢弃的数量
     */
    private long messagesDropped;

    /**
     * 处理器异常数
     */
    private long messagesFailed;

    /**
     * 消息历史条数
     */
    private int historySize;

    /**
     * 已注册地址
     */
    private List<String> endpoints;

    /**
     * 各地址待投递队列长度
     */
    private Map<String, Integer> queueSizes;
}

package com.agentic.domain.message.adapter.bus;

import com.agentic.domain.message.model.entity.AgentMessageEntity;
import com.agentic.domain.message.model.valobj.MessageBusStats;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 消息总线接口
 * <p>
 * 每个地址拥有独立的投递队列，同一 (发送方, 接收方) 的消息按发送顺序投递，至多一次。
 * 接收方未注册时静默丢弃。广播投递给发送时刻已注册的全部地址（发送方除外）。
 * 点对点消息发送前依次经过路由规则，第一条给出接收方的规则生效。
 * </p>
 *
 * @author agentic
 * @since 2026-10-17
 */
public interface IMessageBus {

    /**
     * 注册地址，已存在时抛出 IllegalStateException
     */
    void register(String endpointId, Consumer<AgentMessageEntity> handler);

    /**
     * 注销地址，队列中未投递的消息一并丢弃
     */
    void unregister(String endpointId);

    /**
     * 地址是否已注册
     */
    boolean isRegistered(String endpointId);

    /**
     * 入队后立即返回，不等待投递
     */
    void send(AgentMessageEntity message);

    /**
     * 追加路由规则：返回新的接收方，返回空表示不处理。规则按添加顺序求值，不作用于广播。
     */
    void addRoutingRule(Function<AgentMessageEntity, String> rule);

    /**
     * 最近消息历史中发往该地址的消息（含其它地址发出的广播），按发送顺序。
     *
     * @param since 为空时不按时间过滤，否则只返回不早于该时间的消息
     */
    List<AgentMessageEntity> getMessagesFor(String recipient, LocalDateTime since);

    /**
     * 当前已注册地址，按注册顺序
     */
    List<String> getEndpoints();

    /**
     * 统计快照
     */
    MessageBusStats getStats();

    /**
     * 等待指定地址的队列清空且没有正在执行的投递。
     *
     * @return 超时前清空返回 true
     */
    boolean awaitIdle(String endpointId, Duration timeout) throws InterruptedException;
}

package com.agentic.domain.agent.adapter.handler;

import com.agentic.domain.agent.model.aggregate.WorkerAgent;
import com.agentic.domain.message.model.entity.AgentMessageEntity;

/**
 * Agent 收到消息后的回调，运行在总线投递线程上。
 */
@FunctionalInterface
public interface IAgentMessageHandler {

    void onMessage(WorkerAgent agent, AgentMessageEntity message);
}

package com.agentic.domain.message.model.entity;

import com.agentic.types.common.Constants;
import com.agentic.types.enums.MessageTypeEnum;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 消息实体，创建后不可变；总线只负责路由，不解析 content。
 *
 * @author agentic
 * @since 2026-10-17
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class AgentMessageEntity {

    /**
     * 消息 ID
     */
    private final String id;

    /**
     * 发送方
     */
    private final String sender;

    /**
     * 接收方，广播时为 {@link Constants#BROADCAST_RECIPIENT}
     */
    private final String recipient;

    /**
     * 消息类型
     */
    private final MessageTypeEnum messageType;

    /**
     * 消息内容
     */
    private final Object content;

    /**
     * 发送时间
     */
    private final LocalDateTime timestamp;

    /**
     * 回复的消息 ID
     */
    private final String replyTo;

    /**
     * 附加元数据
     */
    private final Map<String, Object> metadata;

    public static AgentMessageEntity of(String sender, String recipient, MessageTypeEnum messageType, Object content) {
        return AgentMessageEntity.builder()
                .id(UUID.randomUUID().toString())
                .sender(sender)
                .recipient(recipient)
                .messageType(messageType)
                .content(content)
                .timestamp(LocalDateTime.now())
                .metadata(Collections.emptyMap())
                .build();
    }

    public static AgentMessageEntity broadcast(String sender, MessageTypeEnum messageType, Object content) {
        return of(sender, Constants.BROADCAST_RECIPIENT, messageType, content);
    }

    /**
     * 生成回复消息，收发方互换。
     */
    public AgentMessageEntity reply(MessageTypeEnum replyType, Object replyContent) {
        return AgentMessageEntity.builder()
                .id(UUID.randomUUID().toString())
                .sender(recipient)
                .recipient(sender)
                .messageType(replyType)
                .content(replyContent)
                .timestamp(LocalDateTime.now())
                .replyTo(id)
                .metadata(Collections.emptyMap())
                .build();
    }

    public boolean isBroadcast() {
        return Constants.BROADCAST_RECIPIENT.equals(recipient);
    }

    public Map<String, Object> getMetadata() {
        return metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * 校验消息是否可路由
     */
    public void validate() {
        if (sender == null || sender.trim().isEmpty()) {
            throw new IllegalStateException("Message sender cannot be empty");
        }
        if (recipient == null || recipient.trim().isEmpty()) {
            throw new IllegalStateException("Message recipient cannot be empty");
        }
        if (messageType == null) {
            throw new IllegalStateException("Message type cannot be null");
        }
    }
}

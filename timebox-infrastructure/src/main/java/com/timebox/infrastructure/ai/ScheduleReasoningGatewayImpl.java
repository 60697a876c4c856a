package com.timebox.infrastructure.ai;

import com.timebox.domain.schedule.adapter.gateway.IScheduleReasoningGateway;
import com.timebox.domain.schedule.model.valobj.ScheduleReasoningRequest;
import com.timebox.infrastructure.ai.config.ScheduleReasoningProperties;
import com.timebox.types.enums.ResponseCode;
import com.timebox.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;

/**
 * 基于 Spring AI ChatClient 的排程推理网关。
 * <p>
 * 只负责一次调用与错误归类，重试由调用方决定。
 * </p>
 */
@Slf4j
@Component
public class ScheduleReasoningGatewayImpl implements IScheduleReasoningGateway {

    private static final String RATE_LIMIT_STATUS = "429";

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ScheduleReasoningProperties properties;

    public ScheduleReasoningGatewayImpl(ObjectProvider<ChatModel> chatModelProvider,
                                        ScheduleReasoningProperties properties) {
        this.chatModelProvider = chatModelProvider;
        this.properties = properties;
    }

    @Override
    public String generate(ScheduleReasoningRequest request) {
        if (StringUtils.isBlank(properties.getApiKey())) {
            throw new AppException(ResponseCode.AI_SERVICE_UNAVAILABLE);
        }
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "reasoning request is null");
        }
        try {
            return invoke(request.systemInstructions(), request.context());
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            AppException classified = classify(ex);
            if (classified.is(ResponseCode.AI_SERVICE_TRANSIENT)) {
                log.warn("SCHEDULE_REASONING_TRANSIENT model={}, reason={}", properties.getModel(), ex.getMessage());
            } else {
                log.error("SCHEDULE_REASONING_FAILED model={}, errorType={}, reason={}",
                        properties.getModel(), ex.getClass().getSimpleName(), ex.getMessage());
            }
            throw classified;
        }
    }

    /**
     * 发起一次对话调用并返回原始文本。
     */
    protected String invoke(String systemInstructions, String context) {
        ChatModel chatModel = chatModelProvider.getIfAvailable();
        if (chatModel == null) {
            throw new AppException(ResponseCode.AI_SERVICE_UNAVAILABLE, "chat model is not configured");
        }
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(properties.getModel())
                .temperature(properties.getTemperature())
                .build();
        return ChatClient.builder(chatModel)
                .build()
                .prompt()
                .options(options)
                .system(systemInstructions)
                .user(context)
                .call()
                .content();
    }

    /**
     * 限流与网络不可达归为可重试错误，其余上游错误直接失败。
     */
    AppException classify(RuntimeException ex) {
        if (ex instanceof TransientAiException && StringUtils.startsWith(ex.getMessage(), RATE_LIMIT_STATUS)) {
            return new AppException(ResponseCode.AI_SERVICE_TRANSIENT, "rate limited: " + ex.getMessage(), ex);
        }
        if (isConnectivityFailure(ex)) {
            return new AppException(ResponseCode.AI_SERVICE_TRANSIENT, "connection failed: " + ex.getMessage(), ex);
        }
        if (ex instanceof NonTransientAiException) {
            return new AppException(ResponseCode.AI_SERVICE_ERROR, "upstream rejected: " + ex.getMessage(), ex);
        }
        return new AppException(ResponseCode.AI_SERVICE_ERROR, "upstream failure: " + ex.getMessage(), ex);
    }

    private boolean isConnectivityFailure(Throwable ex) {
        Throwable current = ex;
        int depth = 0;
        while (current != null && depth++ < 10) {
            if (current instanceof ResourceAccessException || current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

package com.guildsentinel.core.support;

import com.guildsentinel.core.action.ApiEndpoint;
import com.guildsentinel.core.action.ApiResult;
import com.guildsentinel.core.action.ModerationApi;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Scripted {@link ModerationApi}. Each endpoint answers with queued results
 * in order and with success once its queue is empty.
 */
public final class FakeModerationApi implements ModerationApi {

    private final Map<ApiEndpoint, Deque<Object>> scripts = new EnumMap<>(ApiEndpoint.class);
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeModerationApi() {
        for (ApiEndpoint endpoint : ApiEndpoint.values()) {
            scripts.put(endpoint, new ConcurrentLinkedDeque<>());
        }
    }

    public FakeModerationApi script(ApiEndpoint endpoint, ApiResult... results) {
        Collections.addAll(scripts.get(endpoint), (Object[]) results);
        return this;
    }

    /** Make the next call on the endpoint throw. */
    public FakeModerationApi scriptThrow(ApiEndpoint endpoint, RuntimeException error) {
        scripts.get(endpoint).add(error);
        return this;
    }

    /** Calls in invocation order, as {@code "endpoint:target"}. */
    public List<String> getCalls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long count(ApiEndpoint endpoint) {
        String prefix = endpoint.label() + ":";
        return getCalls().stream().filter(c -> c.startsWith(prefix)).count();
    }

    @Override
    public CompletableFuture<ApiResult> mute(String guildId, String userId, Duration duration, String reason) {
        return answer(ApiEndpoint.MUTE, userId + "/" + duration.toMinutes() + "m");
    }

    @Override
    public CompletableFuture<ApiResult> deleteMessage(String guildId, String channelId, String messageId) {
        return answer(ApiEndpoint.DELETE_MESSAGE, messageId);
    }

    @Override
    public CompletableFuture<ApiResult> warn(String guildId, String userId, String reason) {
        return answer(ApiEndpoint.WARN, userId);
    }

    private CompletableFuture<ApiResult> answer(ApiEndpoint endpoint, String target) {
        calls.add(endpoint.label() + ":" + target);
        Object next = scripts.get(endpoint).poll();
        if (next instanceof RuntimeException e) {
            throw e;
        }
        return CompletableFuture.completedFuture(next != null ? (ApiResult) next : ApiResult.success());
    }
}

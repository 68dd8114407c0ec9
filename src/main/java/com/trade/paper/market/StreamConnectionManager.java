package com.trade.paper.market;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 组合流 WebSocket 连接管理器
 *
 * 职责：
 * 1. 一条连接承载所有订阅的流（/stream?streams=a/b/c）
 * 2. 按信封中的 stream 字段把 data 分发给对应回调
 * 3. 异常断开后按指数退避重连，连接成功后退避复位
 * 4. 连接中增减订阅：启用控制帧时发送 SUBSCRIBE/UNSUBSCRIBE，否则按新的流集合重建连接
 *
 * 所有状态变更和回调分发都在对象锁内执行，同一时刻只有一个写入者。
 * 每个实例独立持有连接，不使用全局单例。
 */
public class StreamConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(StreamConnectionManager.class);

    private static final int NORMAL_CLOSURE = 1000;

    private final WebSocket.Factory socketFactory;
    private final ObjectMapper objectMapper;
    private final StreamConfig config;
    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final ReconnectBackoff backoff;
    private final AtomicLong requestIds = new AtomicLong();

    private final Map<String, Set<StreamHandler>> subscriptions = new LinkedHashMap<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private WebSocket webSocket;
    private Set<String> socketStreams = new LinkedHashSet<>();
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private boolean disconnectRequested;
    private ScheduledFuture<?> reconnectTask;

    public StreamConnectionManager(OkHttpClient httpClient, StreamConfig config) {
        this(httpClient, new ObjectMapper(), config, Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stream-reconnect");
            t.setDaemon(true);
            return t;
        }), true);
    }

    public StreamConnectionManager(WebSocket.Factory socketFactory, ObjectMapper objectMapper,
                                   StreamConfig config, ScheduledExecutorService scheduler) {
        this(socketFactory, objectMapper, config, scheduler, false);
    }

    private StreamConnectionManager(WebSocket.Factory socketFactory, ObjectMapper objectMapper,
                                    StreamConfig config, ScheduledExecutorService scheduler,
                                    boolean ownsScheduler) {
        this.socketFactory = socketFactory;
        this.objectMapper = objectMapper;
        this.config = config;
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.backoff = config.newBackoff();
    }

    // ==================== 订阅 ====================

    /**
     * 订阅一个流
     * @return 取消订阅句柄，执行后该回调不再收到任何消息
     */
    public synchronized Runnable subscribe(String streamKey, StreamHandler handler) {
        String key = StreamKeys.normalize(streamKey);
        boolean newKey = !subscriptions.containsKey(key);
        subscriptions.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(handler);

        if (newKey) {
            logger.info("新增订阅: {}", key);
            if (status == ConnectionStatus.CONNECTED) {
                applyTopologyChange(List.of(key), List.of());
            }
        }
        if (webSocket == null && reconnectTask == null && !disconnectRequested) {
            openSocket(ConnectionStatus.CONNECTING);
        }
        return () -> unsubscribe(key, handler);
    }

    /**
     * 取消订阅；流上没有回调时移除该流，全部移除后关闭连接
     */
    public synchronized void unsubscribe(String streamKey, StreamHandler handler) {
        String key = StreamKeys.normalize(streamKey);
        Set<StreamHandler> handlers = subscriptions.get(key);
        if (handlers == null || !handlers.remove(handler)) {
            return;
        }
        if (!handlers.isEmpty()) {
            return;
        }

        subscriptions.remove(key);
        logger.info("移除订阅: {}", key);
        if (subscriptions.isEmpty()) {
            closeIdle();
        } else if (status == ConnectionStatus.CONNECTED) {
            applyTopologyChange(List.of(), List.of(key));
        }
    }

    public synchronized List<String> getSubscriptions() {
        return new ArrayList<>(subscriptions.keySet());
    }

    // ==================== 连接控制 ====================

    /**
     * 建立连接（幂等）；没有订阅时不建立连接
     */
    public synchronized void connect() {
        disconnectRequested = false;
        if (webSocket != null || reconnectTask != null) {
            return;
        }
        if (subscriptions.isEmpty()) {
            logger.debug("没有订阅的流，暂不建立连接");
            return;
        }
        openSocket(ConnectionStatus.CONNECTING);
    }

    /**
     * 主动断开（幂等）：取消待执行的重连，之后不再分发任何消息
     */
    public synchronized void disconnect() {
        disconnectRequested = true;
        cancelReconnect();
        boolean hadSocket = closeCurrentSocket("Disconnect");
        setStatus(ConnectionStatus.DISCONNECTED);
        if (hadSocket) {
            notifyListeners(ConnectionListener::onDisconnect);
        }
    }

    /**
     * 复位退避并立即重连
     */
    public synchronized void retryConnection() {
        disconnectRequested = false;
        cancelReconnect();
        backoff.reset();
        closeCurrentSocket("Retry");
        if (subscriptions.isEmpty()) {
            setStatus(ConnectionStatus.DISCONNECTED);
            return;
        }
        openSocket(ConnectionStatus.CONNECTING);
    }

    /**
     * 断开并释放自建的调度线程
     */
    public void shutdown() {
        disconnect();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    public synchronized ConnectionStatus getStatus() {
        return status;
    }

    public synchronized boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    /**
     * 下一次重连将等待的时间
     */
    public Duration getNextReconnectDelay() {
        return backoff.peekDelay();
    }

    // ==================== 监听器 ====================

    /**
     * 注册连接监听器，注册时立即回调一次当前状态
     * @return 移除监听器的句柄
     */
    public Runnable addListener(ConnectionListener listener) {
        listeners.add(listener);
        ConnectionStatus current;
        synchronized (this) {
            current = status;
        }
        notifyListener(listener, l -> l.onStatusChange(current));
        return () -> listeners.remove(listener);
    }

    // ==================== 私有方法 ====================

    private void openSocket(ConnectionStatus connectingStatus) {
        Set<String> streams = new LinkedHashSet<>(subscriptions.keySet());
        String url = config.getBaseUrl() + "/stream?streams=" + String.join("/", streams);
        setStatus(connectingStatus);
        socketStreams = streams;
        logger.info("连接行情流: {}", url);
        Request request = new Request.Builder().url(url).build();
        webSocket = socketFactory.newWebSocket(request, new Listener());
    }

    private void applyTopologyChange(Collection<String> added, Collection<String> removed) {
        if (config.isControlFramesEnabled()) {
            if (!added.isEmpty()) {
                sendControlFrame("SUBSCRIBE", added);
                socketStreams.addAll(added);
            }
            if (!removed.isEmpty()) {
                sendControlFrame("UNSUBSCRIBE", removed);
                socketStreams.removeAll(removed);
            }
        } else {
            // 组合流地址由订阅集合决定，只能重建连接
            logger.info("订阅集合变化，重建行情连接");
            closeCurrentSocket("Resubscribe");
            openSocket(ConnectionStatus.CONNECTING);
        }
    }

    /**
     * 连接建立后，把连接期间发生的订阅变化补齐
     */
    private void reconcileStreams() {
        List<String> added = new ArrayList<>();
        for (String key : subscriptions.keySet()) {
            if (!socketStreams.contains(key)) {
                added.add(key);
            }
        }
        List<String> removed = new ArrayList<>();
        for (String key : socketStreams) {
            if (!subscriptions.containsKey(key)) {
                removed.add(key);
            }
        }
        if (!added.isEmpty() || !removed.isEmpty()) {
            applyTopologyChange(added, removed);
        }
    }

    private void sendControlFrame(String method, Collection<String> streams) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("method", method);
        ArrayNode params = frame.putArray("params");
        streams.forEach(params::add);
        frame.put("id", requestIds.incrementAndGet());
        try {
            String text = objectMapper.writeValueAsString(frame);
            if (webSocket == null || !webSocket.send(text)) {
                logger.warn("控制帧发送失败: {}", text);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("控制帧序列化失败", e);
        }
    }

    private void closeIdle() {
        cancelReconnect();
        boolean hadSocket = closeCurrentSocket("Idle");
        setStatus(ConnectionStatus.DISCONNECTED);
        if (hadSocket) {
            notifyListeners(ConnectionListener::onDisconnect);
        }
    }

    /**
     * 先解除引用再关闭，旧连接的后续回调会被忽略
     */
    private boolean closeCurrentSocket(String reason) {
        WebSocket current = webSocket;
        webSocket = null;
        socketStreams = new LinkedHashSet<>();
        if (current == null) {
            return false;
        }
        current.close(NORMAL_CLOSURE, reason);
        return true;
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private void handleUnexpectedClose() {
        notifyListeners(ConnectionListener::onDisconnect);
        if (disconnectRequested || subscriptions.isEmpty()) {
            setStatus(ConnectionStatus.DISCONNECTED);
            return;
        }
        setStatus(ConnectionStatus.RECONNECTING);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (reconnectTask != null) {
            return;
        }
        Duration delay = backoff.nextDelay();
        logger.warn("行情连接断开，{} ms 后第 {} 次重连", delay.toMillis(), backoff.getAttemptCount());
        reconnectTask = scheduler.schedule(this::reconnectFromTimer, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void reconnectFromTimer() {
        reconnectTask = null;
        if (disconnectRequested || webSocket != null) {
            return;
        }
        if (subscriptions.isEmpty()) {
            setStatus(ConnectionStatus.DISCONNECTED);
            return;
        }
        openSocket(ConnectionStatus.RECONNECTING);
    }

    private void setStatus(ConnectionStatus newStatus) {
        if (status == newStatus) {
            return;
        }
        logger.info("行情连接状态: {} -> {}", status, newStatus);
        status = newStatus;
        notifyListeners(l -> l.onStatusChange(newStatus));
    }

    private void dispatch(String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            logger.error("行情消息解析失败: {}", e.getOriginalMessage());
            return;
        }

        if (message.hasNonNull("stream") && message.has("data")) {
            String key = message.get("stream").asText();
            Set<StreamHandler> handlers = subscriptions.get(key);
            if (handlers == null) {
                logger.debug("收到未订阅流的消息: {}", key);
                return;
            }
            invokeHandlers(key, handlers, message.get("data"));
        } else if (message.has("id") && message.has("result")) {
            logger.debug("控制帧确认: id={}", message.get("id").asLong());
        } else if (message.has("error")) {
            logger.warn("行情服务返回错误: {}", message.get("error"));
        } else {
            // 单流连接直接推送原始数据
            for (Map.Entry<String, Set<StreamHandler>> entry : subscriptions.entrySet()) {
                invokeHandlers(entry.getKey(), entry.getValue(), message);
            }
        }
    }

    private void invokeHandlers(String key, Set<StreamHandler> handlers, JsonNode data) {
        for (StreamHandler handler : new ArrayList<>(handlers)) {
            try {
                handler.onMessage(data);
            } catch (Exception e) {
                logger.error("流 {} 回调失败: {}", key, e.getMessage(), e);
            }
        }
    }

    private void notifyListeners(Consumer<ConnectionListener> action) {
        for (ConnectionListener listener : listeners) {
            notifyListener(listener, action);
        }
    }

    private void notifyListener(ConnectionListener listener, Consumer<ConnectionListener> action) {
        try {
            action.accept(listener);
        } catch (Exception e) {
            logger.error("连接监听器回调失败: {}", e.getMessage(), e);
        }
    }

    /**
     * OkHttp 回调，只处理当前连接的事件
     */
    private class Listener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket ws, Response response) {
            synchronized (StreamConnectionManager.this) {
                if (ws != webSocket) {
                    return;
                }
                backoff.reset();
                setStatus(ConnectionStatus.CONNECTED);
                reconcileStreams();
                notifyListeners(ConnectionListener::onConnect);
            }
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            synchronized (StreamConnectionManager.this) {
                if (ws != webSocket || disconnectRequested) {
                    return;
                }
                dispatch(text);
            }
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            synchronized (StreamConnectionManager.this) {
                if (ws != webSocket) {
                    return;
                }
                logger.warn("行情连接被关闭: code={}, reason={}", code, reason);
                webSocket = null;
                socketStreams = new LinkedHashSet<>();
                handleUnexpectedClose();
            }
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            synchronized (StreamConnectionManager.this) {
                if (ws != webSocket) {
                    return;
                }
                logger.warn("行情连接异常: {}", t.getMessage());
                webSocket = null;
                socketStreams = new LinkedHashSet<>();
                notifyListeners(l -> l.onError(t));
                handleUnexpectedClose();
            }
        }
    }
}

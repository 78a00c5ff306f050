package com.hyperagi.nacosagent.common.registry.impl;

import com.hyperagi.nacosagent.common.registry.model.AccessToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * accessToken 缓存
 * <p>
 * 读取-刷新-写入全程持锁，同一个客户端实例可以被多个线程共享。
 * 失效只针对调用方手里那个旧 token，避免并发场景下把别人刚刷新的 token 清掉。
 */
public class AccessTokenManager {

    private static final Logger logger = LoggerFactory.getLogger(AccessTokenManager.class);

    private final Supplier<AccessToken> loginCall;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private AccessToken current;

    public AccessTokenManager(Supplier<AccessToken> loginCall, Clock clock) {
        this.loginCall = loginCall;
        this.clock = clock;
    }

    /**
     * 获取有效 token，缓存缺失或过期时同步登录
     */
    public String getToken() {
        lock.lock();
        try {
            if (current == null || current.isExpired(clock.instant())) {
                logger.debug("accessToken 缺失或已过期，重新登录");
                current = loginCall.get();
            }
            return current.getValue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 使指定 token 失效
     *
     * @param staleToken 被服务端拒绝的 token
     */
    public void invalidate(String staleToken) {
        lock.lock();
        try {
            if (current != null && current.getValue().equals(staleToken)) {
                logger.info("accessToken 被服务端拒绝，已清除缓存");
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前缓存的 token，仅用于诊断
     */
    public AccessToken peek() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }
}

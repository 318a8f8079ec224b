package com.ryuqq.fetcher.adapter.okhttp;

import com.ryuqq.fetcher.core.spi.ConnectionContextFactory;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * OkHttp 기반 Connection Context 팩토리.
 *
 * <p>{@link #open()}마다 독립된 {@link ConnectionPool}을 가진 클라이언트를 만듭니다.
 * 같은 Context 안의 요청들은 이 풀을 공유하고, Context를 닫으면 풀의 연결이 정리됩니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class OkHttpConnectionContextFactory implements ConnectionContextFactory {

    private static final Logger log = LoggerFactory.getLogger(OkHttpConnectionContextFactory.class);

    private final OkHttpConnectionConfig config;

    /**
     * 생성자 (기본 설정 사용).
     */
    public OkHttpConnectionContextFactory() {
        this(new OkHttpConnectionConfig());
    }

    /**
     * 생성자.
     *
     * @param config 연결 풀 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public OkHttpConnectionContextFactory(OkHttpConnectionConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    @Override
    public OkHttpConnectionContext open() {
        ConnectionPool pool = new ConnectionPool(
            config.maxIdleConnections(),
            config.keepAlive().toSeconds(),
            TimeUnit.SECONDS
        );
        OkHttpClient client = new OkHttpClient.Builder()
            .connectionPool(pool)
            .retryOnConnectionFailure(config.retryOnConnectionFailure())
            .build();

        log.debug("Opened connection context with max. {} idle connections and {} sec. keep-alive",
            config.maxIdleConnections(), config.keepAlive().toSeconds());
        return new OkHttpConnectionContext(client);
    }

    public OkHttpConnectionConfig getConfig() {
        return config;
    }
}

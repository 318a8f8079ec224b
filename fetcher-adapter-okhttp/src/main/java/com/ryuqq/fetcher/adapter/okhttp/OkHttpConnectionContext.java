package com.ryuqq.fetcher.adapter.okhttp;

import com.ryuqq.fetcher.core.spi.ConnectionContext;
import com.ryuqq.fetcher.core.spi.HttpRequestSpec;
import com.ryuqq.fetcher.core.spi.RawResponse;
import com.ryuqq.fetcher.core.spi.TransportException;
import okhttp3.Credentials;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.net.ProtocolException;
import java.net.SocketTimeoutException;
import java.net.Proxy;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * OkHttp 기반 Connection Context.
 *
 * <p>하나의 {@link OkHttpClient}(연결 풀 포함)를 감싸고, 요청마다 리다이렉트, 타임아웃,
 * 프록시, TLS 검증 설정을 적용한 파생 클라이언트로 GET을 수행합니다.
 * 파생 클라이언트는 원본의 연결 풀과 Dispatcher를 공유합니다.</p>
 *
 * <p><strong>예외 변환:</strong></p>
 * <ul>
 *   <li>리다이렉트 한도 초과 → {@code TOO_MANY_REDIRECTS}</li>
 *   <li>연결/읽기/전체 호출 타임아웃 → {@code TIMEOUT}</li>
 *   <li>호출 스레드 인터럽트 → {@code INTERRUPTED}</li>
 *   <li>잘못된 URL, 프록시 → {@code INVALID_REQUEST}</li>
 *   <li>그 외 I/O 오류 → {@code CONNECTION}</li>
 * </ul>
 *
 * <p>여러 스레드에서 동시에 {@link #get(HttpRequestSpec)}을 호출할 수 있습니다.</p>
 *
 * @author Fetcher Team
 * @since 1.0.0
 */
public final class OkHttpConnectionContext implements ConnectionContext {

    private static final Logger log = LoggerFactory.getLogger(OkHttpConnectionContext.class);

    private static final String TOO_MANY_FOLLOW_UPS = "Too many follow-up requests";

    private static final X509TrustManager TRUST_ALL_MANAGER = new X509TrustManager() {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    };

    private static final SSLSocketFactory TRUST_ALL_SOCKET_FACTORY;

    static {
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[] {TRUST_ALL_MANAGER}, new SecureRandom());
            TRUST_ALL_SOCKET_FACTORY = sslContext.getSocketFactory();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize trust-all SSL context", e);
        }
    }

    private final OkHttpClient client;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * 생성자.
     *
     * @param client 연결 풀을 가진 기본 클라이언트
     * @throws IllegalArgumentException client가 null인 경우
     */
    public OkHttpConnectionContext(OkHttpClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    @Override
    public RawResponse get(HttpRequestSpec request) throws TransportException {
        if (closed.get()) {
            throw new IllegalStateException("Connection context is already closed");
        }

        Request httpRequest = buildRequest(request);
        OkHttpClient callClient = clientFor(request);

        try (Response response = callClient.newCall(httpRequest).execute()) {
            ResponseBody body = response.body();
            byte[] content = body == null ? new byte[0] : body.bytes();
            String text = new String(content, charsetOf(body == null ? null : body.contentType()));

            log.debug("GET {} -> {} ({} bytes)", request.url(), response.code(), content.length);
            return new RawResponse(response.code(), joinHeaders(response.headers()), content, text);
        } catch (ProtocolException e) {
            if (e.getMessage() != null && e.getMessage().startsWith(TOO_MANY_FOLLOW_UPS)) {
                throw new TransportException(TransportException.Reason.TOO_MANY_REDIRECTS, e.getMessage(), e);
            }
            throw new TransportException(TransportException.Reason.CONNECTION, e.getMessage(), e);
        } catch (InterruptedIOException e) {
            throw fromInterruptedIo(e);
        } catch (IOException e) {
            throw new TransportException(TransportException.Reason.CONNECTION, describe(e), e);
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportException.Reason.INVALID_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * 연결 풀의 유휴 연결을 정리합니다. 여러 번 호출해도 안전합니다.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            client.connectionPool().evictAll();
            log.debug("Closed connection context");
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private static Request buildRequest(HttpRequestSpec request) throws TransportException {
        HttpUrl base = HttpUrl.parse(request.url());
        if (base == null) {
            throw new TransportException(TransportException.Reason.INVALID_REQUEST,
                "Invalid request URL: " + request.url());
        }

        HttpUrl.Builder url = base.newBuilder();
        request.queryParams().forEach(url::addQueryParameter);

        Request.Builder builder = new Request.Builder().url(url.build()).get();
        try {
            request.headers().forEach(builder::header);
        } catch (IllegalArgumentException e) {
            throw new TransportException(TransportException.Reason.INVALID_REQUEST, e.getMessage(), e);
        }

        if (!request.cookies().isEmpty()) {
            StringJoiner cookie = new StringJoiner("; ");
            request.cookies().forEach((name, value) -> cookie.add(name + "=" + value));
            builder.header("Cookie", cookie.toString());
        }
        return builder.build();
    }

    private OkHttpClient clientFor(HttpRequestSpec request) throws TransportException {
        long timeoutMillis = request.timeout().toMillis();
        OkHttpClient.Builder builder = client.newBuilder()
            .followRedirects(request.followRedirects())
            .followSslRedirects(request.followRedirects())
            .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
            .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS);

        if (!request.verifyTls()) {
            builder.sslSocketFactory(TRUST_ALL_SOCKET_FACTORY, TRUST_ALL_MANAGER);
            builder.hostnameVerifier((hostname, session) -> true);
        }

        if (request.proxy() != null) {
            applyProxy(builder, request.proxy());
        }
        return builder.build();
    }

    /**
     * 타임아웃과 스레드 인터럽트를 구분합니다.
     *
     * <p>호출 스레드의 인터럽트 플래그가 켜져 있으면 취소로 보고 {@code INTERRUPTED}를 반환하며,
     * 플래그는 유지합니다. 그 외에는 {@code TIMEOUT}입니다.</p>
     */
    static TransportException fromInterruptedIo(InterruptedIOException e) {
        if (!(e instanceof SocketTimeoutException) && Thread.currentThread().isInterrupted()) {
            return new TransportException(TransportException.Reason.INTERRUPTED, e.getMessage(), e);
        }
        return new TransportException(TransportException.Reason.TIMEOUT, e.getMessage(), e);
    }

    private static void applyProxy(OkHttpClient.Builder builder, String proxy) throws TransportException {
        URI uri = parseProxyUri(proxy);
        Proxy parsed = toProxy(uri, proxy);
        builder.proxy(parsed);

        String userInfo = uri.getUserInfo();
        if (userInfo != null && parsed.type() == Proxy.Type.HTTP) {
            int separator = userInfo.indexOf(':');
            String user = separator < 0 ? userInfo : userInfo.substring(0, separator);
            String password = separator < 0 ? "" : userInfo.substring(separator + 1);
            String credential = Credentials.basic(user, password);
            builder.proxyAuthenticator((route, response) -> response.request().newBuilder()
                .header("Proxy-Authorization", credential)
                .build());
        }
    }

    /**
     * 프록시 URL을 {@link Proxy}로 변환합니다. 포트가 없으면 스킴 기본 포트(http 80, https 443, socks 1080)를 씁니다.
     */
    static Proxy parseProxy(String proxy) throws TransportException {
        return toProxy(parseProxyUri(proxy), proxy);
    }

    private static URI parseProxyUri(String proxy) throws TransportException {
        URI uri;
        try {
            uri = new URI(proxy);
        } catch (URISyntaxException e) {
            throw new TransportException(TransportException.Reason.INVALID_REQUEST, "Invalid proxy: " + proxy, e);
        }
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new TransportException(TransportException.Reason.INVALID_REQUEST, "Invalid proxy: " + proxy);
        }
        return uri;
    }

    private static Proxy toProxy(URI uri, String proxy) throws TransportException {
        Proxy.Type type;
        int defaultPort;
        switch (uri.getScheme().toLowerCase(Locale.ROOT)) {
            case "http":
                type = Proxy.Type.HTTP;
                defaultPort = 80;
                break;
            case "https":
                type = Proxy.Type.HTTP;
                defaultPort = 443;
                break;
            case "socks":
            case "socks5":
                type = Proxy.Type.SOCKS;
                defaultPort = 1080;
                break;
            default:
                throw new TransportException(TransportException.Reason.INVALID_REQUEST,
                    "Unsupported proxy scheme: " + proxy);
        }
        int port = uri.getPort() < 0 ? defaultPort : uri.getPort();
        return new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), port));
    }

    private static Map<String, String> joinHeaders(Headers headers) {
        Map<String, String> joined = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (int i = 0; i < headers.size(); i++) {
            joined.merge(headers.name(i), headers.value(i), (first, next) -> first + ", " + next);
        }
        return joined;
    }

    private static Charset charsetOf(MediaType contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        Charset charset = contentType.charset(StandardCharsets.UTF_8);
        return charset == null ? StandardCharsets.UTF_8 : charset;
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}

package org.qwen.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.socket.ConnectionSocketFactory;
import org.apache.hc.client5.http.socket.PlainConnectionSocketFactory;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactory;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.config.Registry;
import org.apache.hc.core5.http.config.RegistryBuilder;
import org.apache.hc.core5.http.protocol.HttpContext;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.ssl.SSLContexts;
import org.qwen.utils.ProxyUrlUtils;

import java.io.Closeable;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.Proxy;
import java.net.Socket;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * 按代理地址缓存 HttpClient，每个代理一个连接池，直连共用一个
 */
@Slf4j
public class ProxyHttpClientFactory implements Closeable {

    private static final String DIRECT = "direct";

    private final int timeoutSeconds;
    private final Map<String, CloseableHttpClient> clients = new ConcurrentHashMap<>();
    // SOCKS 凭据：host:port -> 认证信息
    private final Map<String, PasswordAuthentication> socksCredentials = new ConcurrentHashMap<>();
    private volatile boolean authenticatorInstalled;

    public ProxyHttpClientFactory(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * 获取指定代理的客户端，proxyUrl 为 null 时返回直连客户端
     */
    public CloseableHttpClient clientFor(String proxyUrl) {
        String key = proxyUrl == null ? DIRECT : proxyUrl;
        return clients.computeIfAbsent(key, k -> {
            ProxyUrlUtils.ProxySpec spec = proxyUrl == null ? null : ProxyUrlUtils.parse(proxyUrl);
            log.info("创建HTTP客户端[代理: {}]", ProxyUrlUtils.hostForLog(proxyUrl));
            return buildClient(spec);
        });
    }

    private CloseableHttpClient buildClient(ProxyUrlUtils.ProxySpec spec) {
        RegistryBuilder<ConnectionSocketFactory> registryBuilder = RegistryBuilder.create();
        if (spec != null && spec.isSocks()) {
            Proxy socksProxy = new Proxy(Proxy.Type.SOCKS, new InetSocketAddress(spec.getHost(), spec.getPort()));
            registryBuilder.register("http", new SocksPlainSocketFactory(socksProxy));
            registryBuilder.register("https", new SocksSslSocketFactory(socksProxy));
            if (spec.hasCredentials()) {
                registerSocksCredentials(spec);
            }
        } else {
            registryBuilder.register("http", PlainConnectionSocketFactory.getSocketFactory());
            registryBuilder.register("https", SSLConnectionSocketFactory.getSocketFactory());
        }
        Registry<ConnectionSocketFactory> registry = registryBuilder.build();

        PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager(registry);
        connectionManager.setMaxTotal(200);
        connectionManager.setDefaultMaxPerRoute(50);
        connectionManager.setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .setSocketTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build());

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .setResponseTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();

        HttpClientBuilder builder = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                // 重试由分发层按错误类别决定
                .disableAutomaticRetries();

        if (spec != null && !spec.isSocks()) {
            HttpHost proxyHost = new HttpHost(spec.getScheme(), spec.getHost(), spec.getPort());
            builder.setProxy(proxyHost);
            if (spec.hasCredentials()) {
                BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
                credentialsProvider.setCredentials(new AuthScope(proxyHost),
                        new UsernamePasswordCredentials(spec.getUsername(), spec.getPassword().toCharArray()));
                builder.setDefaultCredentialsProvider(credentialsProvider);
            }
        }
        return builder.build();
    }

    private void registerSocksCredentials(ProxyUrlUtils.ProxySpec spec) {
        socksCredentials.put(spec.getHost() + ":" + spec.getPort(),
                new PasswordAuthentication(spec.getUsername(), spec.getPassword().toCharArray()));
        if (!authenticatorInstalled) {
            synchronized (this) {
                if (!authenticatorInstalled) {
                    Authenticator.setDefault(new SocksAuthenticator());
                    authenticatorInstalled = true;
                }
            }
        }
    }

    @Override
    public void close() {
        clients.forEach((key, client) -> client.close(CloseMode.GRACEFUL));
        clients.clear();
    }

    private class SocksAuthenticator extends Authenticator {
        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            String protocol = getRequestingProtocol();
            if (protocol == null || !protocol.toUpperCase().startsWith("SOCKS")) {
                return null;
            }
            return socksCredentials.get(getRequestingHost() + ":" + getRequestingPort());
        }
    }

    private static class SocksPlainSocketFactory extends PlainConnectionSocketFactory {
        private final Proxy proxy;

        SocksPlainSocketFactory(Proxy proxy) {
            this.proxy = proxy;
        }

        @Override
        public Socket createSocket(HttpContext context) {
            return new Socket(proxy);
        }

        // httpclient5 5.3+ 调用此重载
        public Socket createSocket(Proxy ignored, HttpContext context) {
            return new Socket(proxy);
        }
    }

    private static class SocksSslSocketFactory extends SSLConnectionSocketFactory {
        private final Proxy proxy;

        SocksSslSocketFactory(Proxy proxy) {
            super(SSLContexts.createDefault());
            this.proxy = proxy;
        }

        @Override
        public Socket createSocket(HttpContext context) {
            return new Socket(proxy);
        }

        // httpclient5 5.3+ 调用此重载
        public Socket createSocket(Proxy ignored, HttpContext context) {
            return new Socket(proxy);
        }
    }
}

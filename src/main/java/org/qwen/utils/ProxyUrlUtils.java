package org.qwen.utils;

import lombok.Value;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class ProxyUrlUtils {

    private ProxyUrlUtils() {
    }

    /**
     * 解析代理地址，支持 socks://、socks4://、socks5://、socks5h://、http://、https://
     */
    public static ProxySpec parse(String proxyUrl) {
        if (proxyUrl == null || proxyUrl.isBlank()) {
            throw new IllegalArgumentException("代理地址为空");
        }
        URI uri;
        try {
            uri = new URI(proxyUrl.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("代理地址格式错误: " + hostForLog(proxyUrl), e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("代理地址缺少主机: " + hostForLog(proxyUrl));
        }
        boolean socks = scheme.startsWith("socks");
        if (!socks && !"http".equals(scheme) && !"https".equals(scheme)) {
            throw new IllegalArgumentException("不支持的代理协议: " + scheme);
        }
        int port = uri.getPort();
        if (port < 0) {
            port = socks ? 1080 : ("https".equals(scheme) ? 443 : 80);
        }

        String username = null;
        String password = null;
        String userInfo = uri.getUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int idx = userInfo.indexOf(':');
            username = idx >= 0 ? userInfo.substring(0, idx) : userInfo;
            password = idx >= 0 ? userInfo.substring(idx + 1) : "";
        }
        return new ProxySpec(scheme, uri.getHost(), port, username, password, socks);
    }

    /**
     * 日志中只输出代理主机，避免泄露凭据
     */
    public static String hostForLog(String proxyUrl) {
        if (proxyUrl == null) {
            return "none";
        }
        try {
            String host = new URI(proxyUrl.trim()).getHost();
            return host != null ? host : "invalid";
        } catch (URISyntaxException e) {
            return "invalid";
        }
    }

    @Value
    public static class ProxySpec {
        String scheme;
        String host;
        int port;
        String username;
        String password;
        boolean socks;

        public boolean hasCredentials() {
            return username != null && !username.isEmpty();
        }
    }
}

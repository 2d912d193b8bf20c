package org.qwen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class QwenApiProxyApplication {

    public static void main(String[] args) {
        SpringApplication.run(QwenApiProxyApplication.class, args);
        System.out.println("(♥◠‿◠)ﾉﾞ  Qwen-Api-Proxy启动成功   ლ(´ڡ`ლ)ﾞ");
    }

}

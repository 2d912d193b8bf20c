package org.qwen.config;

import lombok.extern.slf4j.Slf4j;
import org.qwen.domain.Account;
import org.qwen.service.IAccountService;
import org.qwen.service.IDataPersistenceService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 启动时导入 set-env 设置，并登录配置文件中尚未保存的账号
 */
@Slf4j
@Component
public class AccountBootstrap implements ApplicationRunner {

    private final QwenProperties qwenProperties;
    private final IDataPersistenceService persistenceService;
    private final IAccountService accountService;

    public AccountBootstrap(QwenProperties qwenProperties,
                            IDataPersistenceService persistenceService,
                            IAccountService accountService) {
        this.qwenProperties = qwenProperties;
        this.persistenceService = persistenceService;
        this.accountService = accountService;
    }

    @Override
    public void run(ApplicationArguments args) {
        importSetEnvFile(Paths.get(qwenProperties.getSetEnvFilePath()));
        initConfiguredAccounts();
        log.info(accountService.healthSummary());
    }

    /**
     * 逐行读取 KEY=VALUE 写入设置，处理完毕后删除文件
     */
    void importSetEnvFile(Path setEnvFile) {
        if (!Files.exists(setEnvFile)) {
            return;
        }
        log.info("检测到 set-env 文件，正在处理: {}", setEnvFile);
        try {
            List<String> lines = Files.readAllLines(setEnvFile, StandardCharsets.UTF_8);
            int imported = 0;
            for (String line : lines) {
                int idx = line.indexOf('=');
                if (idx <= 0) {
                    continue;
                }
                String key = line.substring(0, idx).trim();
                String value = line.substring(idx + 1).trim();
                if (key.isEmpty() || value.isEmpty()) {
                    continue;
                }
                persistenceService.saveSetting(key, value);
                imported++;
                log.info("导入设置项: {}", key);
            }
            Files.delete(setEnvFile);
            log.info("set-env 文件处理完毕并已删除，导入设置项: {}", imported);
        } catch (IOException e) {
            log.error("处理 set-env 文件失败: {}", setEnvFile, e);
        }
    }

    void initConfiguredAccounts() {
        List<String> configured = qwenProperties.getAccounts();
        if (configured == null || configured.isEmpty()) {
            return;
        }
        Set<String> known = accountService.listAccounts().stream()
                .map(Account::getEmail)
                .collect(Collectors.toSet());

        int added = 0;
        for (String entry : configured) {
            int idx = entry == null ? -1 : entry.indexOf(':');
            if (idx <= 0 || idx == entry.length() - 1) {
                log.warn("忽略格式错误的账号配置，应为 email:password");
                continue;
            }
            String email = entry.substring(0, idx).trim();
            String password = entry.substring(idx + 1).trim();
            if (known.contains(email)) {
                continue;
            }
            accountService.addAccount(email, password);
            known.add(email);
            added++;
        }
        if (added > 0) {
            log.info("成功从配置初始化 {} 个账户", added);
        }
    }
}

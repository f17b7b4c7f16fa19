package com.example.mltranslation.config;

import com.example.mltranslation.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 啟動時建立管理員帳號（translation.admin.email / password 皆有設定時）
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AdminAccountInitializer implements ApplicationRunner {

    private final TranslationProperties properties;
    private final UserService userService;

    @Override
    public void run(ApplicationArguments args) {
        TranslationProperties.Admin admin = properties.getAdmin();
        if (!StringUtils.hasText(admin.getEmail()) || !StringUtils.hasText(admin.getPassword())) {
            log.debug("No admin account configured");
            return;
        }
        userService.ensureAdmin(admin.getEmail(), admin.getPassword());
    }
}

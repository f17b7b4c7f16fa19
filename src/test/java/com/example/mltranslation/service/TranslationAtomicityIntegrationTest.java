package com.example.mltranslation.service;

import com.example.mltranslation.entity.TransactionType;
import com.example.mltranslation.entity.User;
import com.example.mltranslation.exception.TranslationFailedException;
import com.example.mltranslation.repository.TransactionRepository;
import com.example.mltranslation.repository.TranslationRepository;
import com.example.mltranslation.repository.UserRepository;
import com.example.mltranslation.repository.WalletRepository;
import com.example.mltranslation.translator.Translator;
import org.apache.rocketmq.client.producer.DefaultMQProducer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * 翻譯失敗時的原子性整合測試
 *
 * 翻譯器在持有錢包鎖時失敗：整個交易 rollback，
 * 錢包（含首次存取時建立的錢包）、帳本與翻譯紀錄皆不變。
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Translation Atomicity Integration Tests")
class TranslationAtomicityIntegrationTest {

    @Container
    static MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>("redis:7-alpine")
        .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", mysql::getJdbcUrl);
        registry.add("spring.datasource.username", mysql::getUsername);
        registry.add("spring.datasource.password", mysql::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");

        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", redis::getFirstMappedPort);
    }

    /**
     * 不連線 RocketMQ
     */
    @MockitoBean
    private DefaultMQProducer producer;

    @MockitoBean
    private Translator translator;

    @Autowired
    private UserService userService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private CreditService creditService;

    @Autowired
    private TranslationRequestProcessor processor;

    @Autowired
    private WalletRepository walletRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private TranslationRepository translationRepository;

    @BeforeEach
    void setUp() {
        when(translator.translate(anyString(), anyString(), anyString()))
            .thenThrow(new TranslationFailedException("Translation timed out after 2000 ms", null, true));
    }

    @Test
    @DisplayName("process - Translator fails on first access - Wallet is not created")
    void process_TranslatorFailsOnFirstAccess_LeavesNoWallet() {
        // Given: 使用者沒有錢包
        User user = userRepository.save(User.builder()
            .email("atomic-" + UUID.randomUUID() + "@example.com")
            .passwordHash("hash")
            .admin(false)
            .build());
        Long userId = user.getId();
        assertThat(walletRepository.findById(userId)).isEmpty();

        // When
        assertThatThrownBy(() -> processor.process(command(userId, "ext-" + UUID.randomUUID()),
                InsufficientFundsPolicy.LENIENT))
            .isInstanceOf(TranslationFailedException.class);

        // Then
        assertThat(walletRepository.findById(userId)).isEmpty();
        assertThat(transactionRepository.countByUserId(userId)).isZero();
        assertThat(translationRepository.countByUserId(userId)).isZero();
    }

    @Test
    @DisplayName("process - Translator fails with funded wallet - Balance, ledger and history unchanged")
    void process_TranslatorFailsWithFundedWallet_LeavesStateUnchanged() {
        // Given
        Long userId = userService.register("atomic-" + UUID.randomUUID() + "@example.com", "Secret123").getId();
        creditService.topUp(userId, 5L);
        String externalId = "ext-" + UUID.randomUUID();

        // When
        assertThatThrownBy(() -> processor.process(command(userId, externalId), InsufficientFundsPolicy.STRICT))
            .isInstanceOf(TranslationFailedException.class)
            .satisfies(e -> assertThat(((TranslationFailedException) e).isTimedOut()).isTrue());

        // Then
        assertThat(walletRepository.findById(userId).orElseThrow().getBalance()).isEqualTo(5L);
        assertThat(transactionRepository.countByUserIdAndType(userId, TransactionType.DEBIT)).isZero();
        assertThat(transactionRepository.countByUserId(userId)).isEqualTo(1);
        assertThat(translationRepository.countByUserId(userId)).isZero();
        assertThat(processor.findCompleted(externalId, userId)).isEmpty();
    }

    private TranslationCommand command(Long userId, String externalId) {
        return TranslationCommand.builder()
            .userId(userId)
            .inputText("hello")
            .sourceLang("en")
            .targetLang("fr")
            .externalId(externalId)
            .build();
    }
}

package com.aec.FileVault;

import com.aec.FileVault.support.InMemoryStorageConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(classes = FileVaultApplication.class)
@ActiveProfiles("test")
@Import(InMemoryStorageConfig.class)
class FileVaultApplicationTests {

    @Test
    void contextLoads() {
        // the application starts with the test profile
    }
}

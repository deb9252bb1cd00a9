package lab.swapdesk.config;

import lab.swapdesk.custody.FernetSecretCodec;
import lab.swapdesk.custody.SecretCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Required in every mode: the simulated wallets are encrypted with the same codec as real ones.
    @Bean
    public SecretCodec secretCodec(SwapDeskProperties properties) {
        String key = properties.getCustody().getEncryptionKey();
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("swapdesk.custody.encryption-key (SWAPDESK_ENCRYPTION_KEY) must be configured");
        }
        return new FernetSecretCodec(key);
    }
}

package com.phoenixdash.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.phoenixdash.common.config.ConfigService;
import com.phoenixdash.common.config.PhoenixDashConfig;
import com.phoenixdash.common.infra.SsrfGuard;
import com.phoenixdash.gateway.events.PaymentEventBus;
import com.phoenixdash.gateway.lnurl.LnurlPayResolver;
import com.phoenixdash.gateway.node.NodeConnectionRegistry;
import com.phoenixdash.gateway.phoenixd.PaymentGatewayFactory;
import com.phoenixdash.gateway.phoenixd.PhoenixdClient;
import com.phoenixdash.gateway.recurring.ContactService;
import com.phoenixdash.gateway.recurring.ExecutionLedger;
import com.phoenixdash.gateway.recurring.JsonFileExecutionLedger;
import com.phoenixdash.gateway.recurring.RecurringPaymentExecutor;
import com.phoenixdash.gateway.recurring.RecurringPaymentScheduler;
import com.phoenixdash.gateway.recurring.RecurringPaymentService;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Spring configuration for gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    static final String STORE_FILE_NAME = "recurring-store.json";

    @Value("${phoenixdash.config.path:~/.phoenixdash/config.json}")
    private String configPath;
    @Value("${phoenixdash.state.dir:~/.phoenixdash}")
    private String stateDir;

    @Bean
    public ConfigService configService() {
        return new ConfigService(expandHome(configPath));
    }

    @Bean
    public PhoenixDashConfig phoenixDashConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public NodeConnectionRegistry nodeConnectionRegistry(PhoenixDashConfig config) {
        return NodeConnectionRegistry.fromConfig(config.getPhoenixd());
    }

    @Bean
    public OkHttpClient phoenixdHttpClient(PhoenixDashConfig config) {
        PhoenixDashConfig.PhoenixdConfig phoenixd = config.getPhoenixd();
        return PhoenixdClient.newHttpClient(
                Duration.ofSeconds(phoenixd.getConnectTimeoutSeconds()),
                Duration.ofSeconds(phoenixd.getTimeoutSeconds()));
    }

    @Bean
    public OkHttpClient lnurlHttpClient(PhoenixDashConfig config) {
        Duration timeout = Duration.ofSeconds(config.getLnurl().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    @Bean
    public PaymentGatewayFactory paymentGatewayFactory(
            @Qualifier("phoenixdHttpClient") OkHttpClient httpClient, ObjectMapper objectMapper) {
        return connection -> new PhoenixdClient(httpClient, objectMapper, connection);
    }

    @Bean
    public LnurlPayResolver lnurlPayResolver(@Qualifier("lnurlHttpClient") OkHttpClient httpClient,
            ObjectMapper objectMapper, PhoenixDashConfig config) {
        PhoenixDashConfig.LnurlConfig lnurl = config.getLnurl();
        SsrfGuard.SsrfPolicy policy = lnurl.isAllowPrivateNetwork()
                ? SsrfGuard.SsrfPolicy.PERMISSIVE
                : SsrfGuard.SsrfPolicy.DEFAULT;
        return new LnurlPayResolver(httpClient, objectMapper, policy, lnurl.getScheme());
    }

    @Bean
    public PaymentEventBus paymentEventBus() {
        return new PaymentEventBus();
    }

    @Bean
    public ExecutionLedger executionLedger(PhoenixDashConfig config) {
        String store = config.getRecurring().getStore();
        Path storePath = store != null && !store.isBlank()
                ? expandHome(store)
                : expandHome(stateDir).resolve(STORE_FILE_NAME);
        return new JsonFileExecutionLedger(storePath);
    }

    @Bean
    public RecurringPaymentExecutor recurringPaymentExecutor(ExecutionLedger ledger, LnurlPayResolver resolver,
            PaymentEventBus eventBus, PhoenixDashConfig config) {
        return new RecurringPaymentExecutor(ledger, resolver, eventBus, config.getRecurring().isNotifyOnFailure());
    }

    @Bean
    public RecurringPaymentScheduler recurringPaymentScheduler(ExecutionLedger ledger,
            NodeConnectionRegistry connections, PaymentGatewayFactory gateways,
            RecurringPaymentExecutor executor, PhoenixDashConfig config) {
        return new RecurringPaymentScheduler(ledger, connections, gateways, executor,
                config.getRecurring().getItemDelayMs());
    }

    @Bean
    public RecurringPaymentService recurringPaymentService(ExecutionLedger ledger,
            NodeConnectionRegistry connections) {
        return new RecurringPaymentService(ledger, connections);
    }

    @Bean
    public ContactService contactService(ExecutionLedger ledger) {
        return new ContactService(ledger);
    }

    private static Path expandHome(String path) {
        String resolved = path;
        if (resolved.startsWith("~")) {
            resolved = System.getProperty("user.home") + resolved.substring(1);
        }
        return Path.of(resolved);
    }
}

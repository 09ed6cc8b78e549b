package lab.reconciler.adapter;

import lab.reconciler.config.ReconcilerProperties;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.Route;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One web3j client per configured chain, each with its own OkHttp timeouts so a slow node
 * only ever stalls its own scanner.
 */
@Configuration
@ConditionalOnProperty(prefix = "reconciler", name = "mode", havingValue = "rpc")
@Slf4j
public class EvmRpcConfig {

    @Bean
    public ChainAdapterRouter chainAdapterRouter(ReconcilerProperties properties) {
        List<ChainAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, ReconcilerProperties.ChainEntry> entry : properties.getChains().entrySet()) {
            Web3j web3j = web3j(entry.getKey(), entry.getValue());
            adapters.add(new EvmRpcAdapter(entry.getKey(), entry.getValue(), web3j));
            log.info("event=adapter.rpc.registered chain={} chainId={}", entry.getKey(), entry.getValue().getChainId());
        }
        return new ChainAdapterRouter(adapters);
    }

    static Web3j web3j(String chain, ReconcilerProperties.ChainEntry config) {
        String rpcUrl = config.getRpcUrl();
        OkHttpClient.Builder clientBuilder = new OkHttpClient.Builder()
                .connectTimeout(config.getRpcTimeout())
                .readTimeout(config.getRpcTimeout())
                .callTimeout(config.getRpcTimeout().multipliedBy(2));

        ReconcilerProperties.Proxy proxyConfig = config.getProxy();
        if (proxyConfig.isEnabled()) {
            if (proxyConfig.getHost() == null || proxyConfig.getHost().isBlank()) {
                throw new IllegalStateException("reconciler.chains." + chain + ".proxy.host must be configured when the proxy is enabled");
            }
            clientBuilder.proxy(new Proxy(Proxy.Type.HTTP, new InetSocketAddress(proxyConfig.getHost(), proxyConfig.getPort())));

            String proxyUsername = proxyConfig.getUsername();
            if (proxyUsername != null && !proxyUsername.isBlank()) {
                String proxyPassword = proxyConfig.getPassword();
                clientBuilder.proxyAuthenticator((Route route, Response response) -> {
                    String credential = okhttp3.Credentials.basic(proxyUsername, proxyPassword == null ? "" : proxyPassword);
                    Request request = response.request();
                    return request.newBuilder()
                            .header("Proxy-Authorization", credential)
                            .build();
                });
            }
        }
        return Web3j.build(new HttpService(rpcUrl, clientBuilder.build(), false));
    }
}

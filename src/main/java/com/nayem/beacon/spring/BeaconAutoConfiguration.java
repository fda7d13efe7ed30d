package com.nayem.beacon.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nayem.beacon.core.LockOptions;
import com.nayem.beacon.core.PubSubLockFactory;
import com.nayem.beacon.metrics.LockMetrics;
import com.nayem.beacon.pubsub.InMemoryPubSubBroker;
import com.nayem.beacon.pubsub.LettucePubSubConnection;
import com.nayem.beacon.pubsub.PubSubConnection;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

import java.util.List;
import java.util.function.Supplier;

@Configuration
@EnableAspectJAutoProxy
@EnableConfigurationProperties({ BeaconProperties.class, RedisProperties.class })
@ConditionalOnProperty(name = "beacon.enabled", havingValue = "true", matchIfMissing = true)
public class BeaconAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(BeaconAutoConfiguration.class);

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "beacon.store", havingValue = "redis", matchIfMissing = true)
    public RedisClient beaconRedisClient(BeaconProperties properties, RedisProperties redisProperties) {
        RedisURI uri = resolveRedisUri(properties, redisProperties);
        log.info("Beacon locks using Redis at {}:{}", uri.getHost(), uri.getPort());
        return LettucePubSubConnection.createClient(uri);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "beacon.store", havingValue = "memory")
    public InMemoryPubSubBroker inMemoryPubSubBroker() {
        return new InMemoryPubSubBroker();
    }

    @Bean
    @ConditionalOnMissingBean
    public LockMetrics lockMetrics(ObjectProvider<MeterRegistry> registryProvider) {
        return new LockMetrics(registryProvider.getIfAvailable());
    }

    // Closed by BeaconRegistry.
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public PubSubLockFactory pubSubLockFactory(BeaconProperties properties,
            ObjectProvider<RedisClient> redisClientProvider,
            ObjectProvider<InMemoryPubSubBroker> brokerProvider,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            LockMetrics lockMetrics) {

        String store = properties.getStore();
        Supplier<PubSubConnection> connectionSupplier = switch (store.toLowerCase()) {
            case "memory" -> {
                InMemoryPubSubBroker broker = brokerProvider.getIfAvailable();
                if (broker == null) {
                    throw new IllegalStateException("InMemoryPubSubBroker is required for the memory lock store");
                }
                yield broker::connect;
            }
            case "redis" -> {
                RedisClient client = redisClientProvider.getIfAvailable();
                if (client == null) {
                    throw new IllegalStateException("A Lettuce RedisClient is required for the redis lock store");
                }
                yield () -> new LettucePubSubConnection(client);
            }
            default -> throw new IllegalStateException("Unknown lock store '" + store + "'");
        };

        ObjectMapper mapper = objectMapperProvider.getIfAvailable();
        if (mapper == null) {
            mapper = new ObjectMapper();
        }

        LockOptions options = new LockOptions(
                properties.getTimeout(),
                properties.getCheckInterval(),
                properties.isFailWhenLocked(),
                properties.getThreadSleepTime(),
                properties.getUnavailableTimeout(),
                properties.getHealthCheckInterval(),
                properties.getThreadNamePrefix());

        return new PubSubLockFactory(connectionSupplier, properties.isSharedConnection(),
                properties.getChannelPrefix(), options, mapper, lockMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public DistributedLockAspect distributedLockAspect(PubSubLockFactory lockFactory) {
        return new DistributedLockAspect(lockFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public BeaconRegistry beaconRegistry(PubSubLockFactory lockFactory) {
        return new BeaconRegistry(List.of(lockFactory));
    }

    static RedisURI resolveRedisUri(BeaconProperties properties, RedisProperties redisProperties) {
        String uri = properties.getRedis().getUri();
        if (uri == null || uri.isBlank()) {
            uri = redisProperties.getUrl();
        }
        RedisURI redisUri;
        if (uri != null && !uri.isBlank()) {
            redisUri = RedisURI.create(uri);
        } else {
            RedisURI.Builder builder = RedisURI.builder()
                    .withHost(redisProperties.getHost())
                    .withPort(redisProperties.getPort())
                    .withDatabase(redisProperties.getDatabase())
                    .withSsl(redisProperties.getSsl().isEnabled());
            String password = redisProperties.getPassword();
            if (password != null) {
                if (redisProperties.getUsername() != null) {
                    builder.withAuthentication(redisProperties.getUsername(), password);
                } else {
                    builder.withPassword((CharSequence) password);
                }
            }
            redisUri = builder.build();
        }
        redisUri.setTimeout(properties.getRedis().getCommandTimeout());
        return redisUri;
    }
}

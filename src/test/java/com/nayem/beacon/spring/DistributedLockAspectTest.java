package com.nayem.beacon.spring;

import com.nayem.beacon.core.AlreadyLockedException;
import com.nayem.beacon.core.PubSubLock;
import com.nayem.beacon.core.PubSubLockFactory;
import com.nayem.beacon.pubsub.InMemoryPubSubBroker;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DistributedLockAspectTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(BeaconAutoConfiguration.class))
            .withUserConfiguration(ReportConfiguration.class)
            .withPropertyValues("beacon.store=memory", "beacon.channel-prefix=test:",
                    "beacon.check-interval=50ms", "beacon.thread-sleep-time=10ms",
                    "beacon.unavailable-timeout=20ms");

    @Test
    void annotatedMethodRunsWhileHoldingLock() {
        contextRunner.run(context -> {
            ReportService service = context.getBean(ReportService.class);
            InMemoryPubSubBroker broker = context.getBean(InMemoryPubSubBroker.class);

            int subscribersDuringCall = service.rebuild(() -> broker.subscriberCount("test:reports"));

            assertThat(subscribersDuringCall).isEqualTo(1);
            assertThat(broker.subscriberCount("test:reports")).isZero();
            assertThat(service.getRuns()).isEqualTo(1);
        });
    }

    @Test
    void heldLockRejectsFailFastMethod() {
        contextRunner.run(context -> {
            ReportService service = context.getBean(ReportService.class);
            PubSubLockFactory factory = context.getBean(PubSubLockFactory.class);

            try (PubSubLock lock = factory.create("reports")) {
                lock.acquire();
                assertThatThrownBy(service::rebuildIfFree).isInstanceOf(AlreadyLockedException.class);
            }
            assertThat(service.getRuns()).isZero();
        });
    }

    @Test
    void lockReleasedWhenMethodThrows() {
        contextRunner.run(context -> {
            ReportService service = context.getBean(ReportService.class);
            InMemoryPubSubBroker broker = context.getBean(InMemoryPubSubBroker.class);

            assertThatThrownBy(service::fail).isInstanceOf(IllegalStateException.class);
            assertThat(broker.subscriberCount("test:reports")).isZero();
        });
    }

    @Configuration
    static class ReportConfiguration {
        @Bean
        ReportService reportService() {
            return new ReportService();
        }
    }

    static class ReportService {
        private final AtomicInteger runs = new AtomicInteger();

        public int getRuns() {
            return runs.get();
        }

        @DistributedLocked("reports")
        public int rebuild(java.util.function.IntSupplier probe) {
            runs.incrementAndGet();
            return probe.getAsInt();
        }

        @DistributedLocked(value = "reports", failWhenLocked = true)
        public void rebuildIfFree() {
            runs.incrementAndGet();
        }

        @DistributedLocked(value = "reports", timeoutMillis = 200)
        public void fail() {
            throw new IllegalStateException("report failed");
        }
    }
}

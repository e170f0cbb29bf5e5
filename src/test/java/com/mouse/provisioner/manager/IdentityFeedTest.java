package com.mouse.provisioner.manager;

import com.mouse.provisioner.model.Identity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityFeedTest {

    @Test
    void handsOutIdentitiesInOrderThenRunsDry() {
        IdentityFeed feed = new IdentityFeed(List.of(new Identity("a@x.io", "p"), new Identity("b@x.io", "p")));

        assertThat(feed.next()).map(Identity::email).contains("a@x.io");
        assertThat(feed.remaining()).isEqualTo(1);
        assertThat(feed.next()).map(Identity::email).contains("b@x.io");
        assertThat(feed.next()).isEmpty();
        assertThat(feed.remaining()).isZero();
    }

    @Test
    void eachIdentityGoesToExactlyOneConcurrentCaller() throws Exception {
        List<Identity> identities = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            identities.add(new Identity("user" + i + "@x.io", "p"));
        }
        IdentityFeed feed = new IdentityFeed(identities);
        Set<String> seen = ConcurrentHashMap.newKeySet();
        List<String> duplicates = new java.util.concurrent.CopyOnWriteArrayList<>();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                while (true) {
                    var next = feed.next();
                    if (next.isEmpty()) {
                        return;
                    }
                    if (!seen.add(next.get().email())) {
                        duplicates.add(next.get().email());
                    }
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(duplicates).isEmpty();
        assertThat(seen).hasSize(1000);
    }
}

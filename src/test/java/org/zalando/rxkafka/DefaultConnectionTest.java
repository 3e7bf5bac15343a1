package org.zalando.rxkafka;

import static org.hamcrest.MatcherAssert.assertThat;

import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

import java.util.Map;
import java.util.Optional;

import org.junit.Rule;
import org.junit.Test;

import org.junit.rules.ExpectedException;

import org.zalando.rxkafka.conf.TopicConf;
import org.zalando.rxkafka.domain.ImmutableTopicMetadata;
import org.zalando.rxkafka.domain.TopicMetadata;

import com.google.common.collect.ImmutableMap;

import io.reactivex.observers.TestObserver;

public class DefaultConnectionTest {

    @Rule
    public ExpectedException expected = ExpectedException.none();

    private final DefaultConnection underTest = DefaultConnection.builder()         //
                                                                 .name("producer-1") //
                                                                 .topicDefault("acks", "1") //
                                                                 .build();

    @Test
    public void emitsStateTransitions() {
        final TestObserver<ConnectionState> observer = underTest.states().test();

        underTest.connect();
        underTest.connect();
        underTest.disconnect();
        underTest.close();
        underTest.close();

        observer.assertValues(ConnectionState.DISCONNECTED, ConnectionState.CONNECTED, ConnectionState.DISCONNECTED,
            ConnectionState.CLOSED);
        observer.assertComplete();
    }

    @Test
    public void lateSubscribersSeeCurrentState() {
        underTest.connect();

        underTest.states().test().assertValue(ConnectionState.CONNECTED).assertNotComplete();
        assertThat(underTest.isConnected(), is(true));
    }

    @Test
    public void cannotReconnectAfterClose() {
        underTest.close();

        expected.expect(IllegalStateException.class);
        underTest.connect();
    }

    @Test
    public void topicDefaultsAreSnapshots() {
        final Map<String, String> before = underTest.getTopicDefaults();

        underTest.setTopicDefault("partitioner", "random");
        underTest.removeTopicDefault("acks");

        assertThat(before, is(ImmutableMap.of("acks", "1")));
        assertThat(underTest.getTopicDefaults(), is(ImmutableMap.of("partitioner", "random")));
    }

    @Test
    public void createsDistinctHandles() {
        final TopicConf conf = TopicConf.create(ImmutableMap.of(), ImmutableMap.of());
        final TopicHandle first = underTest.createTopicHandle(TopicName.of("orders"), conf);
        final TopicHandle second = underTest.createTopicHandle(TopicName.of("orders"), conf);

        assertThat(first, is(not(second)));
        assertThat(first.getConnectionName(), is("producer-1"));
    }

    @Test
    public void noHandlesFromClosedConnection() {
        underTest.close();

        expected.expect(IllegalStateException.class);
        underTest.createTopicHandle(TopicName.of("orders"), TopicConf.create(ImmutableMap.of(), ImmutableMap.of()));
    }

    @Test
    public void keepsLatestMetadata() {
        final TopicMetadata metadata = ImmutableTopicMetadata.builder().topic("orders").build();
        underTest.updateMetadata(metadata);

        assertThat(underTest.getMetadata(TopicName.of("orders")), is(Optional.of(metadata)));
        assertThat(underTest.getMetadata(TopicName.of("payments")), is(Optional.empty()));
    }

    @Test
    public void requiresName() {
        expected.expect(IllegalStateException.class);
        DefaultConnection.builder().build();
    }
}

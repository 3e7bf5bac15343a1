package org.zalando.rxkafka.internal;

import static org.hamcrest.MatcherAssert.assertThat;

import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasProperty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;

import java.util.Optional;

import org.junit.Rule;
import org.junit.Test;

import org.junit.rules.ExpectedException;

import org.zalando.rxkafka.ConnectionNotReadyException;
import org.zalando.rxkafka.DefaultConnection;
import org.zalando.rxkafka.NotConnectedException;
import org.zalando.rxkafka.Topic;
import org.zalando.rxkafka.TopicConflictException;
import org.zalando.rxkafka.TopicDescriptor;
import org.zalando.rxkafka.TopicHandle;
import org.zalando.rxkafka.conf.InvalidConfigException;

import com.google.common.collect.ImmutableMap;

public class DefaultTopicRegistryTest {

    @Rule
    public ExpectedException expected = ExpectedException.none();

    private final DefaultTopicRegistry underTest = new DefaultTopicRegistry();

    private final DefaultConnection connA = DefaultConnection.builder().name("connA").build();
    private final DefaultConnection connB = DefaultConnection.builder().name("connB").build();

    @Test
    public void createsTopicOnConnectedConnection() {
        connA.connect();

        final Topic topic = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);

        assertThat(topic.name(), is("orders"));
        assertThat(topic.get("acks"), is(Optional.of("1")));
        assertThat(topic.get("missing"), is(Optional.empty()));
        assertThat(topic.toNativeHandle().getTopic().toString(), is("orders"));
    }

    @Test
    public void createsTopicLazilyOnDisconnectedConnection() {
        final Topic topic = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);

        assertThat(topic.name(), is("orders"));
        assertThat(topic.get("acks"), is(Optional.of("1")));

        expected.expect(NotConnectedException.class);
        topic.toNativeHandle();
    }

    @Test
    public void eagerValidationRequiresConnection() {
        expected.expect(allOf(                                 //
                instanceOf(ConnectionNotReadyException.class), //
                hasProperty("topic", is("orders"))));
        underTest.createTopic(TopicDescriptor.named("orders").validateEagerly().build(), connA);
    }

    @Test
    public void eagerValidationCreatesNativeHandle() {
        connA.connect();

        final DefaultTopic topic = (DefaultTopic) underTest.createTopic(
                TopicDescriptor.named("orders").validateEagerly().build(), connA);

        assertThat(topic.hasNativeHandle(), is(true));
    }

    @Test
    public void eagerRequestCreatesNativeHandleOfExistingTopic() {
        connA.connect();

        final DefaultTopic lazy = (DefaultTopic) underTest.createTopic("orders", ImmutableMap.of(), connA);
        assertThat(lazy.hasNativeHandle(), is(false));

        final Topic eager = underTest.createTopic(TopicDescriptor.named("orders").validateEagerly().build(), connA);

        assertThat(eager, is(sameInstance(lazy)));
        assertThat(lazy.hasNativeHandle(), is(true));
    }

    @Test
    public void nativeHandleFollowsConnectionState() {
        connA.connect();
        final Topic topic = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);
        final TopicHandle handle = topic.toNativeHandle();

        connA.disconnect();
        try {
            topic.toNativeHandle();
            throw new AssertionError("Expected NotConnectedException.");
        } catch (final NotConnectedException e) {
            assertThat(e.getTopic(), is("orders"));
        }

        assertThat(topic.name(), is("orders"));
        assertThat(topic.get("acks"), is(Optional.of("1")));

        connA.connect();
        assertThat(topic.toNativeHandle(), is(sameInstance(handle)));
    }

    @Test
    public void failedEagerValidationRegistersNothing() {
        try {
            underTest.createTopic(TopicDescriptor.named("orders").validateEagerly().build(), connA);
        } catch (final ConnectionNotReadyException e) {
            assertThat(underTest.topics(connA), is(empty()));
            return;
        }

        throw new AssertionError("Expected ConnectionNotReadyException.");
    }

    @Test
    public void rejectsEmptyName() {
        expected.expect(IllegalArgumentException.class);
        underTest.createTopic("", ImmutableMap.of(), connA);
    }

    @Test
    public void rejectsMalformedConfig() {
        expected.expect(InvalidConfigException.class);
        underTest.createTopic("orders", ImmutableMap.of("acks", "lots"), connA);
    }

    @Test
    public void coalescesEqualRequests() {
        final Topic first = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);
        final Topic second = underTest.createTopic("orders", ImmutableMap.of("request.required.acks", "1"), connA);

        assertThat(second, is(sameInstance(first)));
        assertThat(underTest.topics(connA), contains(first));
    }

    @Test
    public void rejectsDivergentConfig() {
        underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);

        expected.expect(allOf(                            //
                instanceOf(TopicConflictException.class), //
                hasProperty("existing", is(ImmutableMap.of("request.required.acks", "1"))), //
                hasProperty("requested", is(ImmutableMap.of("request.required.acks", "-1")))));
        underTest.createTopic("orders", ImmutableMap.of("acks", "-1"), connA);
    }

    @Test
    public void sameNameOnDifferentConnectionsYieldsDifferentTopics() {
        final Topic onA = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);
        final Topic onB = underTest.createTopic("orders", ImmutableMap.of("acks", "-1"), connB);

        assertThat(onB, is(not(sameInstance(onA))));
        assertThat(underTest.find(connA, "orders"), is(Optional.of(onA)));
        assertThat(underTest.find(connB, "orders"), is(Optional.of(onB)));
    }

    @Test
    public void releasedTopicIsForgotten() {
        final Topic first = underTest.createTopic("orders", ImmutableMap.of("acks", "1"), connA);
        first.release();

        assertThat(underTest.find(connA, "orders"), is(Optional.empty()));

        final Topic second = underTest.createTopic("orders", ImmutableMap.of("acks", "-1"), connA);
        assertThat(second, is(not(sameInstance(first))));
        assertThat(second.get("acks"), is(Optional.of("-1")));
    }

    @Test
    public void closingConnectionReleasesTopics() {
        connA.connect();
        connB.connect();

        final Topic orders = underTest.createTopic("orders", ImmutableMap.of(), connA);
        final Topic payments = underTest.createTopic("payments", ImmutableMap.of(), connA);
        final Topic other = underTest.createTopic("orders", ImmutableMap.of(), connB);

        connA.close();

        assertThat(orders.isReleased(), is(true));
        assertThat(payments.isReleased(), is(true));
        assertThat(other.isReleased(), is(false));
        assertThat(underTest.topics(connA), is(empty()));
        assertThat(underTest.topics(connB), contains(other));
    }

    @Test
    public void cannotCreateTopicOnClosedConnection() {
        connA.close();

        expected.expect(IllegalStateException.class);
        underTest.createTopic("orders", ImmutableMap.of(), connA);
    }

    @Test
    public void listsTopicsInCreationOrder() {
        final Topic payments = underTest.createTopic("payments", ImmutableMap.of(), connA);
        final Topic orders = underTest.createTopic("orders", ImmutableMap.of(), connA);

        assertThat(underTest.topics(connA), contains(payments, orders));
        assertThat(underTest.topics(connB), is(empty()));
    }
}

package org.zalando.rxkafka.inject.guice;

import javax.inject.Singleton;

import org.zalando.rxkafka.Connection;
import org.zalando.rxkafka.TopicFactory;
import org.zalando.rxkafka.TopicRegistry;
import org.zalando.rxkafka.inject.Kafka;
import org.zalando.rxkafka.internal.DefaultTopicFactory;
import org.zalando.rxkafka.internal.DefaultTopicRegistry;

import com.google.inject.PrivateModule;

/**
 * Provides bindings for {@link TopicRegistry} and {@link TopicFactory}.
 *
 * <p>Required dependencies:
 *
 * <dl>
 *   <dt>{@code @}{@link Kafka} {@link Connection}</dt>
 *   <dd>The connection on which the {@code TopicFactory} creates topics.</dd>
 * </dl>
 * </p>
 */
public final class RxKafkaModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(TopicRegistry.class).to(DefaultTopicRegistry.class).in(Singleton.class);
        expose(TopicRegistry.class);

        bind(TopicFactory.class).to(DefaultTopicFactory.class).in(Singleton.class);
        expose(TopicFactory.class);
    }
}

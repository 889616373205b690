package io.trigger4j.config;

import io.trigger4j.JobScheduler;
import io.trigger4j.cache.InMemoryTtlCache;
import io.trigger4j.cache.TtlCache;
import io.trigger4j.internal.InMemoryJobScheduler;
import io.trigger4j.internal.mongo.MongoEventStore;
import io.trigger4j.internal.mongo.MongoTriggerStore;
import io.trigger4j.internal.redis.RedisTtlCache;
import io.trigger4j.lifecycle.EventLifecycleManager;
import io.trigger4j.query.EventQueryService;
import io.trigger4j.registry.TriggerRegistry;
import io.trigger4j.store.EventStore;
import io.trigger4j.store.TriggerStore;
import io.trigger4j.utils.Trigger4jJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for trigger4j components.
 *
 * <p>Triggers and events are stored in MongoDB. The recent-events cache uses Redis when a
 * {@link RedisConnectionFactory} bean is present and a process-local cache otherwise.
 */
@AutoConfiguration(after = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class, RedisAutoConfiguration.class})
@ConditionalOnClass({TriggerRegistry.class, MongoTemplate.class})
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "trigger4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class Trigger4jAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(Trigger4jAutoConfiguration.class);

    public static final String CLOCK_BEAN = "trigger4jClock";

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "trigger4j")
    public Trigger4jProperties trigger4jProperties() {
        return new Trigger4jProperties();
    }

    @Bean
    @ConditionalOnMissingBean(name = CLOCK_BEAN)
    public Clock trigger4jClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerStore triggerStore(MongoTemplate mongoTemplate) {
        return new MongoTriggerStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(MongoTemplate mongoTemplate, MongoDatabaseFactory databaseFactory) {
        // sweep only, not registered as a bean
        TransactionTemplate sweepTransactions = new TransactionTemplate(new MongoTransactionManager(databaseFactory));
        return new MongoEventStore(mongoTemplate, sweepTransactions);
    }

    @Bean
    @ConditionalOnMissingBean
    protected Trigger4jMongoIndexConfig trigger4jMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new Trigger4jMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TtlCache trigger4jCache(ObjectProvider<RedisConnectionFactory> redisConnectionFactory, @Qualifier(CLOCK_BEAN) Clock clock) {
        RedisConnectionFactory factory = redisConnectionFactory.getIfUnique();
        if (factory != null) {
            log.info("trigger4j recent-events cache backed by Redis");
            return RedisTtlCache.create(factory);
        }
        log.info("trigger4j recent-events cache is process-local (no RedisConnectionFactory)");
        return new InMemoryTtlCache(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(Trigger4jProperties props, @Qualifier(CLOCK_BEAN) Clock clock) {
        return new InMemoryJobScheduler(props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerRegistry triggerRegistry(TriggerStore triggerStore,
                                           EventStore eventStore,
                                           JobScheduler jobScheduler,
                                           @Qualifier(CLOCK_BEAN) Clock clock) {
        return new TriggerRegistry(triggerStore, eventStore, jobScheduler, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventQueryService eventQueryService(EventStore eventStore,
                                               TtlCache cache,
                                               Trigger4jProperties props,
                                               @Qualifier(CLOCK_BEAN) Clock clock) {
        return new EventQueryService(eventStore, cache, Trigger4jJson.objectMapper(), props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventLifecycleManager eventLifecycleManager(EventStore eventStore,
                                                       EventQueryService eventQueryService,
                                                       Trigger4jProperties props,
                                                       @Qualifier(CLOCK_BEAN) Clock clock) {
        return new EventLifecycleManager(eventStore, eventQueryService, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public Trigger4jLifecycle trigger4jLifecycle(JobScheduler jobScheduler,
                                                 TriggerRegistry triggerRegistry,
                                                 EventLifecycleManager eventLifecycleManager) {
        return new Trigger4jLifecycle(jobScheduler, triggerRegistry, eventLifecycleManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "trigger4j", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton trigger4jIndexesInitializer(Trigger4jMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}

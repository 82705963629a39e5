package io.buddy4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.buddy4j.Buddy;
import io.buddy4j.GoalDecomposer;
import io.buddy4j.IntentClassifier;
import io.buddy4j.TaskHandler;
import io.buddy4j.core.PriorityScorer;
import io.buddy4j.core.dispatch.HandlerRegistry;
import io.buddy4j.internal.Supervisor;
import io.buddy4j.internal.file.JsonFileTaskStore;
import io.buddy4j.internal.mongo.MongoTaskStore;
import io.buddy4j.store.TaskStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for Buddy components.
 *
 * <p>The task store defaults to a JSON file at {@code buddy.storage-path}; {@code buddy.store=mongo}
 * switches to the MongoDB collection through the application's {@link MongoTemplate}.
 */
@AutoConfiguration
@ConditionalOnClass(Buddy.class)
@ConditionalOnProperty(prefix = "buddy", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BuddyConfig {

    @Bean
    @ConfigurationProperties(prefix = "buddy")
    public BuddyProperties buddyProperties() {
        return new BuddyProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock buddyClock(BuddyProperties props) {
        return Clock.system(props.sweepZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public PriorityScorer priorityScorer(Clock clock) {
        return new PriorityScorer(clock);
    }

    @Bean
    @ConditionalOnMissingBean(TaskStore.class)
    @ConditionalOnProperty(prefix = "buddy", name = "store", havingValue = "file", matchIfMissing = true)
    public JsonFileTaskStore jsonFileTaskStore(BuddyProperties props,
                                               ObjectProvider<ObjectMapper> objectMapperProvider,
                                               Clock clock,
                                               PriorityScorer scorer) {
        return new JsonFileTaskStore(Path.of(props.getStoragePath()),
                objectMapperProvider.getIfAvailable(ObjectMapper::new), clock, scorer);
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ObjectProvider<List<TaskHandler>> handlersProvider) {
        List<TaskHandler> handlers = handlersProvider.getIfAvailable(List::of);
        return new HandlerRegistry(handlers);
    }

    /**
     * Routes every untagged request to the default handler. Applications plug in a real classifier by
     * declaring their own {@link IntentClassifier} bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public IntentClassifier intentClassifier(BuddyProperties props) {
        return query -> props.getDefaultHandler();
    }

    /**
     * Proposes nothing, so complex goals use the built-in research / plan / execute split.
     */
    @Bean
    @ConditionalOnMissingBean
    public GoalDecomposer goalDecomposer() {
        return goal -> List.of();
    }

    @Bean
    @ConditionalOnMissingBean
    public Buddy buddy(BuddyProperties props,
                       TaskStore store,
                       HandlerRegistry registry,
                       IntentClassifier classifier,
                       GoalDecomposer decomposer,
                       PriorityScorer scorer,
                       Clock clock) {
        return new Supervisor(props, store, registry, classifier, decomposer, scorer, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public BuddyLifecycle buddyLifecycle(Buddy buddy, BuddyProperties props) {
        return new BuddyLifecycle(buddy, props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "buddy", name = "store", havingValue = "mongo")
    static class MongoStoreConfig {

        @Bean
        @ConditionalOnMissingBean(TaskStore.class)
        public MongoTaskStore mongoTaskStore(MongoTemplate mongoTemplate,
                                             ObjectProvider<ObjectMapper> objectMapperProvider,
                                             Clock clock,
                                             PriorityScorer scorer) {
            return new MongoTaskStore(mongoTemplate, objectMapperProvider.getIfAvailable(ObjectMapper::new), clock, scorer);
        }

        @Bean
        @ConditionalOnMissingBean
        public BuddyMongoIndexConfig buddyMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new BuddyMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "buddy", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton buddyIndexesInitializer(BuddyMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}

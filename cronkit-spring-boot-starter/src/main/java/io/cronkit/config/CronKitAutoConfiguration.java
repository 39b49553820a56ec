package io.cronkit.config;

import io.cronkit.AgentExecutor;
import io.cronkit.CronEventListener;
import io.cronkit.CronManager;
import io.cronkit.internal.DefaultCronManager;
import io.cronkit.internal.mongo.MongoIndexConfig;
import io.cronkit.internal.mongo.MongoJobStore;
import io.cronkit.store.FileJobStore;
import io.cronkit.store.InMemoryJobStore;
import io.cronkit.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;

/**
 * Spring Boot auto-configuration entrypoint for the cron scheduler.
 *
 * <p>The store is chosen by {@code cronkit.store.type}; an application-defined {@link JobStore} bean wins.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@EnableConfigurationProperties(CronKitProperties.class)
@ConditionalOnProperty(prefix = "cronkit", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CronKitAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    @ConditionalOnProperty(prefix = "cronkit.store", name = "type", havingValue = "file", matchIfMissing = true)
    public FileJobStore fileJobStore(CronKitProperties props) {
        return new FileJobStore(Path.of(props.getStore().getPath()), props.getMaxHistoryPerJob());
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    @ConditionalOnProperty(prefix = "cronkit.store", name = "type", havingValue = "memory")
    public InMemoryJobStore inMemoryJobStore(CronKitProperties props) {
        return new InMemoryJobStore(props.getMaxHistoryPerJob());
    }

    @Bean
    @ConditionalOnMissingBean
    public CronManager cronManager(CronKitProperties props,
                                   JobStore jobStore,
                                   ObjectProvider<AgentExecutor> agentExecutor,
                                   ObjectProvider<CronEventListener> listeners) {
        DefaultCronManager manager = new DefaultCronManager(jobStore, props);
        agentExecutor.ifAvailable(manager::setAgentExecutor);
        listeners.orderedStream().forEach(manager::addListener);
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public CronKitLifecycle cronKitLifecycle(CronManager cronManager, CronKitProperties props) {
        return new CronKitLifecycle(cronManager, props.isAutoStart());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoJobStore.class})
    @ConditionalOnProperty(prefix = "cronkit.store", name = "type", havingValue = "mongo")
    static class MongoStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(JobStore.class)
        @ConditionalOnBean(MongoTemplate.class)
        public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, CronKitProperties props) {
            return new MongoJobStore(mongoTemplate, props.getMaxHistoryPerJob());
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MongoTemplate.class)
        public MongoIndexConfig cronKitMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new MongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "cronkit.store.mongo", name = "ensure-indexes", havingValue = "true")
        public SmartInitializingSingleton cronKitIndexesInitializer(MongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
